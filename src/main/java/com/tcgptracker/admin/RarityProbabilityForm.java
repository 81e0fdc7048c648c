package com.tcgptracker.admin;

import com.tcgptracker.catalog.RarityProbability;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Form backing the rarity probability create/edit page.
 */
@Data
@NoArgsConstructor
public class RarityProbabilityForm {

    private Long id;

    @NotNull(message = "Pack type is required")
    private Long packTypeId;

    @NotBlank(message = "Rarity is required")
    private String rarityName;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probabilitySlot1 = 0.0;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probabilitySlot2 = 0.0;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probabilitySlot3 = 0.0;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probabilitySlot4 = 0.0;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probabilitySlot5 = 0.0;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probabilitySlot6 = 0.0;

    public static RarityProbabilityForm from(RarityProbability row) {
        RarityProbabilityForm form = new RarityProbabilityForm();
        form.setId(row.getId());
        form.setPackTypeId(row.getPackType().getId());
        form.setRarityName(row.getRarity().getName());
        form.setProbabilitySlot1(row.getSlot1());
        form.setProbabilitySlot2(row.getSlot2());
        form.setProbabilitySlot3(row.getSlot3());
        form.setProbabilitySlot4(row.getSlot4());
        form.setProbabilitySlot5(row.getSlot5());
        form.setProbabilitySlot6(row.getSlot6());
        return form;
    }

    public List<Double> getSlotProbabilities() {
        return Arrays.asList(probabilitySlot1, probabilitySlot2, probabilitySlot3,
            probabilitySlot4, probabilitySlot5, probabilitySlot6);
    }
}
