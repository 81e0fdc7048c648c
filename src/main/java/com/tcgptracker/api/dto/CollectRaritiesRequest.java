package com.tcgptracker.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * DTO for collecting every card of some rarities in a set.
 */
@Data
public class CollectRaritiesRequest {

    @NotEmpty(message = "At least one rarity is required")
    private List<String> rarities;
}
