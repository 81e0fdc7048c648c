package com.tcgptracker.web.controller;

import com.tcgptracker.admin.ProbabilitySumValidator;
import com.tcgptracker.admin.RarityProbabilityAdminService;
import com.tcgptracker.admin.RarityProbabilityForm;
import com.tcgptracker.admin.SlotFieldVisibility;
import com.tcgptracker.admin.SlotSumWarning;
import com.tcgptracker.catalog.Generation;
import com.tcgptracker.catalog.PackType;
import com.tcgptracker.catalog.RarityProbability;
import com.tcgptracker.common.exception.InvalidProbabilityException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog administration: sets, generations and rarity probabilities.
 */
@Controller
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final RarityProbabilityAdminService adminService;
    private final ProbabilitySumValidator sumValidator;

    @GetMapping
    public String index(Model model) {
        Map<String, List<PackType>> packTypes = new LinkedHashMap<>();
        List<Generation> generations = adminService.getGenerations();
        generations.forEach(g -> packTypes.put(g.getName(), adminService.getPackTypes(g.getName())));

        model.addAttribute("sets", adminService.getSets());
        model.addAttribute("today", LocalDate.now());
        model.addAttribute("generations", generations);
        model.addAttribute("packTypes", packTypes);
        return "admin/index";
    }

    @GetMapping("/generations/{generation}/probabilities")
    public String probabilities(@PathVariable String generation, Model model) {
        model.addAttribute("generation", adminService.getGeneration(generation));
        model.addAttribute("probabilities", adminService.getProbabilities(generation));
        model.addAttribute("warnings", sumValidator.validate(generation));
        return "admin/probabilities";
    }

    @GetMapping("/generations/{generation}/probabilities/new")
    public String newProbability(@PathVariable String generation, Model model) {
        return showForm(generation, new RarityProbabilityForm(), model);
    }

    @GetMapping("/probabilities/{id}/edit")
    public String editProbability(@PathVariable Long id, Model model) {
        RarityProbability row = adminService.getProbability(id);
        return showForm(row.getGeneration().getName(), RarityProbabilityForm.from(row), model);
    }

    @PostMapping("/generations/{generation}/probabilities")
    public String saveProbability(@PathVariable String generation,
                                  @Valid @ModelAttribute("form") RarityProbabilityForm form,
                                  BindingResult bindingResult,
                                  Model model,
                                  RedirectAttributes redirectAttributes) {
        if (bindingResult.hasErrors()) {
            return showForm(generation, form, model);
        }
        try {
            adminService.save(generation, form);
        } catch (InvalidProbabilityException e) {
            bindingResult.reject("probability", e.getMessage());
            return showForm(generation, form, model);
        }

        List<SlotSumWarning> warnings = sumValidator.validate(generation);
        redirectAttributes.addFlashAttribute("message", "Rarity probability saved.");
        redirectAttributes.addFlashAttribute("warningMessages",
            warnings.stream().map(SlotSumWarning::getMessage).toList());
        redirectAttributes.addAttribute("generation", generation);
        return "redirect:/admin/generations/{generation}/probabilities";
    }

    private String showForm(String generationName, RarityProbabilityForm form, Model model) {
        List<PackType> packTypes = adminService.getPackTypes(generationName).stream()
            .filter(pt -> !pt.isGodPack())
            .toList();
        int slotCount = packTypes.stream()
            .filter(pt -> pt.getId().equals(form.getPackTypeId()))
            .findFirst()
            .map(PackType::getSlotCount)
            .orElse(SlotFieldVisibility.OPTIONAL_SLOT_ROWS);

        model.addAttribute("generation", adminService.getGeneration(generationName));
        model.addAttribute("form", form);
        model.addAttribute("packTypes", packTypes);
        model.addAttribute("rarities", adminService.getRarities());
        model.addAttribute("visibleSlotRows", SlotFieldVisibility.visibleRows(slotCount));
        return "admin/probability_form";
    }
}
