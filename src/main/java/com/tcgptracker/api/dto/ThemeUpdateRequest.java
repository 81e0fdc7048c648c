package com.tcgptracker.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for changing the theme preference.
 */
@Data
public class ThemeUpdateRequest {

    @NotBlank(message = "Theme is required")
    private String theme;
}
