package com.tcgptracker.web;

import com.tcgptracker.config.TrackerProperties;
import com.tcgptracker.theme.ThemeService;
import com.tcgptracker.theme.ThemeSettings;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ModelAttribute;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes every page template needs: build revision, theme and UI settings.
 */
@ControllerAdvice(basePackages = "com.tcgptracker.web")
@RequiredArgsConstructor
public class SiteModelAdvice {

    private final ThemeService themeService;
    private final TrackerProperties properties;

    @ModelAttribute
    public void addSiteAttributes(Model model, HttpServletRequest request, HttpServletResponse response) {
        model.addAllAttributes(siteAttributes(request, response));
    }

    public Map<String, Object> siteAttributes(HttpServletRequest request, HttpServletResponse response) {
        themeService.requestColorSchemeHint(response);
        ThemeSettings theme = themeService.resolve(request);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("gitHash", properties.getGitHash());
        attributes.put("theme", theme);
        attributes.put("ui", properties.getUi());
        return attributes;
    }
}
