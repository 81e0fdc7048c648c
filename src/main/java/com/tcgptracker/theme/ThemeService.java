package com.tcgptracker.theme;

import com.tcgptracker.config.TrackerProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Optional;

/**
 * Reads and stores theme preferences.
 *
 * The preference lives in a cookie; the system colour scheme comes from the
 * {@code Sec-CH-Prefers-Color-Scheme} client hint, which browsers send once the
 * server has asked for it with {@code Accept-CH}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThemeService {

    public static final String COLOR_SCHEME_HINT = "Sec-CH-Prefers-Color-Scheme";

    private final TrackerProperties properties;

    public ThemeSettings resolve(HttpServletRequest request) {
        ThemePreference preference = readPreference(request).orElse(ThemePreference.DEFAULT);
        return ThemeSettings.of(preference, systemPrefersDark(request));
    }

    /**
     * Whether the request carried a stored preference at all.
     */
    public boolean hasStoredPreference(HttpServletRequest request) {
        return readPreference(request).isPresent();
    }

    public void store(ThemePreference preference, HttpServletResponse response) {
        Cookie cookie = new Cookie(properties.getTheme().getCookieName(), preference.getValue());
        cookie.setMaxAge(properties.getTheme().getCookieMaxAgeSeconds());
        cookie.setPath("/");
        cookie.setHttpOnly(false);
        response.addCookie(cookie);
        log.debug("Stored theme preference {}", preference.getValue());
    }

    /**
     * Ask the browser to send the colour scheme client hint on subsequent requests.
     */
    public void requestColorSchemeHint(HttpServletResponse response) {
        response.setHeader("Accept-CH", COLOR_SCHEME_HINT);
        response.addHeader("Vary", COLOR_SCHEME_HINT);
    }

    private Optional<ThemePreference> readPreference(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
            .filter(c -> properties.getTheme().getCookieName().equals(c.getName()))
            .findFirst()
            .flatMap(c -> ThemePreference.fromValue(c.getValue()));
    }

    private static boolean systemPrefersDark(HttpServletRequest request) {
        String hint = request.getHeader(COLOR_SCHEME_HINT);
        if (hint == null) {
            return false;
        }
        return "dark".equalsIgnoreCase(hint.replace("\"", "").trim());
    }
}
