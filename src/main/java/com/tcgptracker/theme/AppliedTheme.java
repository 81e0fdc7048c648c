package com.tcgptracker.theme;

/**
 * The theme actually applied to the document as its {@code data-theme} attribute.
 */
public enum AppliedTheme {
    LIGHT("light"),
    DARK("dark");

    private final String attribute;

    AppliedTheme(String attribute) {
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
