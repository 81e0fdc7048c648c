package com.tcgptracker.table;

/**
 * Parsing of printed card numbers.
 */
final class CardNumbers {

    private CardNumbers() {
    }

    /**
     * Parse the integer at the start of the trimmed text ("007" is 7, "12a" is 12).
     * Text without leading digits, or a number too large for an int, yields 0.
     */
    static int parseLeadingInt(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        int start = 0;
        boolean negative = false;
        if (!trimmed.isEmpty() && (trimmed.charAt(0) == '-' || trimmed.charAt(0) == '+')) {
            negative = trimmed.charAt(0) == '-';
            start = 1;
        }
        int end = start;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
            end++;
        }
        if (end == start) {
            return 0;
        }
        try {
            int value = Integer.parseInt(trimmed.substring(start, end));
            return negative ? -value : value;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
