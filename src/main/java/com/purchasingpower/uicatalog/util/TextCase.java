package com.purchasingpower.uicatalog.util;

/**
 * Letter-case helpers for component names.
 *
 * <p>A character is "cased" when it is an upper- or lower-case letter. The
 * predicates need at least one cased character, so digits and separators alone
 * are neither upper nor lower case.
 */
public final class TextCase {

    private TextCase() {
    }

    /**
     * Upper-cases the first cased character of every run of cased characters and
     * lower-cases the rest. "nav-item" becomes "Nav-Item", "2col" becomes "2Col".
     */
    public static String titleCase(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean previousCased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isCased(c)) {
                result.append(previousCased ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousCased = true;
            } else {
                result.append(c);
                previousCased = false;
            }
        }
        return result.toString();
    }

    public static boolean isAllUpper(String text) {
        boolean sawCased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            sawCased |= Character.isUpperCase(c);
        }
        return sawCased;
    }

    public static boolean isAllLower(String text) {
        boolean sawCased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isUpperCase(c)) {
                return false;
            }
            sawCased |= Character.isLowerCase(c);
        }
        return sawCased;
    }

    /**
     * True when any character after the first is upper case.
     */
    public static boolean hasInnerUpper(String text) {
        for (int i = 1; i < text.length(); i++) {
            if (Character.isUpperCase(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCased(char c) {
        return Character.isUpperCase(c) || Character.isLowerCase(c) || Character.isTitleCase(c);
    }
}
