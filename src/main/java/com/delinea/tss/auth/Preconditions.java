package com.delinea.tss.auth;

/**
 * Argument checks shared by the credential and configuration types.
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @return the value, unchanged
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String requireNonBlank(String value, String name) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return value;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Removes leading and trailing slashes so path segments can be joined with a single '/'.
     */
    public static String trimSlashes(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
