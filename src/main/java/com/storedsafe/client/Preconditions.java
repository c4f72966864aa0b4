package com.storedsafe.client;

/**
 * Argument checks shared by the client and lookup packages.
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
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return value;
    }

    /**
     * Validates that a count is at least one.
     *
     * @throws IllegalArgumentException if the value is zero or negative
     */
    public static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
