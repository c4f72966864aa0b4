package com.storedsafe.lookup;

/**
 * Log-safe rendering of tokens.
 */
final class Tokens {

    private static final int VISIBLE_PREFIX = 4;

    private Tokens() {
    }

    static String mask(String token) {
        if (token == null) {
            return "(none)";
        }
        if (token.length() <= VISIBLE_PREFIX * 2) {
            return "****";
        }
        return token.substring(0, VISIBLE_PREFIX) + "****";
    }
}
