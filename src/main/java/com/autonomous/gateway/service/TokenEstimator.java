package com.autonomous.gateway.service;

/**
 * Rough token counts for text when the provider does not report them.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static long estimate(String systemPrompt, String prompt) {
        return estimate(systemPrompt) + estimate(prompt);
    }
}
