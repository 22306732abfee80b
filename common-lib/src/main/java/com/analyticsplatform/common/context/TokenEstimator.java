package com.analyticsplatform.common.context;

/** Rough token count: one token per four characters, rounded up. */
public final class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
