package com.missionguard.application;

import org.owasp.encoder.Encode;

/**
 * Escapes and truncates analyst-supplied text before it reaches a log line.
 */
public final class LogSafe {

    private static final int MAX_EXCERPT = 80;

    private LogSafe() {}

    public static String excerpt(String text) {
        if (text == null) {
            return "<null>";
        }
        String cut = text.length() > MAX_EXCERPT ? text.substring(0, MAX_EXCERPT) + "..." : text;
        return Encode.forJava(cut);
    }
}
