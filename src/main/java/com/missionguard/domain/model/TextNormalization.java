package com.missionguard.domain.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form used for guardrail matching: case-folded, punctuation replaced by
 * spaces, whitespace collapsed.
 */
public final class TextNormalization {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextNormalization() {}

    public static String normalize(String text) {
        String folded = text.toLowerCase(Locale.ROOT);
        return NON_WORD.matcher(folded).replaceAll(" ").trim();
    }
}
