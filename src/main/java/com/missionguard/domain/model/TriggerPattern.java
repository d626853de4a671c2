package com.missionguard.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A guardrail trigger: a single phrase, or a compound whose terms must all occur
 * somewhere in the request.
 *
 * <p>Terms are matched against normalized text at word starts, and the last word of a
 * term may be extended, so {@code deploy} matches {@code deploying}. The span of a
 * match is the number of characters matched across all terms.
 */
@Getter
@EqualsAndHashCode(of = "terms")
public final class TriggerPattern {

    private final List<String> terms;
    private final List<Pattern> compiled;

    private TriggerPattern(List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Trigger must have at least one term");
        }
        List<String> normalized = new ArrayList<>(terms.size());
        List<Pattern> patterns = new ArrayList<>(terms.size());
        for (String term : terms) {
            String n = TextNormalization.normalize(Objects.requireNonNull(term, "Trigger term must not be null"));
            if (n.isEmpty()) {
                throw new IllegalArgumentException("Trigger term normalizes to an empty string: '" + term + "'");
            }
            normalized.add(n);
            patterns.add(Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(n) + "[\\p{L}\\p{N}]*"));
        }
        this.terms = List.copyOf(normalized);
        this.compiled = List.copyOf(patterns);
    }

    public static TriggerPattern phrase(String phrase) {
        return new TriggerPattern(List.of(phrase));
    }

    public static TriggerPattern allOf(List<String> terms) {
        return new TriggerPattern(terms);
    }

    public boolean isCompound() {
        return terms.size() > 1;
    }

    /**
     * @param normalizedText text already passed through {@link TextNormalization#normalize}
     * @return matched span in characters, or 0 when any term is absent
     */
    public int matchSpan(String normalizedText) {
        int span = 0;
        for (Pattern pattern : compiled) {
            Matcher matcher = pattern.matcher(normalizedText);
            if (!matcher.find()) {
                return 0;
            }
            span += matcher.end() - matcher.start();
        }
        return span;
    }

    @Override
    public String toString() {
        return isCompound() ? "all" + terms : terms.get(0);
    }
}
