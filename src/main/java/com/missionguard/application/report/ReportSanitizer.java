package com.missionguard.application.report;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips internal pipeline markers from generated text before it reaches a product.
 */
@Component
public class ReportSanitizer {

    private static final List<Pattern> MARKERS = List.of(
        Pattern.compile("(?:\\bfrom\\s+)?(?:\\bthe\\s+)?\\bagent\\s+run\\s+advisory\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:\\breferencing\\s+)?\\bevidence\\.[a-z_]+\\[\\d*\\]", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bevent\\s+id\\b(?:\\s*[#:]?\\s*[\\w-]*\\d[\\w-]*)?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:\\bin\\s+)?(?:\\bthe\\s+)?\\bprovided\\s+(?:json|context|mission(?:\\s+text)?)(?:\\s+(?:context|text|data))?\\b",
            Pattern.CASE_INSENSITIVE));

    private static final Pattern SPACE_RUNS = Pattern.compile("[ \\t]{2,}");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+([.,;:!?])");

    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String cleaned = text;
        for (Pattern marker : MARKERS) {
            cleaned = marker.matcher(cleaned).replaceAll("");
        }
        cleaned = SPACE_RUNS.matcher(cleaned).replaceAll(" ");
        cleaned = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("$1");
        return cleaned.strip();
    }
}
