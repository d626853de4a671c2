package com.missionguard.application.report;

import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.DataRequirement;
import com.missionguard.domain.model.SectionSpec;
import org.springframework.stereotype.Component;

/**
 * Builds section prompts: policy preamble, section fragment, the context slices the
 * section requires, then analyst instructions and section notes.
 */
@Component
public class PromptComposer {

    public String preamble(Authority authority) {
        StringBuilder preamble = new StringBuilder()
            .append("You are drafting an intelligence product under the authority of ")
            .append(authority.getDisplayName()).append(" (").append(authority.getId()).append(").\n");
        if (!authority.getDisclaimer().isBlank()) {
            preamble.append(authority.getDisclaimer().strip()).append('\n');
        }
        if (!authority.getBlockedActionCategories().isEmpty()) {
            preamble.append("Do not recommend, plan or describe actions in these categories: ")
                .append(String.join(", ", authority.getBlockedActionCategories()))
                .append(".\n");
        }
        preamble.append("Use only the evidence supplied below. Where evidence is missing, say so; do not invent facts.\n");
        return preamble.toString();
    }

    public String compose(Authority authority, SectionSpec section, ContextBundle context,
                          String instructions, String sectionNotes) {
        StringBuilder prompt = new StringBuilder(preamble(authority))
            .append("\nSection: ").append(section.getName()).append('\n')
            .append(section.getPromptFragment().strip()).append('\n');

        if (context.isPartial()) {
            prompt.append("\nNote: these sources were unavailable and the context is incomplete: ")
                .append(String.join(", ", context.unavailableSources()))
                .append(". State this limitation.\n");
        }
        for (DataRequirement requirement : section.getDataRequirements()) {
            String slice = context.slice(requirement);
            prompt.append('\n').append(requirement.name()).append(":\n")
                .append(slice.isEmpty() ? "None available." : slice).append('\n');
        }
        if (instructions != null && !instructions.isBlank()) {
            prompt.append("\nAnalyst instructions:\n").append(instructions.strip()).append('\n');
        }
        if (sectionNotes != null && !sectionNotes.isBlank()) {
            prompt.append("\nAnalyst notes for this section:\n").append(sectionNotes.strip()).append('\n');
        }
        return prompt.toString();
    }
}
