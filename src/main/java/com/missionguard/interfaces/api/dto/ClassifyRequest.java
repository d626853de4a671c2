package com.missionguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free text to screen. Deliberately unconstrained: text the classifier cannot read is
 * let through flagged degraded rather than rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {
    private String text;
}
