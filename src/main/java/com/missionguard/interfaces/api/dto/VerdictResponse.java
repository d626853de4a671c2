package com.missionguard.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.missionguard.domain.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerdictResponse {

    private String outcome;
    private String ruleId;
    private Boolean degraded;
    private String actionCategory;
    private String remediation;
    private String reason;

    public static VerdictResponse from(Verdict verdict) {
        return verdict.fold(
            allow -> VerdictResponse.builder()
                .outcome("ALLOW")
                .ruleId(allow.matchedRuleId())
                .degraded(allow.degraded())
                .build(),
            block -> VerdictResponse.builder()
                .outcome("BLOCK")
                .ruleId(block.ruleId())
                .actionCategory(block.actionCategory())
                .remediation(block.remediation())
                .reason(block.reason().name())
                .build());
    }
}
