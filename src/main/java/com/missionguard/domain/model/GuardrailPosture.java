package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Summary of the policy a product was generated under.
 */
@Value
@Builder
public class GuardrailPosture {
    String authorityId;
    String disclaimer;
    List<String> blockedCategories;
    int screenedInputs;
    int degradedScreens;
    String registryVersion;
}
