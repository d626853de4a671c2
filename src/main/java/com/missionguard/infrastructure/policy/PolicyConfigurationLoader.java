package com.missionguard.infrastructure.policy;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GuardrailRule;
import com.missionguard.domain.model.SectionSpec;
import com.missionguard.domain.model.Template;
import com.missionguard.domain.model.TriggerPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Reads the declarative policy YAML into a validated {@link PolicyRegistry}.
 *
 * <p>The registry version is taken from the file, or derived from a SHA-256 of its
 * bytes so that any edit yields a new version.
 */
@Component
@Slf4j
public class PolicyConfigurationLoader {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final ResourceLoader resourceLoader;
    private final EngineProperties properties;

    public PolicyConfigurationLoader(ResourceLoader resourceLoader, EngineProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public PolicyRegistry load() {
        String location = properties.getPolicy().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PolicyConfigException("Policy configuration not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            PolicyRegistry registry = parse(in.readAllBytes());
            log.info("Loaded policy {} from {}: {} authorities, {} rules, {} templates",
                registry.getVersion(), location,
                registry.getAuthorities().size(), registry.getRules().size(), registry.getTemplates().size());
            return registry;
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to read policy configuration from " + location, e);
        }
    }

    public PolicyRegistry parse(byte[] content) {
        PolicyDocument document;
        try {
            document = yaml.readValue(content, PolicyDocument.class);
        } catch (JacksonException e) {
            throw new PolicyConfigException("Malformed policy configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PolicyConfigException("Malformed policy configuration: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new PolicyConfigException("Policy configuration is empty");
        }

        try {
            List<Authority> authorities = document.getAuthorities().stream().map(this::toAuthority).toList();
            List<GuardrailRule> rules = new ArrayList<>();
            for (int i = 0; i < document.getRules().size(); i++) {
                rules.add(toRule(document.getRules().get(i), i));
            }
            List<Template> templates = document.getTemplates().stream().map(this::toTemplate).toList();

            String version = document.getVersion() != null && !document.getVersion().isBlank()
                ? document.getVersion()
                : digest(content);
            return PolicyRegistry.of(version, authorities, rules, templates);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new PolicyConfigException("Invalid policy configuration: " + e.getMessage(), e);
        }
    }

    private Authority toAuthority(PolicyDocument.AuthorityEntry entry) {
        return Authority.builder()
            .id(entry.getId())
            .displayName(entry.getDisplayName())
            .jurisdictionScope(entry.getJurisdictionScope())
            .allowedIntLanes(entry.getAllowedIntLanes())
            .foundationalIntLanes(entry.getFoundationalIntLanes())
            .expectedIntLanes(entry.getExpectedIntLanes())
            .allowedActionCategories(entry.getAllowedActionCategories())
            .blockedActionCategories(entry.getBlockedActionCategories())
            .disclaimer(entry.getDisclaimer())
            .build();
    }

    private GuardrailRule toRule(PolicyDocument.RuleEntry entry, int index) {
        List<TriggerPattern> triggers = new ArrayList<>();
        entry.getPhrases().forEach(phrase -> triggers.add(TriggerPattern.phrase(phrase)));
        entry.getCompounds().forEach(terms -> triggers.add(TriggerPattern.allOf(terms)));
        return GuardrailRule.builder()
            .id(entry.getId())
            .actionCategory(entry.getActionCategory())
            .triggers(triggers)
            .remediationTemplate(entry.getRemediation())
            .referTo(entry.getReferTo())
            .declarationIndex(index)
            .build();
    }

    private Template toTemplate(PolicyDocument.TemplateEntry entry) {
        List<SectionSpec> sections = entry.getSections().stream()
            .map(s -> SectionSpec.builder()
                .name(s.getName())
                .promptFragment(s.getPrompt())
                .dataRequirements(s.getDataRequirements())
                .fallbackText(s.getFallback())
                .build())
            .toList();
        return Template.builder()
            .id(entry.getId())
            .name(entry.getName())
            .priority(entry.getPriority())
            .requiredIntLanes(entry.getRequiredIntLanes())
            .expectedIntCoverage(entry.getExpectedIntCoverage())
            .allowedAuthorities(entry.getAllowedAuthorities())
            .sections(sections)
            .build();
    }

    private static String digest(byte[] content) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(content);
            return "sha256:" + HexFormat.of().formatHex(hash, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
