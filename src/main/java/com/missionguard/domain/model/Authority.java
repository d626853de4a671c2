package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Legal or organizational mandate governing what a mission may do.
 *
 * <p>Immutable value object. A category is blocked under an authority whenever it is
 * not in {@link #getAllowedActionCategories()}; {@link #getBlockedActionCategories()}
 * is the published part of that complement and is what policy preambles list.
 *
 * @since 1.0.0
 */
@Value
public class Authority {

    String id;
    String displayName;
    String jurisdictionScope;
    Set<IntLane> allowedIntLanes;
    Set<IntLane> foundationalIntLanes;
    Set<IntLane> expectedIntLanes;
    Set<String> allowedActionCategories;
    Set<String> blockedActionCategories;
    String disclaimer;

    @Builder
    public Authority(
            String id,
            String displayName,
            String jurisdictionScope,
            Set<IntLane> allowedIntLanes,
            Set<IntLane> foundationalIntLanes,
            Set<IntLane> expectedIntLanes,
            Set<String> allowedActionCategories,
            Set<String> blockedActionCategories,
            String disclaimer) {

        this.id = Objects.requireNonNull(id, "Authority id must not be null");
        this.displayName = displayName != null ? displayName : id;
        this.jurisdictionScope = jurisdictionScope != null ? jurisdictionScope : "";
        this.allowedIntLanes = lanes(allowedIntLanes);
        this.foundationalIntLanes = lanes(foundationalIntLanes);
        this.expectedIntLanes = expectedIntLanes == null || expectedIntLanes.isEmpty()
            ? this.foundationalIntLanes
            : lanes(expectedIntLanes);
        this.allowedActionCategories = categories(allowedActionCategories);
        this.blockedActionCategories = categories(blockedActionCategories);
        this.disclaimer = disclaimer != null ? disclaimer : "";
    }

    public boolean allows(String actionCategory) {
        return allowedActionCategories.contains(actionCategory);
    }

    public boolean isBlocked(String actionCategory) {
        return !allows(actionCategory);
    }

    public boolean isFoundational(IntLane lane) {
        return foundationalIntLanes.contains(lane);
    }

    private static Set<IntLane> lanes(Set<IntLane> lanes) {
        if (lanes == null || lanes.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(IntLane.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(lanes));
    }

    // Declaration order is kept so preambles list categories the way policy authors wrote them.
    private static Set<String> categories(Set<String> categories) {
        if (categories == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(categories));
    }
}
