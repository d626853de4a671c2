package com.missionguard.domain.repository;

import com.missionguard.domain.model.Mission;

import java.util.Optional;

/**
 * Read access to missions owned by the external mission service.
 *
 * @since 1.0.0
 */
public interface MissionRepository {

    /**
     * @param missionId mission identifier
     * @return the mission, or empty when the mission service does not know it
     * @throws com.missionguard.application.exceptions.UpstreamUnavailableException when the service cannot be reached
     */
    Optional<Mission> findById(String missionId);
}
