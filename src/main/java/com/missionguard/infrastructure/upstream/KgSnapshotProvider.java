package com.missionguard.infrastructure.upstream;

import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.Mission;

/**
 * Knowledge-graph snapshot source.
 */
public interface KgSnapshotProvider {

    /**
     * @param mission mission whose KG project ({@link Mission#kgProjectId()}) is extracted
     * @throws com.missionguard.application.exceptions.UpstreamUnavailableException when the KG cannot be reached
     */
    KgSnapshot getMissionKgSnapshot(Mission mission);
}
