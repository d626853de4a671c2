package com.missionguard.infrastructure.upstream;

import com.missionguard.domain.model.DatasetProfile;

import java.util.List;

public interface DatasetProfileProvider {

    /**
     * @throws com.missionguard.application.exceptions.UpstreamUnavailableException when the profiler cannot be reached
     */
    List<DatasetProfile> getDatasetProfiles(String missionId);
}
