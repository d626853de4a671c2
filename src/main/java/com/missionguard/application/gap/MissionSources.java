package com.missionguard.application.gap;

import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.KgSnapshot;

import java.util.List;

/**
 * Upstream data fetched for one mission. A null source was unavailable and is named
 * in {@code unavailableSources}.
 */
public record MissionSources(KgSnapshot kgSnapshot, List<DatasetProfile> datasetProfiles,
                             List<String> unavailableSources) {

    public MissionSources {
        datasetProfiles = datasetProfiles != null ? List.copyOf(datasetProfiles) : null;
        unavailableSources = unavailableSources != null ? List.copyOf(unavailableSources) : List.of();
    }

    public static MissionSources complete(KgSnapshot kgSnapshot, List<DatasetProfile> datasetProfiles) {
        return new MissionSources(kgSnapshot, datasetProfiles, List.of());
    }

    public boolean hasKg() {
        return kgSnapshot != null;
    }

    public boolean hasDatasetProfiles() {
        return datasetProfiles != null;
    }

    public boolean isPartial() {
        return !unavailableSources.isEmpty();
    }

    public String kgSnapshotRef() {
        return kgSnapshot != null ? kgSnapshot.reference() : null;
    }

    public List<String> datasetProfileRefs() {
        return datasetProfiles != null
            ? datasetProfiles.stream().map(DatasetProfile::reference).toList()
            : List.of();
    }
}
