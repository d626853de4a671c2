package com.missionguard.infrastructure.upstream;

import com.missionguard.domain.model.DatasetProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;

@Component
@Slf4j
public class HttpDatasetProfileProvider implements DatasetProfileProvider {

    static final String SOURCE = "dataset_profiles";

    private final RestTemplate profilesRestTemplate;
    private final UpstreamCallSupport upstream;

    public HttpDatasetProfileProvider(
            @Qualifier("profilesRestTemplate") RestTemplate profilesRestTemplate,
            UpstreamCallSupport upstream) {
        this.profilesRestTemplate = profilesRestTemplate;
        this.upstream = upstream;
    }

    @Override
    public List<DatasetProfile> getDatasetProfiles(String missionId) {
        DatasetProfile[] profiles = upstream.call(SOURCE, () -> profilesRestTemplate.getForObject(
            "/missions/{missionId}/datasets/profiles", DatasetProfile[].class, missionId));
        return profiles != null ? Arrays.asList(profiles) : List.of();
    }
}
