package com.missionguard.infrastructure.persistence;

import com.missionguard.application.exceptions.UpstreamUnavailableException;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.repository.MissionRepository;
import com.missionguard.infrastructure.upstream.UpstreamCallSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Reads missions from the mission service over HTTP.
 */
@Repository
@Slf4j
public class RemoteMissionRepository implements MissionRepository {

    private static final String SOURCE = "mission_service";

    private final RestTemplate missionsRestTemplate;
    private final UpstreamCallSupport upstream;

    public RemoteMissionRepository(
            @Qualifier("missionsRestTemplate") RestTemplate missionsRestTemplate,
            UpstreamCallSupport upstream) {
        this.missionsRestTemplate = missionsRestTemplate;
        this.upstream = upstream;
    }

    @Override
    public Optional<Mission> findById(String missionId) {
        try {
            return Optional.ofNullable(upstream.call(SOURCE, () ->
                missionsRestTemplate.getForObject("/missions/{id}", Mission.class, missionId)));
        } catch (UpstreamUnavailableException e) {
            if (e.getCause() instanceof HttpClientErrorException.NotFound) {
                log.debug("Mission {} not known to mission service", missionId);
                return Optional.empty();
            }
            throw e;
        }
    }
}
