package com.missionguard.infrastructure.upstream;

import com.missionguard.application.exceptions.UpstreamUnavailableException;
import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.Mission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Fetches mission snapshots from the knowledge-graph service.
 */
@Component
@Slf4j
public class HttpKgSnapshotProvider implements KgSnapshotProvider {

    static final String SOURCE = "kg_snapshot";
    private static final int LIMIT_NODES = 400;
    private static final int LIMIT_EDGES = 800;

    private final RestTemplate kgRestTemplate;
    private final UpstreamCallSupport upstream;

    public HttpKgSnapshotProvider(@Qualifier("kgRestTemplate") RestTemplate kgRestTemplate, UpstreamCallSupport upstream) {
        this.kgRestTemplate = kgRestTemplate;
        this.upstream = upstream;
    }

    @Override
    public KgSnapshot getMissionKgSnapshot(Mission mission) {
        String projectId = mission.kgProjectId();
        if (log.isDebugEnabled()) {
            log.debug("Fetching KG snapshot: mission={}, project={}", mission.getId(), projectId);
        }
        KgSnapshot snapshot = upstream.call(SOURCE, () -> kgRestTemplate.getForObject(
            "/projects/{projectId}/snapshot?limitNodes={nodes}&limitEdges={edges}",
            KgSnapshot.class, projectId, LIMIT_NODES, LIMIT_EDGES));
        if (snapshot == null) {
            throw new UpstreamUnavailableException(SOURCE, "empty snapshot for project " + projectId);
        }
        return snapshot;
    }
}
