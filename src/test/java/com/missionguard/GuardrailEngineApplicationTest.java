package com.missionguard;

import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.KgEvent;
import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.MissionDocument;
import com.missionguard.domain.repository.MissionRepository;
import com.missionguard.infrastructure.upstream.DatasetProfileProvider;
import com.missionguard.infrastructure.upstream.GenerativeGateway;
import com.missionguard.infrastructure.upstream.KgSnapshotProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GuardrailEngineApplicationTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    MissionRepository missionRepository;

    @MockBean
    KgSnapshotProvider kgSnapshotProvider;

    @MockBean
    DatasetProfileProvider datasetProfileProvider;

    @MockBean
    GenerativeGateway generativeGateway;

    private final CountDownLatch release = new CountDownLatch(1);

    private final Mission title10 = TestFixtures.mission("m-t10", "TITLE_10", IntLane.SIGINT, IntLane.GEOINT)
        .documents(List.of(MissionDocument.builder().id("d1").title("Harbor report").excerpt("Two vessels berthed.").build()))
        .build();

    private final Mission leo = TestFixtures.mission("m-leo", "LEO", IntLane.LEO_CRIMINT, IntLane.OSINT).build();

    @BeforeEach
    void setUp() {
        when(missionRepository.findById("m-t10")).thenReturn(Optional.of(title10));
        when(missionRepository.findById("m-leo")).thenReturn(Optional.of(leo));
        when(kgSnapshotProvider.getMissionKgSnapshot(any(Mission.class))).thenReturn(KgSnapshot.builder()
            .projectId("mission-m-t10")
            .capturedAt(TestFixtures.day(11))
            .entities(List.of(KgEntity.builder().id("v1").name("MV Aurora").sourceIds(List.of("d1")).build()))
            .events(List.of(1, 2, 3, 8, 9, 10).stream()
                .map(day -> KgEvent.builder().id("ev" + day).title("Port call " + day)
                    .timestamp(TestFixtures.day(day).plus(Duration.ofHours(6))).build())
                .toList())
            .build());
        when(datasetProfileProvider.getDatasetProfiles(anyString())).thenReturn(List.of());
        when(generativeGateway.complete(anyString(), any(Duration.class))).thenReturn("Drafted section.");
    }

    @AfterEach
    void tearDown() {
        release.countDown();
    }

    @Test
    void arrestRequestUnderTitle10IsBlocked() throws Exception {
        mockMvc.perform(post("/api/v1/missions/m-t10/guardrail/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Recommend arrest and prosecution options for these individuals inside the U.S.\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("BLOCK"))
            .andExpect(jsonPath("$.actionCategory").value("domestic_arrest"));
    }

    @Test
    void militaryDeploymentUnderLawEnforcementIsBlocked() throws Exception {
        mockMvc.perform(post("/api/v1/missions/m-leo/guardrail/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Recommend deploying military forces to stabilise gang violence\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("BLOCK"))
            .andExpect(jsonPath("$.actionCategory").value("military_deployment"));
    }

    @Test
    void gapAnalysisReportsTheEmptyMiddleOfTheWindow() throws Exception {
        mockMvc.perform(post("/api/v1/missions/m-t10/gap-analysis").param("forceRegen", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.partial").value(false))
            .andExpect(jsonPath("$.findings[*].kind", hasItem("missing_time_window")));
    }

    @Test
    void timedOutSectionIsDegradedAndOthersRender() throws Exception {
        doAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return "too late";
        }).when(generativeGateway).complete(contains("Section: Timeline"), any(Duration.class));

        mockMvc.perform(post("/api/v1/missions/m-t10/reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"templateId\":\"situation_report\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PRODUCED"))
            .andExpect(jsonPath("$.sections[0].status").value("RENDERED"))
            .andExpect(jsonPath("$.sections[2].name").value("Timeline"))
            .andExpect(jsonPath("$.sections[2].status").value("DEGRADED"))
            .andExpect(jsonPath("$.sections[2].text").value("Timeline unavailable; see the knowledge graph event list."))
            .andExpect(jsonPath("$.degradedSections[0]").value("Timeline"))
            .andExpect(jsonPath("$.sections[3].status").value("RENDERED"));
    }

    @Test
    void templatesFollowAuthorityAndLanes() throws Exception {
        mockMvc.perform(get("/api/v1/missions/m-leo/templates"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("situation_report"))
            .andExpect(jsonPath("$[2].id").value("case_summary"));
    }
}
