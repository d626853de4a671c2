package com.missionguard.interfaces.api;

import com.missionguard.application.MissionGuardrailService;
import com.missionguard.application.report.ReportRequest;
import com.missionguard.domain.model.ReportOutcome;
import com.missionguard.domain.model.Verdict;
import com.missionguard.interfaces.api.dto.ClassifyRequest;
import com.missionguard.interfaces.api.dto.ErrorResponse;
import com.missionguard.interfaces.api.dto.GapAnalysisResponse;
import com.missionguard.interfaces.api.dto.GenerateReportRequest;
import com.missionguard.interfaces.api.dto.ReportResponse;
import com.missionguard.interfaces.api.dto.TemplateResponse;
import com.missionguard.interfaces.api.dto.VerdictResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for mission guardrail and intelligence product operations.
 *
 * Provides endpoints for:
 * - Screening analyst requests against the mission's authority
 * - Listing report templates the mission may use
 * - Running gap analysis
 * - Generating multi-section reports
 *
 * A guardrail block is a normal outcome: it is returned with HTTP 200 and a
 * BLOCK / BLOCKED status, never as an error.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/missions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Missions", description = "Guardrail screening, templates, gap analysis and reports")
public class MissionIntelController {

    private final MissionGuardrailService service;

    @PostMapping(
        value = "/{missionId}/guardrail/classify",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Classify a request",
        description = "Screens free text against the mission authority's guardrail rules"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Verdict (ALLOW or BLOCK)",
            content = @Content(schema = @Schema(implementation = VerdictResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Mission not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<VerdictResponse> classify(
            @PathVariable String missionId,
            @RequestBody ClassifyRequest request) {

        Verdict verdict = service.classifyRequest(request.getText(), missionId);
        return ResponseEntity.ok(VerdictResponse.from(verdict));
    }

    @GetMapping(value = "/{missionId}/templates", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "List templates",
        description = "Templates selectable under the mission's authority and INT coverage, in display order"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Selectable templates"),
        @ApiResponse(
            responseCode = "404",
            description = "Mission not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "Mission authority is not configured",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<List<TemplateResponse>> listTemplates(@PathVariable String missionId) {
        return ResponseEntity.ok(service.listTemplates(missionId).stream()
            .map(TemplateResponse::from)
            .toList());
    }

    @PostMapping(value = "/{missionId}/gap-analysis", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Run gap analysis",
        description = "Returns the stored analysis unless forceRegen is set; partial when a source was unavailable"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Gap analysis result",
            content = @Content(schema = @Schema(implementation = GapAnalysisResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Mission or template not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<GapAnalysisResponse> runGapAnalysis(
            @PathVariable String missionId,
            @Parameter(description = "Template whose INT coverage expectation applies")
            @RequestParam(required = false) String templateId,
            @RequestParam(defaultValue = "false") boolean forceRegen) {

        return ResponseEntity.ok(GapAnalysisResponse.from(
            service.runGapAnalysis(missionId, templateId, forceRegen)));
    }

    @PostMapping(
        value = "/{missionId}/reports",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Generate report",
        description = "Synthesizes a report from the template; BLOCKED when analyst text is outside the authority's lane"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Report produced or blocked",
            content = @Content(schema = @Schema(implementation = ReportResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Template not eligible for this mission",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Mission or template not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ReportResponse> generateReport(
            @PathVariable String missionId,
            @Valid @RequestBody GenerateReportRequest request) {

        ReportOutcome outcome = service.generateReport(ReportRequest.builder()
            .missionId(missionId)
            .templateId(request.getTemplateId())
            .instructions(request.getInstructions())
            .sectionNotes(request.getSectionNotes() != null ? request.getSectionNotes() : Map.of())
            .build());

        if (log.isInfoEnabled()) {
            log.info("Report {} for mission {}: {}", request.getTemplateId(), missionId,
                outcome.fold(p -> "produced", b -> "blocked"));
        }
        return ResponseEntity.ok(ReportResponse.from(outcome));
    }
}
