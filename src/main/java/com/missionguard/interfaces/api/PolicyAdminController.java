package com.missionguard.interfaces.api;

import com.missionguard.application.MissionGuardrailService;
import com.missionguard.interfaces.api.dto.ErrorResponse;
import com.missionguard.interfaces.api.dto.PolicyReloadResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Policy administration.
 */
@RestController
@RequestMapping("/api/v1/admin/policy")
@RequiredArgsConstructor
@Tag(name = "Policy administration", description = "Policy registry management")
public class PolicyAdminController {

    private final MissionGuardrailService service;

    @PostMapping(value = "/reload", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Reload policy",
        description = "Re-reads the policy configuration and swaps it in; the old policy stays active if the new one is invalid"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Version now in force",
            content = @Content(schema = @Schema(implementation = PolicyReloadResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "Configuration rejected",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PolicyReloadResponse> reload() {
        return ResponseEntity.ok(new PolicyReloadResponse(service.reloadPolicy()));
    }
}
