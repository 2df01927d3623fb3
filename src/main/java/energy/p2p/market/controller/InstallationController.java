package energy.p2p.market.controller;

import energy.p2p.market.dto.ApiResponse;
import energy.p2p.market.dto.InstallationResponse;
import energy.p2p.market.dto.RegisterInstallationRequest;
import energy.p2p.market.service.InstallationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for generation installations
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/installations")
@Validated
@Tag(name = "Installations", description = "Register and query generation installations")
public class InstallationController {

    @Autowired
    private InstallationService installationService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Register an installation",
        description = "Requires a payment of at least capacity x unit rate, which is kept in market escrow"
    )
    public ApiResponse<InstallationResponse> registerInstallation(
            @Parameter(description = "Owning participant", required = true)
            @RequestHeader(OrderController.PARTICIPANT_HEADER) @NotBlank String participantId,
            @Valid @RequestBody RegisterInstallationRequest request) {

        log.info("Received register installation request: owner={}, request={}", participantId, request);

        InstallationResponse installation = installationService.registerInstallation(
                participantId, request.getCapacity(), request.getPayment());
        return ApiResponse.success("Installation registered", installation);
    }

    @GetMapping("/count")
    @Operation(summary = "Installation count")
    public ApiResponse<Long> getInstallationCount() {
        return ApiResponse.success(installationService.getInstallationCount());
    }

    @GetMapping("/{installationId}")
    @Operation(summary = "Query installation by ID", description = "Fails if no installed record exists for the ID")
    public ApiResponse<InstallationResponse> getInstallation(
            @Parameter(description = "Installation ID", required = true)
            @PathVariable @Min(0) long installationId) {
        return ApiResponse.success(installationService.getInstallation(installationId));
    }
}
