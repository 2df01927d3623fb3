package energy.p2p.market.controller;

import energy.p2p.market.dto.ApiResponse;
import energy.p2p.market.dto.LedgerBalanceResponse;
import energy.p2p.market.service.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for the escrow ledger
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ledger")
@Validated
@Tag(name = "Ledger", description = "Escrow and participant balances")
public class LedgerController {

    @Autowired
    private LedgerService ledgerService;

    @GetMapping("/escrow")
    @Operation(
        summary = "Market escrow balance",
        description = "Value held by the market: over-payments, installation fees and payments stranded by failed transfers"
    )
    public ApiResponse<LedgerBalanceResponse> getEscrowBalance() {
        return ApiResponse.success(ledgerService.getEscrowBalance());
    }

    @GetMapping("/accounts/{participantId}")
    @Operation(summary = "Participant balance", description = "Value credited to a participant by settlements")
    public ApiResponse<LedgerBalanceResponse> getBalance(
            @Parameter(description = "Participant", required = true)
            @PathVariable @NotBlank String participantId) {
        log.debug("Getting balance: participantId={}", participantId);
        return ApiResponse.success(ledgerService.getBalance(participantId));
    }

    @PutMapping("/accounts/{participantId}/rejecting")
    @Operation(
        summary = "Set incoming transfer policy",
        description = "A participant that rejects incoming transfers makes settlements paying it fail"
    )
    public ApiResponse<LedgerBalanceResponse> setRejectsIncoming(
            @Parameter(description = "Participant", required = true)
            @PathVariable @NotBlank String participantId,
            @Parameter(description = "true to reject incoming transfers", required = true)
            @RequestParam boolean rejecting) {
        log.info("Received incoming transfer policy update: participantId={}, rejecting={}", participantId, rejecting);
        return ApiResponse.success("Account updated", ledgerService.setRejectsIncoming(participantId, rejecting));
    }
}
