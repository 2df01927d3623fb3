package energy.p2p.market.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger balance DTO, used for participant accounts and for market escrow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ledger balance")
public class LedgerBalanceResponse {

    @Schema(description = "Participant identity, or 'escrow' for value held by the market", example = "bob")
    private String account;

    @Schema(description = "Balance", example = "4000")
    private long balance;

    @Schema(description = "Whether the account refuses incoming transfers", example = "false")
    private boolean rejectsIncoming;
}
