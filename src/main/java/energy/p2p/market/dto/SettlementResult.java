package energy.p2p.market.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a successful execution: both legs are executed and the seller was paid
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Settlement result")
public class SettlementResult {

    @Schema(description = "Order execution was requested for", example = "0")
    private Long orderId;

    @Schema(description = "Linked order executed together with it", example = "1")
    private Long counterpartOrderId;

    @Schema(description = "Paying participant", example = "alice")
    private String buyer;

    @Schema(description = "Paid participant", example = "bob")
    private String seller;

    @Schema(description = "Quantity x settlement price transferred to the seller", example = "4000")
    private long amountTransferred;

    @Schema(description = "Payment tendered by the buyer", example = "4001")
    private long paymentReceived;

    @Schema(description = "Part of the payment kept in market escrow (not refunded)", example = "1")
    private long retainedExcess;
}
