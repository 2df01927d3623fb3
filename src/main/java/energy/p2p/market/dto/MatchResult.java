package energy.p2p.market.dto;

import energy.p2p.market.domain.Order;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a match attempt for one buy order.
 * When no sell order qualified, only buyOrderId is set and matched is false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Match attempt result")
public class MatchResult {

    @Schema(description = "Buy order the match was attempted for", example = "0")
    private Long buyOrderId;

    @Schema(description = "Whether a sell order was found", example = "true")
    private boolean matched;

    @Schema(description = "Matched sell order", example = "1")
    private Long sellOrderId;

    @Schema(description = "Buyer identity", example = "alice")
    private String buyer;

    @Schema(description = "Seller identity", example = "bob")
    private String seller;

    @Schema(description = "Matched quantity", example = "100")
    private Long quantity;

    @Schema(description = "Price the buyer pays per unit (seller's quoted price)", example = "40")
    private Long settlementPrice;

    public static MatchResult noMatch(long buyOrderId) {
        return MatchResult.builder()
                .buyOrderId(buyOrderId)
                .matched(false)
                .build();
    }

    public static MatchResult of(Order buyOrder, Order sellOrder) {
        return MatchResult.builder()
                .buyOrderId(buyOrder.getOrderId())
                .matched(true)
                .sellOrderId(sellOrder.getOrderId())
                .buyer(buyOrder.getBuyer())
                .seller(sellOrder.getSeller())
                .quantity(buyOrder.getQuantity())
                .settlementPrice(buyOrder.getPrice())
                .build();
    }
}
