package energy.p2p.market.dto;

import energy.p2p.market.domain.Order;
import energy.p2p.market.enums.OrderSide;
import energy.p2p.market.enums.OrderState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Order response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order response")
public class OrderResponse {

    @Schema(description = "Order ID (position in the book)", example = "0")
    private Long orderId;

    @Schema(description = "Initiating side", example = "BUY")
    private OrderSide side;

    @Schema(description = "Participant that placed the order", example = "alice")
    private String initiator;

    @Schema(description = "Buyer identity, null until a sell order is matched", example = "alice")
    private String buyer;

    @Schema(description = "Seller identity, null until a buy order is matched", example = "bob")
    private String seller;

    @Schema(description = "Energy units", example = "100")
    private Long quantity;

    @Schema(description = "Unit price; the settlement price once a buy order is matched", example = "40")
    private Long price;

    @Schema(description = "Whether a counterparty was found", example = "true")
    private boolean matched;

    @Schema(description = "Whether payment was settled", example = "false")
    private boolean executed;

    @Schema(description = "Linked order ID", example = "1")
    private Long matchedOrderId;

    @Schema(description = "Lifecycle state", example = "MATCHED")
    private OrderState state;

    @Schema(description = "Created timestamp", example = "2025-01-15T10:30:00")
    private LocalDateTime createdAt;

    @Schema(description = "Updated timestamp", example = "2025-01-15T10:30:01")
    private LocalDateTime updatedAt;

    /**
     * Snapshot an Order entity
     */
    public static OrderResponse fromOrder(Order order) {
        if (order == null) {
            return null;
        }

        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .side(order.getSide())
                .initiator(order.getInitiator())
                .buyer(order.getBuyer())
                .seller(order.getSeller())
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .matched(order.isMatched())
                .executed(order.isExecuted())
                .matchedOrderId(order.getMatchedOrderId())
                .state(order.getState())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
