package energy.p2p.market.dto;

import energy.p2p.market.enums.OrderSide;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Place order request DTO. The initiator comes from the X-Participant-Id header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Place order request")
public class PlaceOrderRequest {

    @NotNull(message = "Order side cannot be null")
    @Schema(description = "Order side", example = "BUY", requiredMode = Schema.RequiredMode.REQUIRED,
            allowableValues = {"BUY", "SELL"})
    private OrderSide side;

    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be positive")
    @Max(value = 1_000_000_000L, message = "Quantity must be at most 1000000000")
    @Schema(description = "Energy units", example = "100", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long quantity;

    @NotNull(message = "Price cannot be null")
    @Min(value = 0, message = "Price must not be negative")
    @Max(value = 1_000_000_000L, message = "Price must be at most 1000000000")
    @Schema(description = "Unit price", example = "50", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long price;
}
