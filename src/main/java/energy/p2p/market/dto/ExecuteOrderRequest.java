package energy.p2p.market.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Execute order request")
public class ExecuteOrderRequest {

    @NotNull(message = "Payment cannot be null")
    @Min(value = 0, message = "Payment must not be negative")
    @Max(value = 2_000_000_000_000_000_000L, message = "Payment must be at most 2000000000000000000")
    @Schema(description = "Payment tendered; must exceed quantity x settlement price. Any excess is kept in escrow.",
            example = "4001", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long payment;
}
