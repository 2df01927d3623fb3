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
@Schema(description = "Register installation request")
public class RegisterInstallationRequest {

    @NotNull(message = "Capacity cannot be null")
    @Min(value = 1, message = "Capacity must be positive")
    @Max(value = 1_000_000_000L, message = "Capacity must be at most 1000000000")
    @Schema(description = "Generation capacity", example = "50", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long capacity;

    @NotNull(message = "Payment cannot be null")
    @Min(value = 0, message = "Payment must not be negative")
    @Max(value = 2_000_000_000_000_000_000L, message = "Payment must be at most 2000000000000000000")
    @Schema(description = "Upfront payment; at least capacity x unit rate", example = "5000",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Long payment;
}
