package energy.p2p.market.dto;

import energy.p2p.market.domain.Installation;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Installation response")
public class InstallationResponse {

    @Schema(description = "Installation ID", example = "0")
    private Long installationId;

    @Schema(description = "Owner identity", example = "carol")
    private String owner;

    @Schema(description = "Generation capacity", example = "50")
    private Long capacity;

    @Schema(description = "Whether the upfront payment was accepted", example = "true")
    private boolean installed;

    @Schema(description = "Upfront payment taken into escrow", example = "5000")
    private Long paidAmount;

    @Schema(description = "Registration timestamp", example = "2025-01-15T10:30:00")
    private LocalDateTime registeredAt;

    public static InstallationResponse fromInstallation(Installation installation) {
        return InstallationResponse.builder()
                .installationId(installation.getInstallationId())
                .owner(installation.getOwner())
                .capacity(installation.getCapacity())
                .installed(installation.isInstalled())
                .paidAmount(installation.getPaidAmount())
                .registeredAt(installation.getRegisteredAt())
                .build();
    }
}
