package energy.p2p.market.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Registered generation capacity owned by one participant
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Installation {
    private Long installationId;

    /**
     * Participant that registered and paid for the installation
     */
    private String owner;

    /**
     * Generation capacity in energy units
     */
    private long capacity;

    /**
     * True once the upfront payment was accepted
     */
    private boolean installed;

    /**
     * Upfront payment taken into escrow
     */
    private long paidAmount;

    private LocalDateTime registeredAt;
}
