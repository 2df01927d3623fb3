package energy.p2p.market.dto;

import energy.p2p.market.event.MarketEvent;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Page of market notifications")
public class MarketEventsResponse {

    @Builder.Default
    @Schema(description = "Events after the requested sequence, oldest first")
    private List<MarketEvent> events = new ArrayList<>();

    @Schema(description = "Sequence of the newest event in the log; pass it back as afterSequence to poll", example = "3")
    private long latestSequence;
}
