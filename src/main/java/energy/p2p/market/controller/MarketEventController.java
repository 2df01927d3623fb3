package energy.p2p.market.controller;

import energy.p2p.market.dto.ApiResponse;
import energy.p2p.market.dto.MarketEventsResponse;
import energy.p2p.market.service.MarketEventService;
import energy.p2p.market.service.sse.SseEmitterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;

/**
 * Market notifications: polling over the event log and streaming via Server-Sent Events
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@Validated
@Tag(name = "Market Events", description = "Match and payment notifications")
public class MarketEventController {

    @Autowired
    private MarketEventService marketEventService;

    @Autowired
    private SseEmitterRegistry sseEmitterRegistry;

    @GetMapping
    @Operation(
        summary = "Poll notifications",
        description = "Events with a sequence greater than afterSequence. Pass latestSequence back on the next poll."
    )
    public ApiResponse<MarketEventsResponse> getEvents(
            @Parameter(description = "Return events after this sequence (0 for all)")
            @RequestParam(required = false, defaultValue = "0") @Min(0) long afterSequence) {
        return ApiResponse.success(marketEventService.getEventsAfter(afterSequence));
    }

    /**
     * SSE endpoint for live notifications
     *
     * Usage:
     * <pre>
     * const eventSource = new EventSource('/api/v1/events/stream?participantId=alice');
     * eventSource.addEventListener('match-confirmed', (event) => console.log(JSON.parse(event.data)));
     * </pre>
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
        summary = "Stream notifications (SSE)",
        description = "Streams events concerning one participant, or every event when participantId is omitted"
    )
    public SseEmitter streamEvents(
            @Parameter(description = "Participant to follow; omit for all events")
            @RequestParam(required = false) String participantId,
            @Parameter(description = "Connection timeout in milliseconds (default: 300000ms / 5min)")
            @RequestParam(required = false, defaultValue = "300000") Long timeout) {

        String key = participantId == null || participantId.isBlank()
                ? SseEmitterRegistry.ALL_PARTICIPANTS
                : participantId;
        log.info("SSE connection request: participantId={}, timeout={}ms", key, timeout);

        SseEmitter emitter = new SseEmitter(timeout);
        sseEmitterRegistry.addEmitter(key, emitter);

        emitter.onCompletion(() -> {
            log.info("SSE connection completed: participantId={}", key);
            sseEmitterRegistry.removeEmitter(key, emitter);
        });

        emitter.onTimeout(() -> {
            log.warn("SSE connection timeout: participantId={}, timeout={}ms", key, timeout);
            sseEmitterRegistry.removeEmitter(key, emitter);
            emitter.complete();
        });

        emitter.onError((ex) -> {
            log.error("SSE connection error: participantId={}, error={}", key, ex.getMessage());
            sseEmitterRegistry.removeEmitter(key, emitter);
        });

        try {
            String connectionId = UUID.randomUUID().toString();
            emitter.send(SseEmitter.event()
                .name("connected")
                .data("Connected to market event stream")
                .id(connectionId)
            );
        } catch (IOException e) {
            log.error("Failed to send initial SSE event: participantId={}, error={}", key, e.getMessage());
            sseEmitterRegistry.removeEmitter(key, emitter);
        }

        return emitter;
    }

    @GetMapping("/stream/stats")
    @Operation(summary = "SSE connection statistics")
    public ApiResponse<SseConnectionStats> getConnectionStats() {
        return ApiResponse.success(new SseConnectionStats(
            sseEmitterRegistry.getTotalParticipantCount(),
            sseEmitterRegistry.getTotalConnectionCount()
        ));
    }

    public record SseConnectionStats(
        int totalParticipants,
        int totalConnections
    ) {}
}
