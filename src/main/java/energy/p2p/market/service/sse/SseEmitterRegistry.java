package energy.p2p.market.service.sse;

import energy.p2p.market.event.MarketEvent;
import energy.p2p.market.event.MarketEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for SSE connections streaming market notifications.
 * A connection either follows one participant or, under {@link #ALL_PARTICIPANTS},
 * receives every event.
 */
@Slf4j
@Service
public class SseEmitterRegistry implements MarketEventListener {

    public static final String ALL_PARTICIPANTS = "*";

    /**
     * Map of participant to SSE emitters; one participant can hold several connections
     */
    private final Map<String, Set<SseEmitter>> emittersByParticipant = new ConcurrentHashMap<>();

    public void addEmitter(String participantId, SseEmitter emitter) {
        emittersByParticipant.computeIfAbsent(participantId, k -> ConcurrentHashMap.newKeySet())
                .add(emitter);

        log.info("Added SSE emitter: participantId={}, totalEmitters={}, totalParticipants={}",
                participantId, emittersByParticipant.get(participantId).size(), emittersByParticipant.size());
    }

    public void removeEmitter(String participantId, SseEmitter emitter) {
        Set<SseEmitter> emitters = emittersByParticipant.get(participantId);
        if (emitters != null) {
            emitters.remove(emitter);

            if (emitters.isEmpty()) {
                emittersByParticipant.remove(participantId);
                log.info("Removed last SSE emitter: participantId={}, totalParticipants={}",
                        participantId, emittersByParticipant.size());
            } else {
                log.info("Removed SSE emitter: participantId={}, remainingEmitters={}",
                        participantId, emitters.size());
            }
        }
    }

    @Override
    public void onEvent(MarketEvent event) {
        Set<String> recipients = new LinkedHashSet<>(event.getParticipants());
        recipients.add(ALL_PARTICIPANTS);
        recipients.forEach(participantId -> sendToParticipant(participantId, event));
    }

    /**
     * Send a market event to every emitter of a participant
     */
    public void sendToParticipant(String participantId, MarketEvent event) {
        if (participantId == null) {
            return;
        }
        Set<SseEmitter> emitters = emittersByParticipant.get(participantId);

        if (emitters == null || emitters.isEmpty()) {
            log.debug("No SSE emitters for participant: participantId={}", participantId);
            return;
        }

        List<SseEmitter> deadEmitters = new ArrayList<>();

        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                    .name(event.getType().name().toLowerCase().replace('_', '-'))
                    .data(event)
                    .id(String.valueOf(event.getSequence()))
                );
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event: participantId={}, sequence={}, error={}",
                        participantId, event.getSequence(), e.getMessage());
                deadEmitters.add(emitter);
            }
        }

        deadEmitters.forEach(emitter -> removeEmitter(participantId, emitter));

        if (!deadEmitters.isEmpty()) {
            log.info("Removed {} dead SSE emitter(s) for participantId={}", deadEmitters.size(), participantId);
        }
    }

    public int getConnectionCount(String participantId) {
        Set<SseEmitter> emitters = emittersByParticipant.get(participantId);
        return emitters == null ? 0 : emitters.size();
    }

    public int getTotalParticipantCount() {
        return emittersByParticipant.size();
    }

    public int getTotalConnectionCount() {
        return emittersByParticipant.values().stream()
                .mapToInt(Set::size)
                .sum();
    }
}
