package energy.p2p.market.service;

import energy.p2p.market.dto.MarketEventsResponse;
import energy.p2p.market.engine.MarketSession;
import energy.p2p.market.event.MarketEvent;
import energy.p2p.market.event.MarketEventLog;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Polling access to the market event log.
 * The log is thread-safe on its own, so reads do not take the session lock.
 */
@Service
public class MarketEventService {

    @Autowired
    private MarketSession marketSession;

    public MarketEventsResponse getEventsAfter(long afterSequence) {
        MarketEventLog eventLog = marketSession.getEventLog();
        List<MarketEvent> events = eventLog.eventsAfter(afterSequence);

        // Derived from the returned page so an append racing this call is not skipped
        long latestSequence = events.isEmpty()
                ? Math.min(afterSequence, eventLog.getLatestSequence())
                : events.get(events.size() - 1).getSequence();

        return MarketEventsResponse.builder()
                .events(events)
                .latestSequence(latestSequence)
                .build();
    }
}
