package energy.p2p.market.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Append-only, sequenced log of market notifications.
 * Observers either poll with {@link #eventsAfter(long)} or subscribe a listener.
 * Listener delivery goes through the dispatcher; a failing or absent listener
 * never affects the publisher.
 */
@Slf4j
public class MarketEventLog implements MarketEventPublisher {

    private final List<MarketEvent> events = new ArrayList<>();

    private final List<MarketEventListener> listeners = new CopyOnWriteArrayList<>();

    private final Executor dispatcher;

    /**
     * Log that delivers to listeners on the publishing thread
     */
    public MarketEventLog() {
        this(Runnable::run);
    }

    public MarketEventLog(Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void publish(MarketEvent event) {
        MarketEvent sequenced;
        synchronized (this) {
            sequenced = event.toBuilder().sequence(events.size() + 1L).build();
            events.add(sequenced);
        }
        log.debug("Market event appended: sequence={}, type={}", sequenced.getSequence(), sequenced.getType());

        for (MarketEventListener listener : listeners) {
            try {
                dispatcher.execute(() -> deliver(listener, sequenced));
            } catch (RejectedExecutionException e) {
                log.warn("Event dispatch rejected: sequence={}, listener={}, error={}",
                        sequenced.getSequence(), listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void deliver(MarketEventListener listener, MarketEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Market event listener failed: sequence={}, listener={}, error={}",
                    event.getSequence(), listener.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    /**
     * Events with a sequence greater than the given one, oldest first
     */
    public synchronized List<MarketEvent> eventsAfter(long sequence) {
        int from = (int) Math.max(0, Math.min(sequence, events.size()));
        return Collections.unmodifiableList(new ArrayList<>(events.subList(from, events.size())));
    }

    public synchronized long getLatestSequence() {
        return events.size();
    }

    public void subscribe(MarketEventListener listener) {
        listeners.add(listener);
        log.info("Market event listener subscribed: {}", listener.getClass().getSimpleName());
    }

    public void unsubscribe(MarketEventListener listener) {
        listeners.remove(listener);
    }
}
