package energy.p2p.market.config;

import energy.p2p.market.engine.MarketSession;
import energy.p2p.market.event.MarketEventListener;
import energy.p2p.market.event.MarketEventLog;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Wires the market session used by the service layer.
 * Event listeners are delivered on one dispatcher thread, so they see events
 * in log order and never hold up the operation that emitted them.
 */
@Slf4j
@Configuration
public class MarketConfig {

    @Value("${market.installation.unit-rate:100}")
    private long installationUnitRate;

    private final ExecutorService eventDispatcher = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "market-event-dispatcher");
        thread.setDaemon(true);
        return thread;
    });

    @Bean
    public MarketSession marketSession(ObjectProvider<MarketEventListener> listeners) {
        MarketEventLog eventLog = new MarketEventLog(eventDispatcher);
        listeners.orderedStream().forEach(eventLog::subscribe);

        MarketSession session = MarketSession.inMemory(installationUnitRate, eventLog);
        log.info("Market session created: installationUnitRate={}", installationUnitRate);
        return session;
    }

    @PreDestroy
    public void shutdownEventDispatcher() {
        eventDispatcher.shutdown();
        try {
            if (!eventDispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Market event dispatcher did not drain within 5s, dropping pending deliveries");
                eventDispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventDispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
