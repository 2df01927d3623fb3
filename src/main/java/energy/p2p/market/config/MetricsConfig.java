package energy.p2p.market.config;

import energy.p2p.market.engine.MarketSession;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Metrics configuration for Prometheus monitoring
 *
 * Configures:
 * - Common tags on every market metric
 * - Gauges over the market session (book size, escrow, event log)
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Value("${spring.application.name:energy-market}")
    private String applicationName;

    @Bean
    public List<Tag> commonTags() {
        return List.of(
            Tag.of("service", applicationName),
            Tag.of("component", "matching-engine")
        );
    }

    @Bean
    public MeterBinder commonTagsBinder(List<Tag> commonTags) {
        return (MeterRegistry registry) -> {
            registry.config().commonTags(commonTags);
            log.info("Common metric tags applied: {}", commonTags);
        };
    }

    /**
     * Session gauges; each sample takes the session lock
     */
    @Bean
    public MeterBinder marketSessionGauges(MarketSession marketSession) {
        return (MeterRegistry registry) -> {
            gauge(registry, marketSession, "market.orders.total", "Orders ever placed",
                    session -> session.getOrderBook().getOrderCount());
            gauge(registry, marketSession, "market.orders.open.buy", "Buy orders waiting for a seller",
                    session -> session.getOrderBook().findUnmatchedBuyOrderIds().size());
            gauge(registry, marketSession, "market.escrow.balance", "Value held in market escrow",
                    session -> session.getLedger().getEscrowBalance());
            gauge(registry, marketSession, "market.installations.total", "Installations registered",
                    session -> session.getInstallationRegistry().count());
            Gauge.builder("market.events.sequence", marketSession,
                            session -> session.getEventLog().getLatestSequence())
                    .description("Latest market event sequence")
                    .register(registry);
        };
    }

    private static void gauge(MeterRegistry registry, MarketSession marketSession, String name,
                              String description, ToDoubleFunction<MarketSession> reading) {
        Gauge.builder(name, marketSession, session -> {
                    synchronized (session) {
                        return reading.applyAsDouble(session);
                    }
                })
                .description(description)
                .register(registry);
    }
}
