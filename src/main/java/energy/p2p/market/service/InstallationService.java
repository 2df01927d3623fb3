package energy.p2p.market.service;

import energy.p2p.market.dto.InstallationResponse;
import energy.p2p.market.engine.MarketSession;
import energy.p2p.market.registry.InstallationRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Service for installation registration and queries
 */
@Slf4j
@Service
public class InstallationService {

    @Autowired
    private MarketSession marketSession;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter installationsRegisteredCounter;

    @PostConstruct
    public void initMetrics() {
        installationsRegisteredCounter = Counter.builder("market.installations.registered")
                .description("Installations registered")
                .register(meterRegistry);
    }

    /**
     * Register an installation, taking the upfront payment into escrow
     *
     * @param owner registering participant
     * @param capacity generation capacity
     * @param payment upfront payment
     * @return the registered installation
     */
    public InstallationResponse registerInstallation(String owner, long capacity, long payment) {
        synchronized (marketSession) {
            InstallationRegistry registry = marketSession.getInstallationRegistry();
            long installationId = registry.register(owner, capacity, payment);
            installationsRegisteredCounter.increment();
            return InstallationResponse.fromInstallation(registry.get(installationId));
        }
    }

    public InstallationResponse getInstallation(long installationId) {
        synchronized (marketSession) {
            return InstallationResponse.fromInstallation(
                    marketSession.getInstallationRegistry().get(installationId));
        }
    }

    public long getInstallationCount() {
        synchronized (marketSession) {
            return marketSession.getInstallationRegistry().count();
        }
    }
}
