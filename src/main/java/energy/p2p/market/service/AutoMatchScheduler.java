package energy.p2p.market.service;

import energy.p2p.market.dto.MatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically matches every open buy order
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "market.auto-match.enabled", havingValue = "true")
public class AutoMatchScheduler {

    @Autowired
    private MatchingEngineService matchingEngineService;

    @Scheduled(fixedDelayString = "${market.auto-match.interval-ms:5000}")
    public void tick() {
        try {
            List<MatchResult> matches = matchingEngineService.matchPendingBuyOrders();
            if (!matches.isEmpty()) {
                log.info("auto-match run matched={}", matches.size());
            }
        } catch (RuntimeException e) {
            log.warn("auto-match tick failed: {}", e.toString());
        }
    }
}
