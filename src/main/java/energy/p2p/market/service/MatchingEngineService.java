package energy.p2p.market.service;

import energy.p2p.market.domain.Order;
import energy.p2p.market.dto.MatchResult;
import energy.p2p.market.dto.OrderResponse;
import energy.p2p.market.dto.SettlementResult;
import energy.p2p.market.engine.MarketSession;
import energy.p2p.market.engine.OrderBook;
import energy.p2p.market.enums.OrderSide;
import energy.p2p.market.exception.SettlementFailedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Core matching engine service
 * Runs order placement, matching and settlement against the market session one operation at a time
 */
@Slf4j
@Service
public class MatchingEngineService {

    @Autowired
    private MarketSession marketSession;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter buyOrdersPlacedCounter;
    private Counter sellOrdersPlacedCounter;
    private Counter matchesConfirmedCounter;
    private Counter matchesMissedCounter;
    private Counter settlementsExecutedCounter;
    private Counter settlementsFailedCounter;
    private Timer settlementTimer;

    /**
     * Initialize metrics on application startup
     */
    @PostConstruct
    public void initMetrics() {
        buyOrdersPlacedCounter = Counter.builder("market.orders.placed")
                .description("Total orders placed")
                .tag("side", "buy")
                .register(meterRegistry);

        sellOrdersPlacedCounter = Counter.builder("market.orders.placed")
                .description("Total orders placed")
                .tag("side", "sell")
                .register(meterRegistry);

        matchesConfirmedCounter = Counter.builder("market.matches.confirmed")
                .description("Match attempts that paired a buy order with a sell order")
                .register(meterRegistry);

        matchesMissedCounter = Counter.builder("market.matches.missed")
                .description("Match attempts that found no compatible sell order")
                .register(meterRegistry);

        settlementsExecutedCounter = Counter.builder("market.settlements.executed")
                .description("Matched pairs settled and executed")
                .register(meterRegistry);

        settlementsFailedCounter = Counter.builder("market.settlements.failed")
                .description("Settlement transfers that failed after validation")
                .register(meterRegistry);

        settlementTimer = Timer.builder("market.settlement.time")
                .description("Time taken to execute a matched order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        log.info("Initialized metrics for MatchingEngineService");
    }

    /**
     * Place a new buy or sell order
     *
     * @param side order side
     * @param initiator participant placing the order
     * @param quantity energy units
     * @param price unit price
     * @return the placed order
     */
    public OrderResponse placeOrder(OrderSide side, String initiator, long quantity, long price) {
        synchronized (marketSession) {
            OrderBook orderBook = marketSession.getOrderBook();
            long orderId = orderBook.place(side, initiator, quantity, price);

            (side == OrderSide.BUY ? buyOrdersPlacedCounter : sellOrdersPlacedCounter).increment();
            return OrderResponse.fromOrder(orderBook.getOrder(orderId));
        }
    }

    /**
     * Match a buy order against the first compatible sell order in the book
     *
     * @param buyOrderId the buy order
     * @return match outcome; matched is false when no sell order qualified
     */
    public MatchResult matchOrder(long buyOrderId) {
        MatchResult result;
        synchronized (marketSession) {
            result = marketSession.getOrderBook().match(buyOrderId);
        }

        (result.isMatched() ? matchesConfirmedCounter : matchesMissedCounter).increment();
        return result;
    }

    /**
     * Attempt a match for every open buy order, oldest first
     *
     * @return the attempts that produced a match
     */
    public List<MatchResult> matchPendingBuyOrders() {
        List<MatchResult> matches = new ArrayList<>();
        synchronized (marketSession) {
            OrderBook orderBook = marketSession.getOrderBook();
            List<Long> pending = orderBook.findUnmatchedBuyOrderIds();
            log.debug("Matching pending buy orders: count={}", pending.size());

            for (Long buyOrderId : pending) {
                MatchResult result = orderBook.match(buyOrderId);
                if (result.isMatched()) {
                    matchesConfirmedCounter.increment();
                    matches.add(result);
                } else {
                    matchesMissedCounter.increment();
                }
            }
        }

        if (!matches.isEmpty()) {
            log.info("Pending buy orders matched: matched={}", matches.size());
        }
        return matches;
    }

    /**
     * Settle a matched order
     *
     * @param orderId either leg of the match
     * @param payment value tendered by the caller
     * @param caller the calling participant; must be the buyer
     * @return settlement details
     */
    public SettlementResult executeOrder(long orderId, long payment, String caller) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SettlementResult result;
            synchronized (marketSession) {
                result = marketSession.getOrderBook().execute(orderId, payment, caller);
            }
            settlementsExecutedCounter.increment();
            return result;
        } catch (SettlementFailedException e) {
            settlementsFailedCounter.increment();
            throw e;
        } finally {
            sample.stop(settlementTimer);
        }
    }

    /**
     * Get order by ID
     */
    public OrderResponse getOrder(long orderId) {
        synchronized (marketSession) {
            return OrderResponse.fromOrder(marketSession.getOrderBook().getOrder(orderId));
        }
    }

    public long getOrderCount() {
        synchronized (marketSession) {
            return marketSession.getOrderBook().getOrderCount();
        }
    }

    /**
     * Get all orders in placement order
     */
    public List<OrderResponse> getOrders() {
        synchronized (marketSession) {
            List<Order> orders = marketSession.getOrderBook().getOrders();
            return orders.stream()
                    .map(OrderResponse::fromOrder)
                    .collect(Collectors.toList());
        }
    }
}
