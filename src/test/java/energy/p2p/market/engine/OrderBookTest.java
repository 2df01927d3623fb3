package energy.p2p.market.engine;

import energy.p2p.market.domain.Order;
import energy.p2p.market.dto.MatchResult;
import energy.p2p.market.dto.SettlementResult;
import energy.p2p.market.enums.MarketEventType;
import energy.p2p.market.enums.OrderSide;
import energy.p2p.market.enums.OrderState;
import energy.p2p.market.event.MarketEvent;
import energy.p2p.market.event.MarketEventLog;
import energy.p2p.market.exception.InsufficientPaymentException;
import energy.p2p.market.exception.InvalidOrderException;
import energy.p2p.market.exception.NotAuthorizedException;
import energy.p2p.market.exception.OrderAlreadyExecutedException;
import energy.p2p.market.exception.OrderAlreadyMatchedException;
import energy.p2p.market.exception.OrderNotFoundException;
import energy.p2p.market.exception.OrderNotMatchedException;
import energy.p2p.market.exception.SettlementFailedException;
import energy.p2p.market.settlement.EscrowLedger;
import energy.p2p.market.store.InMemoryOrderStore;
import energy.p2p.market.testutil.OrderTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OrderBook placement, matching and settlement
 */
@DisplayName("Order Book Tests")
class OrderBookTest {

    private EscrowLedger ledger;
    private MarketEventLog eventLog;
    private OrderBook orderBook;

    @BeforeEach
    void setUp() {
        MarketSession session = MarketSession.inMemory(10);
        ledger = session.getLedger();
        eventLog = session.getEventLog();
        orderBook = session.getOrderBook();
    }

    // ============= PLACEMENT =============

    @Test
    @DisplayName("Orders get consecutive ids starting at 0")
    void testPlace_AssignsSequentialIds() {
        long first = OrderTestBuilder.buy().placeOn(orderBook);
        long second = OrderTestBuilder.sell().placeOn(orderBook);

        assertThat(first).isEqualTo(0L);
        assertThat(second).isEqualTo(1L);
        assertThat(orderBook.getOrderCount()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Buy order records the initiator as buyer, sell order as seller")
    void testPlace_RecordsInitiatorOnOwnSide() {
        Order buy = orderBook.getOrder(OrderTestBuilder.buy().by("alice").placeOn(orderBook));
        Order sell = orderBook.getOrder(OrderTestBuilder.sell().by("bob").placeOn(orderBook));

        assertThat(buy.getBuyer()).isEqualTo("alice");
        assertThat(buy.getSeller()).isNull();
        assertThat(buy.getState()).isEqualTo(OrderState.PLACED);

        assertThat(sell.getSeller()).isEqualTo("bob");
        assertThat(sell.getBuyer()).isNull();
        assertThat(sell.isMatched()).isFalse();
        assertThat(sell.isExecuted()).isFalse();
    }

    @Test
    @DisplayName("Zero quantity and negative price are rejected")
    void testPlace_InvalidInput() {
        assertThatThrownBy(() -> OrderTestBuilder.buy().quantity(0).placeOn(orderBook))
                .isInstanceOf(InvalidOrderException.class);
        assertThatThrownBy(() -> OrderTestBuilder.sell().price(-1).placeOn(orderBook))
                .isInstanceOf(InvalidOrderException.class);
        assertThatThrownBy(() -> OrderTestBuilder.buy().by(" ").placeOn(orderBook))
                .isInstanceOf(InvalidOrderException.class);

        assertThat(orderBook.getOrderCount()).isZero();
    }

    @Test
    @DisplayName("Zero price is accepted")
    void testPlace_ZeroPrice() {
        long sellId = OrderTestBuilder.sell().price(0).placeOn(orderBook);
        assertThat(orderBook.getOrder(sellId).getPrice()).isZero();
    }

    // ============= MATCHING =============

    @Test
    @DisplayName("Match pairs orders and the buyer adopts the seller's price")
    void testMatch_AdoptsSellPrice() {
        // GIVEN
        long buyId = OrderTestBuilder.buy().quantity(100).price(50).placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().quantity(100).price(40).placeOn(orderBook);

        // WHEN
        MatchResult result = orderBook.match(buyId);

        // THEN
        assertThat(result.isMatched()).isTrue();
        assertThat(result.getSellOrderId()).isEqualTo(sellId);
        assertThat(result.getSettlementPrice()).isEqualTo(40L);

        Order buy = orderBook.getOrder(buyId);
        Order sell = orderBook.getOrder(sellId);
        assertThat(buy.getPrice()).isEqualTo(40L);
        assertThat(buy.getSeller()).isEqualTo("bob");
        assertThat(buy.getMatchedOrderId()).isEqualTo(sellId);
        assertThat(buy.getState()).isEqualTo(OrderState.MATCHED);
        assertThat(sell.getBuyer()).isEqualTo("alice");
        assertThat(sell.getMatchedOrderId()).isEqualTo(buyId);
        assertThat(sell.getPrice()).isEqualTo(40L);
        assertThat(sell.isMatched()).isTrue();
    }

    @Test
    @DisplayName("Quantity mismatch leaves the buy order unmatched")
    void testMatch_QuantityMismatch() {
        long buyId = OrderTestBuilder.buy().quantity(100).price(50).placeOn(orderBook);
        OrderTestBuilder.sell().quantity(90).price(40).placeOn(orderBook);

        MatchResult result = orderBook.match(buyId);

        assertThat(result.isMatched()).isFalse();
        assertThat(result.getSellOrderId()).isNull();
        assertThat(orderBook.getOrder(buyId).isMatched()).isFalse();
        assertThat(orderBook.getOrder(buyId).getPrice()).isEqualTo(50L);

        assertThatThrownBy(() -> orderBook.execute(buyId, 10_000, "alice"))
                .isInstanceOf(OrderNotMatchedException.class);
    }

    @Test
    @DisplayName("Sell price above the bid is not matched")
    void testMatch_SellPriceTooHigh() {
        long buyId = OrderTestBuilder.buy().price(50).placeOn(orderBook);
        OrderTestBuilder.sell().price(51).placeOn(orderBook);

        assertThat(orderBook.match(buyId).isMatched()).isFalse();
    }

    @Test
    @DisplayName("Sell price equal to the bid is matched")
    void testMatch_EqualPrice() {
        long buyId = OrderTestBuilder.buy().price(50).placeOn(orderBook);
        OrderTestBuilder.sell().price(50).placeOn(orderBook);

        assertThat(orderBook.match(buyId).getSettlementPrice()).isEqualTo(50L);
    }

    @Test
    @DisplayName("Earliest compatible sell order wins, not the cheapest")
    void testMatch_FirstFit() {
        long buyId = OrderTestBuilder.buy().price(50).placeOn(orderBook);
        long earlier = OrderTestBuilder.sell().by("bob").price(45).placeOn(orderBook);
        long later = OrderTestBuilder.sell().by("carol").price(30).placeOn(orderBook);

        MatchResult result = orderBook.match(buyId);

        assertThat(result.getSellOrderId()).isEqualTo(earlier);
        assertThat(result.getSeller()).isEqualTo("bob");
        assertThat(orderBook.getOrder(later).isMatched()).isFalse();
    }

    @Test
    @DisplayName("Sell order placed before the buy order is found")
    void testMatch_SellPlacedFirst() {
        long sellId = OrderTestBuilder.sell().placeOn(orderBook);
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);

        assertThat(orderBook.match(buyId).getSellOrderId()).isEqualTo(sellId);
    }

    @Test
    @DisplayName("Already matched sell order is skipped")
    void testMatch_SkipsMatchedSell() {
        long firstBuy = OrderTestBuilder.buy().by("alice").placeOn(orderBook);
        long secondBuy = OrderTestBuilder.buy().by("dave").placeOn(orderBook);
        long firstSell = OrderTestBuilder.sell().by("bob").placeOn(orderBook);
        long secondSell = OrderTestBuilder.sell().by("carol").placeOn(orderBook);

        orderBook.match(firstBuy);
        MatchResult result = orderBook.match(secondBuy);

        assertThat(result.getSellOrderId()).isEqualTo(secondSell);
        assertThat(orderBook.getOrder(firstSell).getBuyer()).isEqualTo("alice");
    }

    @Test
    @DisplayName("Buy orders are never matched against each other")
    void testMatch_IgnoresBuyOrders() {
        long buyId = OrderTestBuilder.buy().by("alice").placeOn(orderBook);
        OrderTestBuilder.buy().by("dave").price(10).placeOn(orderBook);

        assertThat(orderBook.match(buyId).isMatched()).isFalse();
    }

    @Test
    @DisplayName("Failed match leaves every order untouched")
    void testMatch_NoMutationOnMiss() {
        long buyId = OrderTestBuilder.buy().quantity(100).price(50).placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().quantity(100).price(60).placeOn(orderBook);
        String before = orderBook.getOrder(sellId).toString();

        orderBook.match(buyId);

        assertThat(orderBook.getOrder(sellId).toString()).isEqualTo(before);
        assertThat(eventLog.getLatestSequence()).isZero();
    }

    @Test
    @DisplayName("Matching a matched buy order again fails")
    void testMatch_AlreadyMatched() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        OrderTestBuilder.sell().placeOn(orderBook);
        OrderTestBuilder.sell().by("carol").placeOn(orderBook);
        orderBook.match(buyId);

        assertThatThrownBy(() -> orderBook.match(buyId))
                .isInstanceOf(OrderAlreadyMatchedException.class);
    }

    @Test
    @DisplayName("Matching an executed buy order fails")
    void testMatch_AlreadyExecuted() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);
        orderBook.execute(buyId, 5001, "alice");

        assertThatThrownBy(() -> orderBook.match(buyId))
                .isInstanceOf(OrderAlreadyExecutedException.class);
    }

    @Test
    @DisplayName("Match must be called with a buy order id")
    void testMatch_SellOrderId() {
        long sellId = OrderTestBuilder.sell().placeOn(orderBook);

        assertThatThrownBy(() -> orderBook.match(sellId))
                .isInstanceOf(InvalidOrderException.class);
    }

    @Test
    @DisplayName("Unknown order id is rejected")
    void testMatch_OrderNotFound() {
        OrderTestBuilder.buy().placeOn(orderBook);

        assertThatThrownBy(() -> orderBook.match(1))
                .isInstanceOf(OrderNotFoundException.class)
                .hasMessageContaining("1");
        assertThatThrownBy(() -> orderBook.match(-1))
                .isInstanceOf(OrderNotFoundException.class);
    }

    @Test
    @DisplayName("Open buy orders are listed oldest first")
    void testFindUnmatchedBuyOrderIds() {
        long first = OrderTestBuilder.buy().placeOn(orderBook);
        OrderTestBuilder.sell().placeOn(orderBook);
        long second = OrderTestBuilder.buy().by("dave").quantity(7).placeOn(orderBook);
        orderBook.match(first);

        assertThat(orderBook.findUnmatchedBuyOrderIds()).containsExactly(second);
    }

    // ============= EXECUTION =============

    @Test
    @DisplayName("Execute transfers quantity x price to the seller and keeps the excess")
    void testExecute_Settles() {
        // GIVEN
        long buyId = OrderTestBuilder.buy().quantity(100).price(50).placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().quantity(100).price(40).placeOn(orderBook);
        orderBook.match(buyId);

        // WHEN
        SettlementResult result = orderBook.execute(buyId, 4001, "alice");

        // THEN
        assertThat(result.getAmountTransferred()).isEqualTo(4000L);
        assertThat(result.getRetainedExcess()).isEqualTo(1L);
        assertThat(result.getCounterpartOrderId()).isEqualTo(sellId);
        assertThat(ledger.getBalance("bob")).isEqualTo(4000L);
        assertThat(ledger.getEscrowBalance()).isEqualTo(1L);
        assertThat(orderBook.getOrder(buyId).getState()).isEqualTo(OrderState.EXECUTED);
        assertThat(orderBook.getOrder(sellId).getState()).isEqualTo(OrderState.EXECUTED);
    }

    @Test
    @DisplayName("Execute via the sell leg settles both orders")
    void testExecute_ViaSellLeg() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);

        SettlementResult result = orderBook.execute(sellId, 5001, "alice");

        assertThat(result.getCounterpartOrderId()).isEqualTo(buyId);
        assertThat(orderBook.getOrder(buyId).isExecuted()).isTrue();
        assertThat(orderBook.getOrder(sellId).isExecuted()).isTrue();
    }

    @Test
    @DisplayName("Payment equal to the settlement amount is insufficient")
    void testExecute_ExactPaymentRejected() {
        long buyId = OrderTestBuilder.buy().quantity(100).price(40).placeOn(orderBook);
        OrderTestBuilder.sell().quantity(100).price(40).placeOn(orderBook);
        orderBook.match(buyId);

        assertThatThrownBy(() -> orderBook.execute(buyId, 4000, "alice"))
                .isInstanceOf(InsufficientPaymentException.class);
        assertThat(ledger.getEscrowBalance()).isZero();
        assertThat(orderBook.getOrder(buyId).isExecuted()).isFalse();
    }

    @Test
    @DisplayName("Only the buyer may execute")
    void testExecute_WrongCaller() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);

        assertThatThrownBy(() -> orderBook.execute(buyId, 10_000, "bob"))
                .isInstanceOf(NotAuthorizedException.class);
        assertThatThrownBy(() -> orderBook.execute(buyId, 10_000, null))
                .isInstanceOf(NotAuthorizedException.class);
        assertThat(ledger.getEscrowBalance()).isZero();
    }

    @Test
    @DisplayName("Executing twice fails and pays nothing more")
    void testExecute_Twice() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);
        orderBook.execute(buyId, 5001, "alice");

        assertThatThrownBy(() -> orderBook.execute(buyId, 5001, "alice"))
                .isInstanceOf(OrderAlreadyExecutedException.class);
        assertThatThrownBy(() -> orderBook.execute(sellId, 5001, "alice"))
                .isInstanceOf(OrderAlreadyExecutedException.class);
        assertThat(ledger.getBalance("bob")).isEqualTo(5000L);
        assertThat(ledger.getEscrowBalance()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Failed transfer keeps orders matched and strands the payment in escrow")
    void testExecute_TransferFailure() {
        // GIVEN: seller refuses incoming transfers
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);
        ledger.setRejectsIncoming("bob", true);

        // WHEN / THEN
        assertThatThrownBy(() -> orderBook.execute(buyId, 5001, "alice"))
                .isInstanceOf(SettlementFailedException.class)
                .satisfies(e -> {
                    SettlementFailedException failure = (SettlementFailedException) e;
                    assertThat(failure.getRecipient()).isEqualTo("bob");
                    assertThat(failure.getSettlementAmount()).isEqualTo(5000L);
                    assertThat(failure.getStrandedPayment()).isEqualTo(5001L);
                });

        assertThat(orderBook.getOrder(buyId).getState()).isEqualTo(OrderState.MATCHED);
        assertThat(orderBook.getOrder(sellId).getState()).isEqualTo(OrderState.MATCHED);
        assertThat(ledger.getEscrowBalance()).isEqualTo(5001L);
        assertThat(ledger.getBalance("bob")).isZero();

        // Retry succeeds once the seller accepts; the first payment is not refunded
        ledger.setRejectsIncoming("bob", false);
        orderBook.execute(buyId, 5001, "alice");
        assertThat(ledger.getEscrowBalance()).isEqualTo(5002L);
        assertThat(ledger.getBalance("bob")).isEqualTo(5000L);
    }

    @Test
    @DisplayName("Execute checks run in order: matched, executed, caller, payment")
    void testExecute_CheckOrder() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);

        // Not matched wins over wrong caller and low payment
        assertThatThrownBy(() -> orderBook.execute(buyId, 0, "mallory"))
                .isInstanceOf(OrderNotMatchedException.class);

        OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);

        // Wrong caller wins over low payment
        assertThatThrownBy(() -> orderBook.execute(buyId, 0, "mallory"))
                .isInstanceOf(NotAuthorizedException.class);
    }

    @Test
    @DisplayName("Settlement amount overflow is rejected without taking payment")
    void testExecute_AmountOverflow() {
        long buyId = OrderTestBuilder.buy().quantity(Long.MAX_VALUE / 2).price(10).placeOn(orderBook);
        OrderTestBuilder.sell().quantity(Long.MAX_VALUE / 2).price(10).placeOn(orderBook);
        orderBook.match(buyId);

        assertThatThrownBy(() -> orderBook.execute(buyId, Long.MAX_VALUE, "alice"))
                .isInstanceOf(InvalidOrderException.class);
        assertThat(ledger.getEscrowBalance()).isZero();
    }

    @Test
    @DisplayName("Payment that would overflow escrow is rejected before anything changes")
    void testExecute_EscrowCapacityExhausted() {
        // GIVEN: a first settlement paid with the largest possible payment
        long firstBuy = OrderTestBuilder.buy().by("alice").quantity(100).price(50).placeOn(orderBook);
        OrderTestBuilder.sell().by("bob").quantity(100).price(40).placeOn(orderBook);
        orderBook.match(firstBuy);
        orderBook.execute(firstBuy, Long.MAX_VALUE, "alice");
        long escrowAfterFirst = ledger.getEscrowBalance();
        assertThat(escrowAfterFirst).isEqualTo(Long.MAX_VALUE - 4000);

        long secondBuy = OrderTestBuilder.buy().by("carol").quantity(10).price(5).placeOn(orderBook);
        long secondSell = OrderTestBuilder.sell().by("dave").quantity(10).price(5).placeOn(orderBook);
        orderBook.match(secondBuy);
        long sequenceBefore = eventLog.getLatestSequence();

        // WHEN / THEN
        assertThatThrownBy(() -> orderBook.execute(secondBuy, 1_000_000, "carol"))
                .isInstanceOf(InvalidOrderException.class)
                .hasMessageContaining("escrow");

        assertThat(ledger.getEscrowBalance()).isEqualTo(escrowAfterFirst);
        assertThat(ledger.getBalance("dave")).isZero();
        assertThat(orderBook.getOrder(secondBuy).getState()).isEqualTo(OrderState.MATCHED);
        assertThat(orderBook.getOrder(secondSell).getState()).isEqualTo(OrderState.MATCHED);
        assertThat(eventLog.getLatestSequence()).isEqualTo(sequenceBefore);
    }

    @Test
    @DisplayName("Orders returned by the book are detached copies")
    void testGetOrder_ReturnsSnapshot() {
        long buyId = OrderTestBuilder.buy().placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().placeOn(orderBook);
        orderBook.match(buyId);

        orderBook.getOrder(buyId).markExecuted();
        orderBook.getOrders().get((int) sellId).markExecuted();

        assertThat(orderBook.getOrder(buyId).getState()).isEqualTo(OrderState.MATCHED);
        assertThat(orderBook.getOrder(sellId).getState()).isEqualTo(OrderState.MATCHED);

        SettlementResult result = orderBook.execute(buyId, 5001, "alice");
        assertThat(result.getAmountTransferred()).isEqualTo(5000L);
        assertThat(orderBook.getOrder(sellId).isExecuted()).isTrue();
    }

    @Test
    @DisplayName("Zero-price match settles a zero amount")
    void testExecute_ZeroPrice() {
        long buyId = OrderTestBuilder.buy().price(0).placeOn(orderBook);
        OrderTestBuilder.sell().price(0).placeOn(orderBook);
        orderBook.match(buyId);

        SettlementResult result = orderBook.execute(buyId, 1, "alice");

        assertThat(result.getAmountTransferred()).isZero();
        assertThat(ledger.getEscrowBalance()).isEqualTo(1L);
    }

    // ============= EVENTS =============

    @Test
    @DisplayName("Match and settlement publish events in order")
    void testEvents_Emitted() {
        long buyId = OrderTestBuilder.buy().quantity(100).price(50).placeOn(orderBook);
        long sellId = OrderTestBuilder.sell().quantity(100).price(40).placeOn(orderBook);
        orderBook.match(buyId);
        orderBook.execute(buyId, 4001, "alice");

        List<MarketEvent> events = eventLog.eventsAfter(0);
        assertThat(events.stream().map(MarketEvent::getType).collect(Collectors.toList()))
                .containsExactly(MarketEventType.MATCH_CONFIRMED,
                        MarketEventType.PAYMENT_RECEIVED,
                        MarketEventType.PAYMENT_SENT);

        MarketEvent match = events.get(0);
        assertThat(match.getSequence()).isEqualTo(1L);
        assertThat(match.getBuyOrderId()).isEqualTo(buyId);
        assertThat(match.getSellOrderId()).isEqualTo(sellId);
        assertThat(match.getPrice()).isEqualTo(40L);

        assertThat(events.get(1).getParty()).isEqualTo("alice");
        assertThat(events.get(1).getAmount()).isEqualTo(4001L);
        assertThat(events.get(2).getParty()).isEqualTo("bob");
        assertThat(events.get(2).getAmount()).isEqualTo(4000L);
    }

    @Test
    @DisplayName("Failed transfer publishes payment received but not payment sent")
    void testEvents_TransferFailure() {
        OrderBook failingBook = new OrderBook(new InMemoryOrderStore(), ledger, (to, amount) -> false, eventLog);
        long failingBuy = failingBook.place(OrderSide.BUY, "alice", 1, 1);
        failingBook.place(OrderSide.SELL, "bob", 1, 1);
        failingBook.match(failingBuy);
        long before = eventLog.getLatestSequence();

        assertThatThrownBy(() -> failingBook.execute(failingBuy, 2, "alice"))
                .isInstanceOf(SettlementFailedException.class);

        List<MarketEvent> after = eventLog.eventsAfter(before);
        assertThat(after).hasSize(1);
        assertThat(after.get(0).getType()).isEqualTo(MarketEventType.PAYMENT_RECEIVED);
    }
}
