package energy.p2p.market.engine;

import energy.p2p.market.domain.Order;
import energy.p2p.market.dto.MatchResult;
import energy.p2p.market.dto.SettlementResult;
import energy.p2p.market.enums.OrderSide;
import energy.p2p.market.event.MarketEvent;
import energy.p2p.market.event.MarketEventPublisher;
import energy.p2p.market.exception.InsufficientPaymentException;
import energy.p2p.market.exception.InvalidOrderException;
import energy.p2p.market.exception.NotAuthorizedException;
import energy.p2p.market.exception.OrderAlreadyExecutedException;
import energy.p2p.market.exception.OrderAlreadyMatchedException;
import energy.p2p.market.exception.OrderNotFoundException;
import energy.p2p.market.exception.OrderNotMatchedException;
import energy.p2p.market.exception.SettlementFailedException;
import energy.p2p.market.settlement.EscrowLedger;
import energy.p2p.market.settlement.SettlementGateway;
import energy.p2p.market.store.OrderStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Order book for energy orders: placement, first-fit matching and settlement.
 *
 * Matching scans the book in insertion order and pairs a buy order with the
 * first open sell order of exactly the same quantity whose price does not
 * exceed the buy price. The buyer then owes the seller's price.
 *
 * Execution takes the buyer's payment into escrow, transfers
 * quantity x settlement price to the seller and marks both legs executed.
 * Payment above the settlement amount, and the whole payment of a failed
 * transfer, stays in escrow.
 *
 * Not thread-safe: every call must complete before the next one starts.
 */
@Slf4j
public class OrderBook {

    private final OrderStore orderStore;

    private final EscrowLedger ledger;

    private final SettlementGateway settlementGateway;

    private final MarketEventPublisher eventPublisher;

    public OrderBook(OrderStore orderStore,
                     EscrowLedger ledger,
                     SettlementGateway settlementGateway,
                     MarketEventPublisher eventPublisher) {
        this.orderStore = orderStore;
        this.ledger = ledger;
        this.settlementGateway = settlementGateway;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Append a new unmatched order. No payment is taken at placement.
     *
     * @return the new order id
     * @throws InvalidOrderException if quantity is not positive, price is negative or the initiator is blank
     */
    public long place(OrderSide side, String initiator, long quantity, long price) {
        if (side == null) {
            throw new InvalidOrderException("Order side must be specified");
        }
        if (initiator == null || initiator.isBlank()) {
            throw new InvalidOrderException("Order initiator must be specified");
        }
        if (quantity <= 0) {
            throw new InvalidOrderException("Quantity must be positive: " + quantity);
        }
        if (price < 0) {
            throw new InvalidOrderException("Price must not be negative: " + price);
        }

        Order order = Order.place(side, initiator, quantity, price);
        long orderId = orderStore.insert(order);

        log.info("Order placed: orderId={}, side={}, initiator={}, quantity={}, price={}",
                orderId, side, initiator, quantity, price);
        return orderId;
    }

    /**
     * Try to pair a buy order with the first compatible sell order in the book.
     * Finding no candidate is not an error; the buy order stays unmatched.
     *
     * @param buyOrderId the buy order to match
     * @return the match outcome
     */
    public MatchResult match(long buyOrderId) {
        Order buyOrder = findOrder(buyOrderId);

        if (!buyOrder.isBuyOrder()) {
            throw new InvalidOrderException("Order " + buyOrderId + " is not a buy order");
        }
        if (buyOrder.isExecuted()) {
            throw new OrderAlreadyExecutedException(buyOrderId);
        }
        if (buyOrder.isMatched() || buyOrder.getSeller() != null) {
            throw new OrderAlreadyMatchedException(buyOrderId, buyOrder.getMatchedOrderId());
        }

        log.debug("Scanning book for sell order: buyOrderId={}, quantity={}, maxPrice={}",
                buyOrderId, buyOrder.getQuantity(), buyOrder.getPrice());

        for (Order candidate : orderStore.findAll()) {
            if (!isCompatibleSellOrder(buyOrder, candidate)) {
                continue;
            }

            candidate.recordMatch(buyOrder);
            buyOrder.recordMatch(candidate);

            log.info("Orders matched: buyOrderId={}, sellOrderId={}, buyer={}, seller={}, quantity={}, settlementPrice={}",
                    buyOrderId, candidate.getOrderId(), buyOrder.getBuyer(), candidate.getSeller(),
                    buyOrder.getQuantity(), buyOrder.getPrice());

            eventPublisher.publish(MarketEvent.matchConfirmed(buyOrderId, candidate.getOrderId(),
                    buyOrder.getBuyer(), buyOrder.getSeller(), buyOrder.getQuantity(), buyOrder.getPrice()));

            return MatchResult.of(buyOrder, candidate);
        }

        log.debug("No sell order matches buyOrderId={}", buyOrderId);
        return MatchResult.noMatch(buyOrderId);
    }

    private boolean isCompatibleSellOrder(Order buyOrder, Order candidate) {
        return candidate.isOpenSellOrder()
                && candidate.getQuantity() == buyOrder.getQuantity()
                && candidate.getPrice() <= buyOrder.getPrice();
    }

    /**
     * Settle a matched order: transfer quantity x settlement price from the
     * buyer's payment to the seller and mark both linked orders executed.
     *
     * @param orderId either leg of a matched pair
     * @param payment value tendered by the caller; must exceed the settlement amount
     * @param caller  identity of the caller; must be the order's buyer
     * @return settlement details
     * @throws SettlementFailedException if the transfer fails; order state is unchanged
     *                                   but the payment stays in escrow
     */
    public SettlementResult execute(long orderId, long payment, String caller) {
        Order order = findOrder(orderId);

        if (!order.isMatched()) {
            throw new OrderNotMatchedException(orderId);
        }
        if (order.isExecuted()) {
            throw new OrderAlreadyExecutedException(orderId);
        }
        if (caller == null || !caller.equals(order.getBuyer())) {
            throw new NotAuthorizedException("Only the buyer of order " + orderId + " may execute it");
        }

        long amount;
        try {
            amount = order.getSettlementAmount();
        } catch (ArithmeticException e) {
            throw new InvalidOrderException("Settlement amount of order " + orderId + " overflows");
        }
        if (payment <= amount) {
            throw new InsufficientPaymentException(
                    "Payment " + payment + " must exceed settlement amount " + amount + " for order " + orderId);
        }
        if (!ledger.canReceive(payment)) {
            throw new InvalidOrderException("Payment " + payment + " for order " + orderId
                    + " exceeds the remaining escrow capacity");
        }

        Order counterpart = findOrder(order.getMatchedOrderId());
        if (counterpart.isExecuted() || !Long.valueOf(orderId).equals(counterpart.getMatchedOrderId())) {
            throw new IllegalStateException("Order " + orderId + " is not consistently linked to order "
                    + counterpart.getOrderId());
        }

        ledger.receive(caller, payment);
        eventPublisher.publish(MarketEvent.paymentReceived(caller, payment));

        if (!settlementGateway.transfer(order.getSeller(), amount)) {
            log.warn("Settlement transfer failed: orderId={}, seller={}, amount={}, strandedPayment={}",
                    orderId, order.getSeller(), amount, payment);
            throw new SettlementFailedException(orderId, order.getSeller(), amount, payment);
        }

        order.markExecuted();
        counterpart.markExecuted();

        eventPublisher.publish(MarketEvent.paymentSent(order.getSeller(), amount));

        log.info("Orders executed: orderId={}, counterpartOrderId={}, buyer={}, seller={}, amount={}, retainedExcess={}",
                orderId, counterpart.getOrderId(), order.getBuyer(), order.getSeller(), amount, payment - amount);

        return SettlementResult.builder()
                .orderId(orderId)
                .counterpartOrderId(counterpart.getOrderId())
                .buyer(order.getBuyer())
                .seller(order.getSeller())
                .amountTransferred(amount)
                .paymentReceived(payment)
                .retainedExcess(payment - amount)
                .build();
    }

    /**
     * Snapshot of an order
     *
     * @throws OrderNotFoundException if the id is outside the book
     */
    public Order getOrder(long orderId) {
        return findOrder(orderId).snapshot();
    }

    private Order findOrder(long orderId) {
        return orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    public long getOrderCount() {
        return orderStore.count();
    }

    /**
     * Snapshots of all orders in placement order
     */
    public List<Order> getOrders() {
        return orderStore.findAll().stream()
                .map(Order::snapshot)
                .collect(Collectors.toList());
    }

    /**
     * Ids of buy orders that are neither matched nor executed, lowest first
     */
    public List<Long> findUnmatchedBuyOrderIds() {
        return orderStore.findAll().stream()
                .filter(Order::isOpenBuyOrder)
                .map(Order::getOrderId)
                .collect(Collectors.toList());
    }
}
