package energy.p2p.market.domain;

import energy.p2p.market.enums.OrderSide;
import energy.p2p.market.enums.OrderState;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Order entity representing one resting buy or sell intent for energy.
 * Fields other than the ones touched by {@link #recordMatch(Order)} and
 * {@link #markExecuted()} never change after placement.
 */
@Getter
@ToString
@Builder(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {
    /**
     * Position in the book, assigned by the store on insert
     */
    private Long orderId;

    /**
     * Side of the initiating party
     */
    private final OrderSide side;

    /**
     * Buyer identity; null until matched for a sell order
     */
    private String buyer;

    /**
     * Seller identity; null until matched for a buy order
     */
    private String seller;

    /**
     * Energy units, always positive
     */
    private final long quantity;

    /**
     * Unit price. A buy order adopts the seller's price when matched.
     */
    private long price;

    private boolean matched;

    private boolean executed;

    /**
     * Id of the paired order; null until matched
     */
    private Long matchedOrderId;

    private final LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Create a new unmatched order with the initiator on the given side
     */
    public static Order place(OrderSide side, String initiator, long quantity, long price) {
        LocalDateTime now = LocalDateTime.now();
        return Order.builder()
                .side(side)
                .buyer(side == OrderSide.BUY ? initiator : null)
                .seller(side == OrderSide.SELL ? initiator : null)
                .quantity(quantity)
                .price(price)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Assign the store position. Ids are immutable once set.
     */
    public void assignId(long orderId) {
        if (this.orderId != null) {
            throw new IllegalStateException("Order id already assigned: " + this.orderId);
        }
        this.orderId = orderId;
    }

    /**
     * Detached copy for readers outside the book; changes to it never reach the book
     */
    public Order snapshot() {
        return Order.builder()
                .orderId(orderId)
                .side(side)
                .buyer(buyer)
                .seller(seller)
                .quantity(quantity)
                .price(price)
                .matched(matched)
                .executed(executed)
                .matchedOrderId(matchedOrderId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    public boolean isBuyOrder() {
        return side == OrderSide.BUY;
    }

    /**
     * Sell order still waiting for a buyer
     */
    public boolean isOpenSellOrder() {
        return side == OrderSide.SELL && buyer == null && !matched;
    }

    /**
     * Buy order still waiting for a seller
     */
    public boolean isOpenBuyOrder() {
        return side == OrderSide.BUY && seller == null && !matched && !executed;
    }

    public String getInitiator() {
        return side == OrderSide.BUY ? buyer : seller;
    }

    public OrderState getState() {
        if (executed) {
            return OrderState.EXECUTED;
        }
        return matched ? OrderState.MATCHED : OrderState.PLACED;
    }

    /**
     * Amount owed for this order at its current price
     *
     * @throws ArithmeticException if quantity x price does not fit in a long
     */
    public long getSettlementAmount() {
        return Math.multiplyExact(quantity, price);
    }

    /**
     * Link this order to its counterparty. A buy order takes over the
     * counterpart's seller and price; a sell order takes over the buyer.
     */
    public void recordMatch(Order counterpart) {
        if (matched) {
            throw new IllegalStateException("Order " + orderId + " is already matched with " + matchedOrderId);
        }
        if (counterpart.getSide() == side) {
            throw new IllegalStateException("Cannot match order " + orderId + " with an order on the same side");
        }
        if (side == OrderSide.BUY) {
            this.seller = counterpart.getSeller();
            this.price = counterpart.getPrice();
        } else {
            this.buyer = counterpart.getBuyer();
        }
        this.matchedOrderId = counterpart.getOrderId();
        this.matched = true;
        this.updatedAt = LocalDateTime.now();
    }

    public void markExecuted() {
        if (!matched || executed) {
            throw new IllegalStateException("Order " + orderId + " cannot be executed in state " + getState());
        }
        this.executed = true;
        this.updatedAt = LocalDateTime.now();
    }
}
