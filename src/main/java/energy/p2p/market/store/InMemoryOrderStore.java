package energy.p2p.market.store;

import energy.p2p.market.domain.Order;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Order arena backed by a list; the list index is the order id.
 * Not thread-safe, callers serialize access.
 */
@Slf4j
public class InMemoryOrderStore implements OrderStore {

    private final List<Order> orders = new ArrayList<>();

    @Override
    public long insert(Order order) {
        long orderId = orders.size();
        order.assignId(orderId);
        orders.add(order);
        log.debug("Order stored: orderId={}, side={}", orderId, order.getSide());
        return orderId;
    }

    @Override
    public Optional<Order> findById(long orderId) {
        if (orderId < 0 || orderId >= orders.size()) {
            return Optional.empty();
        }
        return Optional.of(orders.get((int) orderId));
    }

    @Override
    public long count() {
        return orders.size();
    }

    @Override
    public List<Order> findAll() {
        return Collections.unmodifiableList(orders);
    }
}
