package energy.p2p.market.store;

import energy.p2p.market.domain.Order;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for orders. Ids are insertion positions starting at 0;
 * orders are never removed and ids are never reused.
 */
public interface OrderStore {

    /**
     * Append an order and assign its id
     *
     * @param order order without an id
     * @return the assigned id
     */
    long insert(Order order);

    Optional<Order> findById(long orderId);

    long count();

    /**
     * All orders in insertion order
     */
    List<Order> findAll();
}
