package ir.ramtung.canonicalorders.repository;

import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.OrderState;
import ir.ramtung.canonicalorders.domain.entity.OrderStatus;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

@Component
public class OrderStateRepository {
    private final HashMap<OrderHash, OrderStatus> statusByHash = new HashMap<>();
    private final HashMap<OrderHash, BigInteger> filledAmountByHash = new HashMap<>();
    private final StateJournal journal;

    public OrderStateRepository(StateJournal journal) {
        this.journal = journal;
    }

    public OrderStatus getStatus(OrderHash orderHash) {
        return statusByHash.getOrDefault(orderHash, OrderStatus.NULL);
    }

    public void setStatus(OrderHash orderHash, OrderStatus status) {
        OrderStatus previous = statusByHash.put(orderHash, status);
        journal.record(() -> restore(statusByHash, orderHash, previous));
    }

    public BigInteger getFilledAmount(OrderHash orderHash) {
        return filledAmountByHash.getOrDefault(orderHash, BigInteger.ZERO);
    }

    public void setFilledAmount(OrderHash orderHash, BigInteger filledAmount) {
        BigInteger previous = filledAmountByHash.put(orderHash, filledAmount);
        journal.record(() -> restore(filledAmountByHash, orderHash, previous));
    }

    public OrderState getOrderState(OrderHash orderHash) {
        return new OrderState(getStatus(orderHash), getFilledAmount(orderHash));
    }

    public void clear() {
        statusByHash.clear();
        filledAmountByHash.clear();
    }

    private static <V> void restore(Map<OrderHash, V> map, OrderHash key, V previous) {
        if (previous == null)
            map.remove(key);
        else
            map.put(key, previous);
    }
}
