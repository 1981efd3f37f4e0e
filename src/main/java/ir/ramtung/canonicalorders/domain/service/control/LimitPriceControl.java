package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
@org.springframework.core.annotation.Order(1)
public class LimitPriceControl implements TradeControl {
    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        BigInteger price = context.getTradeArgs().getPrice();
        boolean withinLimit = order.isBuy()
                ? price.compareTo(order.getLimitPrice()) <= 0
                : price.compareTo(order.getLimitPrice()) >= 0;
        return withinLimit ? TradeOutcome.OK : TradeOutcome.PRICE_OUT_OF_BOUNDS;
    }
}
