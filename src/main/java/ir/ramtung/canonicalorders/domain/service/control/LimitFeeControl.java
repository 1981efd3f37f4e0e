package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeArgs;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.stereotype.Component;

/**
 * An order asking for a rebate only accepts rebates at least as large as its limit.
 * Any other order accepts a fee up to its limit, or any rebate.
 */
@Component
@org.springframework.core.annotation.Order(2)
public class LimitFeeControl implements TradeControl {
    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        TradeArgs tradeArgs = context.getTradeArgs();
        boolean withinLimit;
        if (order.isNegativeFee())
            withinLimit = tradeArgs.isNegativeFee() && tradeArgs.getFee().compareTo(order.getLimitFee()) >= 0;
        else
            withinLimit = tradeArgs.isNegativeFee() || tradeArgs.getFee().compareTo(order.getLimitFee()) <= 0;
        return withinLimit ? TradeOutcome.OK : TradeOutcome.FEE_OUT_OF_BOUNDS;
    }
}
