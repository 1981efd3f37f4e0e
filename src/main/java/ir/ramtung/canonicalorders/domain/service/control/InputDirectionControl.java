package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import org.springframework.stereotype.Component;

/**
 * The maker's input balance must grow when it receives the asset it is buying and
 * shrink when it gives up the asset it is selling.
 */
@Component
@org.springframework.core.annotation.Order(8)
public class InputDirectionControl implements TradeControl {
    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        Wei inputWei = context.getInputWei();
        if (inputWei.isZero())
            return TradeOutcome.ZERO_INPUT;
        boolean expectPositive = order.getBaseMarket().equals(context.getInputMarketId()) == order.isBuy();
        return inputWei.isPositive() == expectPositive ? TradeOutcome.OK : TradeOutcome.DIRECTION_MISMATCH;
    }
}
