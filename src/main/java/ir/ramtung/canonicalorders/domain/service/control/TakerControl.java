package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.stereotype.Component;

@Component
@org.springframework.core.annotation.Order(6)
public class TakerControl implements TradeControl {
    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        if (!order.isTakerRestricted() || order.getTaker().equals(context.getTakerAccount().getOwner()))
            return TradeOutcome.OK;
        return TradeOutcome.TAKER_MISMATCH;
    }
}
