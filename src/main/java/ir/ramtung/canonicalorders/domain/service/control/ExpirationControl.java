package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;

@Component
@org.springframework.core.annotation.Order(4)
public class ExpirationControl implements TradeControl {
    private final Clock clock;

    public ExpirationControl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        if (!order.hasExpiration())
            return TradeOutcome.OK;
        BigInteger now = BigInteger.valueOf(clock.instant().getEpochSecond());
        return order.getExpiration().compareTo(now) >= 0 ? TradeOutcome.OK : TradeOutcome.EXPIRED;
    }
}
