package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.AccountInfo;
import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.stereotype.Component;

@Component
@org.springframework.core.annotation.Order(5)
public class MakerAccountControl implements TradeControl {
    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        AccountInfo makerAccount = context.getMakerAccount();
        if (order.getMakerAccountOwner().equals(makerAccount.getOwner())
                && order.getMakerAccountNumber().equals(makerAccount.getNumber()))
            return TradeOutcome.OK;
        return TradeOutcome.ACCOUNT_MISMATCH;
    }
}
