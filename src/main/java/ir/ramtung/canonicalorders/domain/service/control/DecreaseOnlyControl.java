package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.FillResult;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import ir.ramtung.canonicalorders.domain.service.MarginLedger;
import org.springframework.stereotype.Component;

/**
 * A decrease-only fill may move either of the maker's positions toward zero but
 * never past it or away from it. The output side is judged against the balance the
 * ledger reports before this fill is applied.
 */
@Component
@org.springframework.core.annotation.Order(9)
public class DecreaseOnlyControl implements TradeControl {
    private final MarginLedger marginLedger;

    public DecreaseOnlyControl(MarginLedger marginLedger) {
        this.marginLedger = marginLedger;
    }

    @Override
    public TradeOutcome canAcceptFill(TradeContext context, FillResult result) {
        if (!context.getOrder().isDecreaseOnly())
            return TradeOutcome.OK;
        if (!inputMarketDecreased(context.getOldInputPar(), context.getNewInputPar()))
            return TradeOutcome.DECREASE_VIOLATION;
        Wei oldOutputWei = marginLedger.getAccountWei(context.getMakerAccount(), context.getOutputMarketId());
        if (!outputMarketDecreased(oldOutputWei, result.getOutputWei()))
            return TradeOutcome.DECREASE_VIOLATION;
        return TradeOutcome.OK;
    }

    private static boolean inputMarketDecreased(Wei oldInputPar, Wei newInputPar) {
        return newInputPar.isZero()
                || (newInputPar.magnitude().compareTo(oldInputPar.magnitude()) <= 0 && newInputPar.hasSameSignAs(oldInputPar));
    }

    private static boolean outputMarketDecreased(Wei oldOutputWei, Wei outputWei) {
        return outputWei.isZero()
                || (outputWei.magnitude().compareTo(oldOutputWei.magnitude()) <= 0 && !outputWei.hasSameSignAs(oldOutputWei));
    }
}
