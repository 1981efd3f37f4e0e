package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.FillResult;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the trade controls in their declared order and stops at the first rejection.
 */
@Component
public class TradeControlList {
    @Autowired
    private List<TradeControl> controlList;

    public TradeOutcome canStartFill(TradeContext context) {
        for (TradeControl control : controlList) {
            TradeOutcome outcome = control.canStartFill(context);
            if (outcome != TradeOutcome.OK)
                return outcome;
        }
        return TradeOutcome.OK;
    }

    public TradeOutcome canAcceptFill(TradeContext context, FillResult result) {
        for (TradeControl control : controlList) {
            TradeOutcome outcome = control.canAcceptFill(context, result);
            if (outcome != TradeOutcome.OK)
                return outcome;
        }
        return TradeOutcome.OK;
    }
}
