package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.FillResult;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;

public interface TradeControl {
    default TradeOutcome canStartFill(TradeContext context) { return TradeOutcome.OK; }
    default TradeOutcome canAcceptFill(TradeContext context, FillResult result) { return TradeOutcome.OK; }
}
