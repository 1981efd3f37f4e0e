package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.domain.service.MarginLedger;
import ir.ramtung.canonicalorders.domain.service.PriceMath;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
@org.springframework.core.annotation.Order(3)
public class TriggerPriceControl implements TradeControl {
    private final MarginLedger marginLedger;

    public TriggerPriceControl(MarginLedger marginLedger) {
        this.marginLedger = marginLedger;
    }

    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        if (!order.isTriggered())
            return TradeOutcome.OK;
        BigInteger currentPrice = getCurrentPrice(order.getBaseMarket(), order.getQuoteMarket());
        if (currentPrice == null)
            return TradeOutcome.PRICE_UNAVAILABLE;
        boolean triggered = order.isBuy()
                ? currentPrice.compareTo(order.getTriggerPrice()) >= 0
                : currentPrice.compareTo(order.getTriggerPrice()) <= 0;
        return triggered ? TradeOutcome.OK : TradeOutcome.NOT_TRIGGERED;
    }

    /**
     * Price of the base market in units of the quote market, scaled by 10^18;
     * null when either price is missing or the quote price is zero.
     */
    public BigInteger getCurrentPrice(BigInteger baseMarket, BigInteger quoteMarket) {
        BigInteger basePrice = marginLedger.findMarketPrice(baseMarket);
        BigInteger quotePrice = marginLedger.findMarketPrice(quoteMarket);
        if (basePrice == null || quotePrice == null || quotePrice.signum() == 0)
            return null;
        return PriceMath.getPartial(basePrice, PriceMath.PRICE_BASE, quotePrice);
    }
}
