package ir.ramtung.canonicalorders.domain.service.control;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
@org.springframework.core.annotation.Order(7)
public class MarketControl implements TradeControl {
    @Override
    public TradeOutcome canStartFill(TradeContext context) {
        Order order = context.getOrder();
        BigInteger input = context.getInputMarketId();
        BigInteger output = context.getOutputMarketId();
        boolean baseToQuote = order.getBaseMarket().equals(input) && order.getQuoteMarket().equals(output);
        boolean quoteToBase = order.getQuoteMarket().equals(input) && order.getBaseMarket().equals(output);
        return baseToQuote || quoteToBase ? TradeOutcome.OK : TradeOutcome.MARKET_MISMATCH;
    }
}
