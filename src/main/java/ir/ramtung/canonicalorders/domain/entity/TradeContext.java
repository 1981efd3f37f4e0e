package ir.ramtung.canonicalorders.domain.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * One fill attempt as seen by the trade controls: the ledger's view of the trade
 * plus the decoded order.
 */
@Builder
@Getter
@ToString
public class TradeContext {
    private final BigInteger inputMarketId;
    private final BigInteger outputMarketId;
    private final AccountInfo makerAccount;
    private final AccountInfo takerAccount;
    private final Wei oldInputPar;
    private final Wei newInputPar;
    private final Wei inputWei;
    private final OrderInfo orderInfo;

    public Order getOrder() {
        return orderInfo.getOrder();
    }

    public TradeArgs getTradeArgs() {
        return orderInfo.getTradeArgs();
    }

    public OrderHash getOrderHash() {
        return orderInfo.getOrderHash();
    }

    public boolean isQuoteInput() {
        return getOrder().getQuoteMarket().equals(inputMarketId);
    }
}
