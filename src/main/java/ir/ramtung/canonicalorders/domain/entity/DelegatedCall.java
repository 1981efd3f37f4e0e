package ir.ramtung.canonicalorders.domain.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An order management call relayed by the ledger on behalf of an account:
 * approve or cancel an order, or stage trade args for the next fill.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DelegatedCall {
    private final CallFunctionType type;
    private final Order order;
    private final TradeArgs tradeArgs;

    private DelegatedCall(CallFunctionType type, Order order, TradeArgs tradeArgs) {
        this.type = type;
        this.order = order;
        this.tradeArgs = tradeArgs;
    }

    public static DelegatedCall approve(Order order) {
        return new DelegatedCall(CallFunctionType.APPROVE, order, null);
    }

    public static DelegatedCall cancel(Order order) {
        return new DelegatedCall(CallFunctionType.CANCEL, order, null);
    }

    public static DelegatedCall setFillArgs(TradeArgs tradeArgs) {
        return new DelegatedCall(CallFunctionType.SET_FILL_ARGS, null, tradeArgs);
    }
}
