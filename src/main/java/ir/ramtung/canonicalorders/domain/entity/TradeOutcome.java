package ir.ramtung.canonicalorders.domain.entity;

public enum TradeOutcome {
    OK,
    MODULE_INACTIVE,
    DECODE_ERROR,
    INVALID_SIGNATURE,
    ORDER_CANCELED,
    STALE_TRADE_ARGS,
    PRICE_OUT_OF_BOUNDS,
    FEE_OUT_OF_BOUNDS,
    NOT_TRIGGERED,
    PRICE_UNAVAILABLE,
    EXPIRED,
    ACCOUNT_MISMATCH,
    TAKER_MISMATCH,
    MARKET_MISMATCH,
    DIRECTION_MISMATCH,
    ZERO_INPUT,
    OVERFILL,
    DECREASE_VIOLATION,
    UNAUTHORIZED
}
