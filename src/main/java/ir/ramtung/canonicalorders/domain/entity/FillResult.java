package ir.ramtung.canonicalorders.domain.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * The outcome of an accepted fill: the maker's output delta to apply on the ledger
 * and the order's fill bookkeeping after this fill.
 */
@Builder
@Getter
@EqualsAndHashCode
@ToString
public class FillResult {
    private final OrderHash orderHash;
    private final Address orderMaker;
    private final Wei outputWei;
    private final BigInteger fillAmount;
    private final BigInteger totalFilledAmount;
    private final boolean buy;
    private final TradeArgs tradeArgs;
}
