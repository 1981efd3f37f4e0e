package ir.ramtung.canonicalorders.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * An order together with the trade terms of the current fill attempt and its hash.
 * Built once per fill and never stored.
 */
@Getter
@AllArgsConstructor
@ToString
public class OrderInfo {
    private final Order order;
    private final TradeArgs tradeArgs;
    private final OrderHash orderHash;
}
