package ir.ramtung.canonicalorders.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Execution terms proposed for one fill: price and fee rate, both scaled by 10^18.
 */
@Builder
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TradeArgs {
    public static final TradeArgs EMPTY = new TradeArgs(BigInteger.ZERO, BigInteger.ZERO, false);

    private final BigInteger price;
    @Builder.Default
    private final BigInteger fee = BigInteger.ZERO;
    private final boolean negativeFee;

    public boolean isEmpty() {
        return price.signum() == 0;
    }
}
