package ir.ramtung.canonicalorders.domain.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
@Getter
public class Order {
    private final OrderFlags flags;
    private final BigInteger baseMarket;
    private final BigInteger quoteMarket;
    private final BigInteger amount;
    private final BigInteger limitPrice;
    @Builder.Default
    private final BigInteger triggerPrice = BigInteger.ZERO;
    @Builder.Default
    private final BigInteger limitFee = BigInteger.ZERO;
    private final Address makerAccountOwner;
    @Builder.Default
    private final BigInteger makerAccountNumber = BigInteger.ZERO;
    @Builder.Default
    private final Address taker = Address.ZERO;
    @Builder.Default
    private final BigInteger expiration = BigInteger.ZERO;

    public boolean isBuy() {
        return flags.isBuy();
    }

    public boolean isDecreaseOnly() {
        return flags.isDecreaseOnly();
    }

    public boolean isNegativeFee() {
        return flags.isNegativeFee();
    }

    public boolean isTriggered() {
        return triggerPrice.signum() > 0;
    }

    public boolean hasExpiration() {
        return expiration.signum() != 0;
    }

    public boolean isTakerRestricted() {
        return !taker.isZero();
    }

    public AccountInfo getMakerAccount() {
        return new AccountInfo(makerAccountOwner, makerAccountNumber);
    }
}
