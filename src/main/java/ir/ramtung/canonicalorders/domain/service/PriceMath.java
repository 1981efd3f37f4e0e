package ir.ramtung.canonicalorders.domain.service;

import java.math.BigInteger;

public final class PriceMath {
    public static final BigInteger PRICE_BASE = BigInteger.TEN.pow(18);

    private PriceMath() {
    }

    /**
     * {@code target * numerator / denominator}, rounded down.
     */
    public static BigInteger getPartial(BigInteger target, BigInteger numerator, BigInteger denominator) {
        return target.multiply(numerator).divide(denominator);
    }
}
