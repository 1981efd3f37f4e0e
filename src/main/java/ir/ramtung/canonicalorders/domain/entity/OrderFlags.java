package ir.ramtung.canonicalorders.domain.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * The flags word of an order, decoded once: bit 0 is buy, bit 1 decrease-only,
 * bit 2 negative fee, bit 3 is reserved and the remaining high bits hold the salt.
 * Every bit survives the round trip so that the word hashes exactly as it was signed.
 */
@Builder
@Getter
@EqualsAndHashCode
@ToString
public class OrderFlags {
    private static final int IS_BUY_BIT = 0;
    private static final int IS_DECREASE_ONLY_BIT = 1;
    private static final int IS_NEGATIVE_FEE_BIT = 2;
    private static final int RESERVED_BIT = 3;
    private static final int SALT_SHIFT = 4;

    @Builder.Default
    private final BigInteger salt = BigInteger.ZERO;
    private final boolean buy;
    private final boolean decreaseOnly;
    private final boolean negativeFee;
    private final boolean reserved;

    public static OrderFlags fromWord(BigInteger word) {
        return OrderFlags.builder()
                .salt(word.shiftRight(SALT_SHIFT))
                .buy(word.testBit(IS_BUY_BIT))
                .decreaseOnly(word.testBit(IS_DECREASE_ONLY_BIT))
                .negativeFee(word.testBit(IS_NEGATIVE_FEE_BIT))
                .reserved(word.testBit(RESERVED_BIT))
                .build();
    }

    public BigInteger toWord() {
        BigInteger word = salt.shiftLeft(SALT_SHIFT);
        if (buy)
            word = word.setBit(IS_BUY_BIT);
        if (decreaseOnly)
            word = word.setBit(IS_DECREASE_ONLY_BIT);
        if (negativeFee)
            word = word.setBit(IS_NEGATIVE_FEE_BIT);
        if (reserved)
            word = word.setBit(RESERVED_BIT);
        return word;
    }
}
