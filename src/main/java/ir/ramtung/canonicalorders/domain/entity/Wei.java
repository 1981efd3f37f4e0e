package ir.ramtung.canonicalorders.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigInteger;

/**
 * A signed balance or balance change in a market's native unit.
 */
@EqualsAndHashCode
public final class Wei {
    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    private final BigInteger value;

    private Wei(BigInteger value) {
        this.value = value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Wei of(BigInteger value) {
        return new Wei(value);
    }

    public static Wei of(long value) {
        return new Wei(BigInteger.valueOf(value));
    }

    public static Wei of(boolean positive, BigInteger magnitude) {
        return new Wei(positive ? magnitude : magnitude.negate());
    }

    @JsonValue
    public BigInteger value() {
        return value;
    }

    public BigInteger magnitude() {
        return value.abs();
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean hasSameSignAs(Wei other) {
        return value.signum() == other.value.signum();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
