package ir.ramtung.canonicalorders.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * The 32-byte typed hash that identifies an order.
 */
@EqualsAndHashCode
public final class OrderHash {
    public static final int LENGTH = 32;

    private final byte[] bytes;

    private OrderHash(byte[] bytes) {
        this.bytes = bytes;
    }

    public static OrderHash wrap(byte[] bytes) {
        if (bytes.length != LENGTH)
            throw new IllegalArgumentException("Order hash must be " + LENGTH + " bytes, got " + bytes.length);
        return new OrderHash(bytes.clone());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static OrderHash of(String hex) {
        String digits = StringUtils.removeStartIgnoreCase(hex, "0x");
        if (digits == null || digits.length() != LENGTH * 2)
            throw new IllegalArgumentException("Invalid order hash: " + hex);
        try {
            return new OrderHash(Hex.decode(digits));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid order hash: " + hex, e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toHex() {
        return "0x" + Hex.toHexString(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
