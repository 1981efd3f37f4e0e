package ir.ramtung.canonicalorders.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * A 20-byte account address, kept in lower-case hex form.
 */
@EqualsAndHashCode
public final class Address {
    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Address wrap(byte[] bytes) {
        if (bytes.length != LENGTH)
            throw new IllegalArgumentException("Address must be " + LENGTH + " bytes, got " + bytes.length);
        return new Address(bytes.clone());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address of(String hex) {
        String digits = StringUtils.removeStartIgnoreCase(hex, "0x");
        if (digits == null || digits.length() != LENGTH * 2)
            throw new IllegalArgumentException("Invalid address: " + hex);
        try {
            return new Address(Hex.decode(digits));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid address: " + hex, e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        return Arrays.equals(bytes, ZERO.bytes);
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
