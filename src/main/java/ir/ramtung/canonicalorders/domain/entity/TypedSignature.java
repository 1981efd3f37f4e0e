package ir.ramtung.canonicalorders.domain.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * A detached signature in its 66-byte wire form: r, s, v and the signature type.
 */
@EqualsAndHashCode
public final class TypedSignature {
    public static final int LENGTH = 66;
    private static final int V_OFFSET = 64;
    private static final int TYPE_OFFSET = 65;

    private final byte[] bytes;
    @Getter
    private final SignatureType type;

    private TypedSignature(byte[] bytes) {
        this.bytes = bytes;
        this.type = SignatureType.fromByte(bytes[TYPE_OFFSET]);
    }

    public static TypedSignature wrap(byte[] bytes) {
        if (bytes.length != LENGTH)
            throw new IllegalArgumentException("Typed signature must be " + LENGTH + " bytes, got " + bytes.length);
        return new TypedSignature(bytes.clone());
    }

    public static TypedSignature of(BigInteger r, BigInteger s, int v, SignatureType type) {
        byte[] bytes = new byte[LENGTH];
        System.arraycopy(toWord(r), 0, bytes, 0, 32);
        System.arraycopy(toWord(s), 0, bytes, 32, 32);
        bytes[V_OFFSET] = (byte) v;
        bytes[TYPE_OFFSET] = type.toByte();
        return new TypedSignature(bytes);
    }

    private static byte[] toWord(BigInteger value) {
        return BigIntegers.asUnsignedByteArray(32, value);
    }

    public BigInteger getR() {
        return new BigInteger(1, Arrays.copyOfRange(bytes, 0, 32));
    }

    public BigInteger getS() {
        return new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
    }

    public int getV() {
        return bytes[V_OFFSET] & 0xff;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public String toString() {
        return "0x" + Hex.toHexString(bytes);
    }
}
