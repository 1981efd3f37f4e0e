package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.Address;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Public key recovery on secp256k1, following the semantics of the EVM
 * {@code ecrecover} precompile.
 */
public final class Secp256k1 {
    public static final ECDomainParameters CURVE;
    public static final BigInteger HALF_CURVE_ORDER;

    static {
        X9ECParameters params = CustomNamedCurves.getByName("secp256k1");
        CURVE = new ECDomainParameters(params.getCurve(), params.getG(), params.getN(), params.getH());
        HALF_CURVE_ORDER = params.getN().shiftRight(1);
    }

    private Secp256k1() {
    }

    /**
     * Recovers the 64-byte uncompressed public key (without the 0x04 prefix)
     * that produced {@code (r, s)} over {@code messageHash}.
     *
     * @param recId recovery id, 0 or 1
     * @return the public key, or {@code null} when no key can be recovered
     */
    public static byte[] recoverPublicKey(int recId, BigInteger r, BigInteger s, byte[] messageHash) {
        BigInteger n = CURVE.getN();
        if (recId < 0 || recId > 1)
            return null;
        if (r.signum() <= 0 || r.compareTo(n) >= 0 || s.signum() <= 0 || s.compareTo(n) >= 0)
            return null;

        BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
        if (r.compareTo(prime) >= 0)
            return null;
        ECPoint point;
        try {
            point = decompressKey(r, recId == 1);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (!point.multiply(n).isInfinity())
            return null;

        BigInteger e = new BigInteger(1, messageHash);
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, point, srInv).normalize();
        if (q.isInfinity())
            return null;
        byte[] encoded = q.getEncoded(false);
        return Arrays.copyOfRange(encoded, 1, encoded.length);
    }

    public static byte[] publicKeyOf(BigInteger privateKey) {
        byte[] encoded = new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKey).normalize().getEncoded(false);
        return Arrays.copyOfRange(encoded, 1, encoded.length);
    }

    public static Address toAddress(byte[] publicKey) {
        byte[] hash = Keccak.keccak256(publicKey);
        return Address.wrap(Arrays.copyOfRange(hash, hash.length - Address.LENGTH, hash.length));
    }

    private static ECPoint decompressKey(BigInteger x, boolean yBit) {
        X9IntegerConverter converter = new X9IntegerConverter();
        byte[] compressed = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
        compressed[0] = (byte) (yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compressed);
    }
}
