package ir.ramtung.canonicalorders.testutil;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.SignatureType;
import ir.ramtung.canonicalorders.domain.entity.TypedSignature;
import ir.ramtung.canonicalorders.domain.service.Keccak;
import ir.ramtung.canonicalorders.domain.service.Secp256k1;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Signs order hashes the way a wallet would, with deterministic RFC 6979 nonces.
 */
public final class OrderSigner {
    private static final byte[] PREPEND_DECIMAL = "\u0019Ethereum Signed Message:\n32".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PREPEND_HEX = "\u0019Ethereum Signed Message:\n ".getBytes(StandardCharsets.UTF_8);

    private OrderSigner() {
    }

    public static Address addressOf(BigInteger privateKey) {
        return Secp256k1.toAddress(Secp256k1.publicKeyOf(privateKey));
    }

    public static TypedSignature sign(OrderHash hash, BigInteger privateKey) {
        return sign(hash, privateKey, SignatureType.NO_PREPEND);
    }

    public static TypedSignature sign(OrderHash hash, BigInteger privateKey, SignatureType type) {
        byte[] digest = switch (type) {
            case NO_PREPEND -> hash.toBytes();
            case DECIMAL -> Keccak.keccak256(PREPEND_DECIMAL, hash.toBytes());
            case HEXADECIMAL -> Keccak.keccak256(PREPEND_HEX, hash.toBytes());
            case INVALID -> throw new IllegalArgumentException("Cannot sign with an invalid signature type");
        };

        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, Secp256k1.CURVE));
        BigInteger[] components = signer.generateSignature(digest);
        BigInteger r = components[0];
        BigInteger s = components[1];
        if (s.compareTo(Secp256k1.HALF_CURVE_ORDER) > 0)
            s = Secp256k1.CURVE.getN().subtract(s);

        byte[] publicKey = Secp256k1.publicKeyOf(privateKey);
        for (int recId = 0; recId < 2; recId++) {
            if (Arrays.equals(publicKey, Secp256k1.recoverPublicKey(recId, r, s, digest)))
                return TypedSignature.of(r, s, 27 + recId, type);
        }
        throw new IllegalStateException("Could not find a recovery id for the signature");
    }
}
