package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.TypedSignature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
public class SignatureVerifier {
    private static final byte[] PREPEND_DECIMAL = "\u0019Ethereum Signed Message:\n32".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PREPEND_HEX = "\u0019Ethereum Signed Message:\n\u0020".getBytes(StandardCharsets.UTF_8);

    /**
     * Recovers the signer of {@code hash}, honoring the signature type byte.
     * Returns the zero address when recovery fails.
     */
    public Address recover(OrderHash hash, TypedSignature signature) {
        byte[] signedHash = switch (signature.getType()) {
            case NO_PREPEND -> hash.toBytes();
            case DECIMAL -> Keccak.keccak256(PREPEND_DECIMAL, hash.toBytes());
            case HEXADECIMAL -> Keccak.keccak256(PREPEND_HEX, hash.toBytes());
            case INVALID -> null;
        };
        if (signedHash == null)
            return Address.ZERO;

        int v = signature.getV();
        if (v != 27 && v != 28)
            return Address.ZERO;
        byte[] publicKey = Secp256k1.recoverPublicKey(v - 27, signature.getR(), signature.getS(), signedHash);
        if (publicKey == null)
            return Address.ZERO;
        return Secp256k1.toAddress(publicKey);
    }

    public boolean isSignedBy(OrderHash hash, TypedSignature signature, Address signer) {
        if (signature == null || signer.isZero())
            return false;
        return recover(hash, signature).equals(signer);
    }
}
