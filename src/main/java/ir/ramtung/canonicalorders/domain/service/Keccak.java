package ir.ramtung.canonicalorders.domain.service;

import org.bouncycastle.jcajce.provider.digest.Keccak.Digest256;

import java.nio.charset.StandardCharsets;

public final class Keccak {
    private Keccak() {
    }

    public static byte[] keccak256(byte[]... parts) {
        Digest256 digest = new Digest256();
        for (byte[] part : parts)
            digest.update(part);
        return digest.digest();
    }

    public static byte[] keccak256(String text) {
        return keccak256(text.getBytes(StandardCharsets.UTF_8));
    }
}
