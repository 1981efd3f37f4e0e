package ir.ramtung.canonicalorders.messaging.codec;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.messaging.Message;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import org.bouncycastle.util.BigIntegers;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Reads and writes 32-byte ABI words with the same strictness as the ABI decoder:
 * addresses, uint128 and booleans must not carry dirty high bits.
 */
public final class AbiWords {
    public static final int WORD = 32;
    private static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger UINT128_LIMIT = BigInteger.ONE.shiftLeft(128);

    private AbiWords() {
    }

    public static byte[] uint256(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(UINT256_LIMIT) >= 0)
            throw new IllegalArgumentException("Value does not fit in uint256: " + value);
        return BigIntegers.asUnsignedByteArray(WORD, value);
    }

    public static byte[] uint128(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(UINT128_LIMIT) >= 0)
            throw new IllegalArgumentException("Value does not fit in uint128: " + value);
        return BigIntegers.asUnsignedByteArray(WORD, value);
    }

    public static byte[] address(Address address) {
        byte[] word = new byte[WORD];
        System.arraycopy(address.toBytes(), 0, word, WORD - Address.LENGTH, Address.LENGTH);
        return word;
    }

    public static byte[] bool(boolean value) {
        byte[] word = new byte[WORD];
        word[WORD - 1] = (byte) (value ? 1 : 0);
        return word;
    }

    public static Writer writer() {
        return new Writer();
    }

    public static Reader reader(byte[] data, int offset) {
        return new Reader(data, offset);
    }

    public static final class Writer {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        private Writer() {
        }

        public Writer word(byte[] word) {
            out.writeBytes(word);
            return this;
        }

        public Writer uint256(BigInteger value) {
            return word(AbiWords.uint256(value));
        }

        public Writer uint128(BigInteger value) {
            return word(AbiWords.uint128(value));
        }

        public Writer address(Address address) {
            return word(AbiWords.address(address));
        }

        public Writer bool(boolean value) {
            return word(AbiWords.bool(value));
        }

        public Writer raw(byte[] bytes) {
            out.writeBytes(bytes);
            return this;
        }

        public byte[] toBytes() {
            return out.toByteArray();
        }
    }

    public static final class Reader {
        private final byte[] data;
        private int offset;

        private Reader(byte[] data, int offset) {
            this.data = data;
            this.offset = offset;
        }

        private byte[] next() throws InvalidRequestException {
            if (offset + WORD > data.length)
                throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_ORDER_DATA_LENGTH);
            byte[] word = Arrays.copyOfRange(data, offset, offset + WORD);
            offset += WORD;
            return word;
        }

        private static void requireClean(byte[] word, int cleanBytes) throws InvalidRequestException {
            for (int i = 0; i < cleanBytes; i++) {
                if (word[i] != 0)
                    throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_ABI_WORD);
            }
        }

        public BigInteger uint256() throws InvalidRequestException {
            return new BigInteger(1, next());
        }

        public BigInteger uint128() throws InvalidRequestException {
            byte[] word = next();
            requireClean(word, WORD / 2);
            return new BigInteger(1, word);
        }

        public Address address() throws InvalidRequestException {
            byte[] word = next();
            requireClean(word, WORD - Address.LENGTH);
            return Address.wrap(Arrays.copyOfRange(word, WORD - Address.LENGTH, WORD));
        }

        public boolean bool() throws InvalidRequestException {
            byte[] word = next();
            requireClean(word, WORD - 1);
            if (word[WORD - 1] != 0 && word[WORD - 1] != 1)
                throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_ABI_WORD);
            return word[WORD - 1] == 1;
        }
    }
}
