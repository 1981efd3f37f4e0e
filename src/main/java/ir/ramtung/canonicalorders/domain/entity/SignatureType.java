package ir.ramtung.canonicalorders.domain.entity;

public enum SignatureType {
    NO_PREPEND,
    DECIMAL,
    HEXADECIMAL,
    INVALID;

    public static SignatureType fromByte(byte b) {
        return switch (b) {
            case 0 -> NO_PREPEND;
            case 1 -> DECIMAL;
            case 2 -> HEXADECIMAL;
            default -> INVALID;
        };
    }

    public byte toByte() {
        if (this == INVALID)
            throw new IllegalStateException("Invalid signature type has no wire value");
        return (byte) ordinal();
    }
}
