package ir.ramtung.canonicalorders.domain.entity;

public enum CallFunctionType {
    APPROVE,
    CANCEL,
    SET_FILL_ARGS;

    public static CallFunctionType fromTag(int tag) {
        CallFunctionType[] types = values();
        if (tag < 0 || tag >= types.length)
            throw new IllegalArgumentException("Unknown call function type: " + tag);
        return types[tag];
    }

    public int tag() {
        return ordinal();
    }
}
