package ir.ramtung.canonicalorders.domain.entity;

public enum OrderStatus {
    NULL,
    APPROVED,
    CANCELED
}
