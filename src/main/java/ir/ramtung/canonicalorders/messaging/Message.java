package ir.ramtung.canonicalorders.messaging;

public class Message {
    public static final String MODULE_NOT_OPERATIONAL = "Contract is not operational";
    public static final String INVALID_ORDER_DATA_LENGTH = "Cannot parse order from data";
    public static final String INVALID_CALL_DATA = "Cannot parse call function data";
    public static final String INVALID_HEX_DATA = "Data is not a hex string";
    public static final String INVALID_ABI_WORD = "Malformed ABI word in order data";
    public static final String ORDER_INVALID_SIGNATURE = "Order invalid signature";
    public static final String ORDER_CANCELED = "Order canceled";
    public static final String CANNOT_APPROVE_CANCELED_ORDER = "Cannot approve canceled order";
    public static final String CANNOT_TAKE_EMPTY_ORDER = "Cannot take empty order";
    public static final String ORDER_PRICE_OUT_OF_BOUNDS = "Order price out of bounds";
    public static final String ORDER_FEE_OUT_OF_BOUNDS = "Order fee out of bounds";
    public static final String ORDER_NOT_TRIGGERED = "Order triggerPrice not triggered";
    public static final String ORDER_EXPIRED = "Order expired";
    public static final String ORDER_MAKER_ACCOUNT_MISMATCH = "Order maker account mismatch";
    public static final String ORDER_TAKER_ACCOUNT_MISMATCH = "Order taker account mismatch";
    public static final String MARKET_MISMATCH = "Market mismatch";
    public static final String INPUT_WEI_IS_ZERO = "InputWei is zero";
    public static final String WRONG_DIRECTION = "InputWei sign does not match order direction";
    public static final String CANNOT_OVERFILL_ORDER = "Cannot overfill order";
    public static final String POSITION_NOT_DECREASED = "Decrease-only order cannot increase a position";
    public static final String CANCELER_MUST_BE_MAKER = "Canceler must be maker";
    public static final String APPROVER_MUST_BE_MAKER = "Approver must be maker";
    public static final String ONLY_LEDGER_CAN_CALL = "Only the margin ledger can call this function";
    public static final String ONLY_OWNER_CAN_CALL = "Only the owner can call this function";
    public static final String MARKET_PRICE_UNAVAILABLE = "No usable oracle price for the order's markets";
}
