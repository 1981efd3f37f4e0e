package ir.ramtung.canonicalorders.messaging.codec;

import ir.ramtung.canonicalorders.domain.entity.CallFunctionType;
import ir.ramtung.canonicalorders.domain.entity.DelegatedCall;
import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.OrderFlags;
import ir.ramtung.canonicalorders.domain.entity.TradeArgs;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.domain.entity.TypedSignature;
import ir.ramtung.canonicalorders.messaging.Message;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Fixed-layout ABI codec for orders, trade args, typed signatures and delegated calls.
 *
 * <p>An order is 11 words in schema order; trade args are 3 words
 * (price, fee as uint128, isNegativeFee). A fill payload is order followed by trade args,
 * optionally followed by the 66-byte typed signature. A delegated call is a
 * discriminant word followed by an order or by trade args.
 */
public final class OrderCodec {
    public static final int ORDER_WORDS = 11;
    public static final int TRADE_ARGS_WORDS = 3;
    public static final int ORDER_BYTES = ORDER_WORDS * AbiWords.WORD;
    public static final int TRADE_ARGS_BYTES = TRADE_ARGS_WORDS * AbiWords.WORD;
    public static final int ORDER_AND_TRADE_ARGS_BYTES = ORDER_BYTES + TRADE_ARGS_BYTES;
    public static final int ORDER_AND_SIGNATURE_BYTES = ORDER_AND_TRADE_ARGS_BYTES + TypedSignature.LENGTH;
    public static final int CALL_ORDER_BYTES = AbiWords.WORD + ORDER_BYTES;
    public static final int CALL_TRADE_ARGS_BYTES = AbiWords.WORD + TRADE_ARGS_BYTES;

    private OrderCodec() {
    }

    public static DecodedTrade decodeTrade(byte[] data) throws InvalidRequestException {
        if (data.length != ORDER_AND_TRADE_ARGS_BYTES && data.length != ORDER_AND_SIGNATURE_BYTES)
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_ORDER_DATA_LENGTH);
        AbiWords.Reader reader = AbiWords.reader(data, 0);
        Order order = readOrder(reader);
        TradeArgs tradeArgs = readTradeArgs(reader);
        TypedSignature signature = null;
        if (data.length == ORDER_AND_SIGNATURE_BYTES)
            signature = TypedSignature.wrap(Arrays.copyOfRange(data, ORDER_AND_TRADE_ARGS_BYTES, ORDER_AND_SIGNATURE_BYTES));
        return new DecodedTrade(order, tradeArgs, signature);
    }

    public static byte[] encodeTrade(Order order, TradeArgs tradeArgs) {
        AbiWords.Writer writer = AbiWords.writer();
        writeOrder(writer, order);
        writeTradeArgs(writer, tradeArgs);
        return writer.toBytes();
    }

    public static byte[] encodeTrade(Order order, TradeArgs tradeArgs, TypedSignature signature) {
        return AbiWords.writer()
                .raw(encodeTrade(order, tradeArgs))
                .raw(signature.toBytes())
                .toBytes();
    }

    public static Order decodeOrder(byte[] data) throws InvalidRequestException {
        if (data.length != ORDER_BYTES)
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_ORDER_DATA_LENGTH);
        return readOrder(AbiWords.reader(data, 0));
    }

    public static byte[] encodeOrder(Order order) {
        AbiWords.Writer writer = AbiWords.writer();
        writeOrder(writer, order);
        return writer.toBytes();
    }

    public static DelegatedCall decodeCall(byte[] data) throws InvalidRequestException {
        if (data.length < AbiWords.WORD)
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_CALL_DATA);
        AbiWords.Reader reader = AbiWords.reader(data, 0);
        BigInteger tag = reader.uint256();
        if (tag.compareTo(BigInteger.valueOf(CallFunctionType.values().length)) >= 0)
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_CALL_DATA);
        CallFunctionType type = CallFunctionType.fromTag(tag.intValue());
        int expectedLength = type == CallFunctionType.SET_FILL_ARGS ? CALL_TRADE_ARGS_BYTES : CALL_ORDER_BYTES;
        if (data.length != expectedLength)
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_CALL_DATA);
        return switch (type) {
            case APPROVE -> DelegatedCall.approve(readOrder(reader));
            case CANCEL -> DelegatedCall.cancel(readOrder(reader));
            case SET_FILL_ARGS -> DelegatedCall.setFillArgs(readTradeArgs(reader));
        };
    }

    public static byte[] encodeCall(DelegatedCall call) {
        AbiWords.Writer writer = AbiWords.writer().uint256(BigInteger.valueOf(call.getType().tag()));
        if (call.getType() == CallFunctionType.SET_FILL_ARGS)
            writeTradeArgs(writer, call.getTradeArgs());
        else
            writeOrder(writer, call.getOrder());
        return writer.toBytes();
    }

    public static byte[] fromHex(String data) throws InvalidRequestException {
        String digits = StringUtils.removeStartIgnoreCase(StringUtils.defaultString(data), "0x");
        if (digits.length() % 2 != 0)
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_HEX_DATA);
        try {
            return Hex.decode(digits);
        } catch (DecoderException e) {
            throw new InvalidRequestException(TradeOutcome.DECODE_ERROR, Message.INVALID_HEX_DATA);
        }
    }

    public static String toHex(byte[] data) {
        return "0x" + Hex.toHexString(data);
    }

    private static Order readOrder(AbiWords.Reader reader) throws InvalidRequestException {
        return Order.builder()
                .flags(OrderFlags.fromWord(reader.uint256()))
                .baseMarket(reader.uint256())
                .quoteMarket(reader.uint256())
                .amount(reader.uint256())
                .limitPrice(reader.uint256())
                .triggerPrice(reader.uint256())
                .limitFee(reader.uint256())
                .makerAccountOwner(reader.address())
                .makerAccountNumber(reader.uint256())
                .taker(reader.address())
                .expiration(reader.uint256())
                .build();
    }

    private static TradeArgs readTradeArgs(AbiWords.Reader reader) throws InvalidRequestException {
        BigInteger price = reader.uint256();
        BigInteger fee = reader.uint128();
        boolean negativeFee = reader.bool();
        return new TradeArgs(price, fee, negativeFee);
    }

    private static void writeOrder(AbiWords.Writer writer, Order order) {
        writer.uint256(order.getFlags().toWord())
                .uint256(order.getBaseMarket())
                .uint256(order.getQuoteMarket())
                .uint256(order.getAmount())
                .uint256(order.getLimitPrice())
                .uint256(order.getTriggerPrice())
                .uint256(order.getLimitFee())
                .address(order.getMakerAccountOwner())
                .uint256(order.getMakerAccountNumber())
                .address(order.getTaker())
                .uint256(order.getExpiration());
    }

    private static void writeTradeArgs(AbiWords.Writer writer, TradeArgs tradeArgs) {
        writer.uint256(tradeArgs.getPrice())
                .uint128(tradeArgs.getFee())
                .bool(tradeArgs.isNegativeFee());
    }
}
