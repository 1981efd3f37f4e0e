package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.FillResult;
import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.TradeArgs;
import ir.ramtung.canonicalorders.domain.entity.TradeContext;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import ir.ramtung.canonicalorders.messaging.Message;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import ir.ramtung.canonicalorders.repository.OrderStateRepository;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Prices a fill and books it against the order's amount.
 *
 * <p>The fee moves the effective price against the maker when positive and in its
 * favor when negative. When the maker receives the quote asset, the fill counts the
 * base amount it pays out; when it receives the base asset, the fill counts the base
 * amount received.
 */
@Component
public class FillAccountant {
    private final OrderStateRepository orderStateRepository;

    public FillAccountant(OrderStateRepository orderStateRepository) {
        this.orderStateRepository = orderStateRepository;
    }

    public static BigInteger adjustedPrice(Order order, TradeArgs tradeArgs) {
        BigInteger fee = PriceMath.getPartial(tradeArgs.getPrice(), tradeArgs.getFee(), PriceMath.PRICE_BASE);
        return order.isBuy() == tradeArgs.isNegativeFee()
                ? tradeArgs.getPrice().subtract(fee)
                : tradeArgs.getPrice().add(fee);
    }

    public FillResult fill(TradeContext context) throws InvalidRequestException {
        Order order = context.getOrder();
        OrderHash orderHash = context.getOrderHash();
        BigInteger adjustedPrice = adjustedPrice(order, context.getTradeArgs());
        BigInteger inputAmount = context.getInputWei().magnitude();

        BigInteger outputAmount;
        BigInteger fillAmount;
        if (context.isQuoteInput()) {
            if (adjustedPrice.signum() <= 0)
                throw new InvalidRequestException(TradeOutcome.PRICE_OUT_OF_BOUNDS, orderHash, Message.ORDER_PRICE_OUT_OF_BOUNDS);
            outputAmount = PriceMath.getPartial(inputAmount, PriceMath.PRICE_BASE, adjustedPrice);
            fillAmount = outputAmount;
        } else {
            if (adjustedPrice.signum() < 0)
                throw new InvalidRequestException(TradeOutcome.PRICE_OUT_OF_BOUNDS, orderHash, Message.ORDER_PRICE_OUT_OF_BOUNDS);
            outputAmount = PriceMath.getPartial(inputAmount, adjustedPrice, PriceMath.PRICE_BASE);
            fillAmount = inputAmount;
        }

        BigInteger totalFilledAmount = updateFilledAmount(orderHash, order, fillAmount);
        return FillResult.builder()
                .orderHash(orderHash)
                .orderMaker(order.getMakerAccountOwner())
                .outputWei(Wei.of(!context.getInputWei().isPositive(), outputAmount))
                .fillAmount(fillAmount)
                .totalFilledAmount(totalFilledAmount)
                .buy(order.isBuy())
                .tradeArgs(context.getTradeArgs())
                .build();
    }

    private BigInteger updateFilledAmount(OrderHash orderHash, Order order, BigInteger fillAmount)
            throws InvalidRequestException {
        BigInteger totalFilledAmount = orderStateRepository.getFilledAmount(orderHash).add(fillAmount);
        if (totalFilledAmount.compareTo(order.getAmount()) > 0)
            throw new InvalidRequestException(TradeOutcome.OVERFILL, orderHash, Message.CANNOT_OVERFILL_ORDER);
        orderStateRepository.setFilledAmount(orderHash, totalFilledAmount);
        return totalFilledAmount;
    }
}
