package ir.ramtung.canonicalorders.messaging.event;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.FillResult;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@EqualsAndHashCode(callSuper = false)
@AllArgsConstructor
@NoArgsConstructor
public class OrderFilledEvent extends Event {
    private OrderHash orderHash;
    private Address orderMaker;
    private BigInteger fillAmount;
    private BigInteger totalFilledAmount;
    private boolean buy;
    private BigInteger price;
    private BigInteger fee;
    private boolean negativeFee;

    public OrderFilledEvent(FillResult result) {
        this(result.getOrderHash(), result.getOrderMaker(), result.getFillAmount(), result.getTotalFilledAmount(),
                result.isBuy(), result.getTradeArgs().getPrice(), result.getTradeArgs().getFee(),
                result.getTradeArgs().isNegativeFee());
    }
}
