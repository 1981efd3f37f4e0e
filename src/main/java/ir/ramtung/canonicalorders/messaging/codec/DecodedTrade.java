package ir.ramtung.canonicalorders.messaging.codec;

import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.TradeArgs;
import ir.ramtung.canonicalorders.domain.entity.TypedSignature;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class DecodedTrade {
    private final Order order;
    private final TradeArgs tradeArgs;
    private final TypedSignature signature;

    public boolean hasSignature() {
        return signature != null;
    }
}
