package ir.ramtung.canonicalorders.messaging.event;

import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@EqualsAndHashCode(callSuper = false)
@AllArgsConstructor
@NoArgsConstructor
public class TradeCostEvent extends Event {
    private long requestId;
    private OrderHash orderHash;
    private Wei outputWei;
}
