package ir.ramtung.canonicalorders.messaging.event;

import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@AllArgsConstructor
@NoArgsConstructor
public class RequestRejectedEvent extends Event {
    private long requestId;
    private TradeOutcome reason;
    private OrderHash orderHash;
    private List<String> messages;
}
