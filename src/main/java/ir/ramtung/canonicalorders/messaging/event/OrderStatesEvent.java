package ir.ramtung.canonicalorders.messaging.event;

import ir.ramtung.canonicalorders.domain.entity.OrderState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@AllArgsConstructor
@NoArgsConstructor
public class OrderStatesEvent extends Event {
    private long requestId;
    private List<OrderState> states;
}
