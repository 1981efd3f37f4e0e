package ir.ramtung.canonicalorders.messaging.request;

import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class GetOrderStatesRq {
    private long requestId;
    private List<OrderHash> orderHashes;
}
