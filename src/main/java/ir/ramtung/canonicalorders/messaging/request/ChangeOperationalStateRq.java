package ir.ramtung.canonicalorders.messaging.request;

import ir.ramtung.canonicalorders.domain.entity.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ChangeOperationalStateRq {
    private long requestId;
    private Address sender;
    private boolean operational;
}
