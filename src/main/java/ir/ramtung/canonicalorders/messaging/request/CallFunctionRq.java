package ir.ramtung.canonicalorders.messaging.request;

import ir.ramtung.canonicalorders.domain.entity.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tagged approve, cancel or set-fill-args call relayed by the ledger.
 * {@code sender} is the ledger itself, {@code accountOwner} the account it acts for.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CallFunctionRq {
    private long requestId;
    private Address sender;
    private Address accountOwner;
    private String data;
}
