package ir.ramtung.canonicalorders.messaging.event;

import ir.ramtung.canonicalorders.domain.entity.Address;
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
public class OrderApprovedEvent extends Event {
    private OrderHash orderHash;
    private Address approver;
    private BigInteger baseMarket;
    private BigInteger quoteMarket;
}
