package ir.ramtung.canonicalorders.messaging.request;

import ir.ramtung.canonicalorders.domain.entity.AccountInfo;
import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Asks for the maker's output amount for one fill. Sent by the ledger while it
 * settles a trade; {@code data} is the hex fill payload.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class GetTradeCostRq {
    private long requestId;
    private Address sender;
    private BigInteger inputMarketId;
    private BigInteger outputMarketId;
    private AccountInfo makerAccount;
    private AccountInfo takerAccount;
    private Wei oldInputPar;
    private Wei newInputPar;
    private Wei inputWei;
    private String data;
}
