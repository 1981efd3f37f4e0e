package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.AccountInfo;
import ir.ramtung.canonicalorders.domain.entity.Wei;

import java.math.BigInteger;

/**
 * The margin ledger's read side, as far as fill validation needs it.
 */
public interface MarginLedger {
    /**
     * @return the market's oracle price scaled by 10^18, or null if the ledger has not pushed one
     */
    BigInteger findMarketPrice(BigInteger marketId);

    Wei getAccountWei(AccountInfo account, BigInteger marketId);
}
