package ir.ramtung.canonicalorders.repository;

import ir.ramtung.canonicalorders.domain.entity.AccountInfo;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import ir.ramtung.canonicalorders.domain.service.MarginLedger;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;

/**
 * The engine's copy of the ledger state it reads during validation: oracle prices
 * per market and account balances per market, pushed by the ledger.
 */
@Component
public class LedgerSnapshotRepository implements MarginLedger {
    private final HashMap<BigInteger, BigInteger> priceByMarket = new HashMap<>();
    private final HashMap<BalanceKey, Wei> balanceByAccount = new HashMap<>();

    @Value
    private static class BalanceKey {
        AccountInfo account;
        BigInteger marketId;
    }

    @Override
    public BigInteger findMarketPrice(BigInteger marketId) {
        return priceByMarket.get(marketId);
    }

    @Override
    public Wei getAccountWei(AccountInfo account, BigInteger marketId) {
        return balanceByAccount.getOrDefault(new BalanceKey(copyOf(account), marketId), Wei.ZERO);
    }

    public void setMarketPrice(BigInteger marketId, BigInteger price) {
        priceByMarket.put(marketId, price);
    }

    public void setAccountWei(AccountInfo account, BigInteger marketId, Wei balance) {
        balanceByAccount.put(new BalanceKey(copyOf(account), marketId), balance);
    }

    public void clear() {
        priceByMarket.clear();
        balanceByAccount.clear();
    }

    private static AccountInfo copyOf(AccountInfo account) {
        return new AccountInfo(account.getOwner(), account.getNumber());
    }
}
