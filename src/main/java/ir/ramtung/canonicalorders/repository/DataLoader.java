package ir.ramtung.canonicalorders.repository;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import ir.ramtung.canonicalorders.domain.entity.AccountInfo;
import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Seeds the ledger snapshot at startup so the engine can validate triggers and
 * decrease-only fills before the ledger pushes its first updates.
 */
@Component
@Profile("!test")
public class DataLoader {
    private final Logger log = Logger.getLogger(this.getClass().getName());
    private final LedgerSnapshotRepository ledgerSnapshotRepository;

    public DataLoader(LedgerSnapshotRepository ledgerSnapshotRepository) {
        this.ledgerSnapshotRepository = ledgerSnapshotRepository;
    }

    @Value("classpath:persistence/market-price.csv")
    private Resource marketPriceCsvResource;
    @Value("classpath:persistence/account-balance.csv")
    private Resource accountBalanceCsvResource;

    @PostConstruct
    public void loadAll() throws Exception {
        ledgerSnapshotRepository.clear();
        loadMarketPrices();
        loadAccountBalances();
    }

    private void loadMarketPrices() throws Exception {
        int count = 0;
        try (Reader reader = new InputStreamReader(marketPriceCsvResource.getInputStream(), StandardCharsets.UTF_8)) {
            try (CSVReader csvReader = new CSVReaderBuilder(reader).withSkipLines(1).build()) {
                String[] line;
                while ((line = csvReader.readNext()) != null) {
                    ledgerSnapshotRepository.setMarketPrice(new BigInteger(line[0].trim()), new BigInteger(line[1].trim()));
                    count++;
                }
            }
        }
        log.info("Market prices loaded: " + count);
    }

    private void loadAccountBalances() throws Exception {
        int count = 0;
        try (Reader reader = new InputStreamReader(accountBalanceCsvResource.getInputStream(), StandardCharsets.UTF_8)) {
            try (CSVReader csvReader = new CSVReaderBuilder(reader).withSkipLines(1).build()) {
                String[] line;
                while ((line = csvReader.readNext()) != null) {
                    AccountInfo account = new AccountInfo(Address.of(line[0].trim()), new BigInteger(line[1].trim()));
                    ledgerSnapshotRepository.setAccountWei(account, new BigInteger(line[2].trim()),
                            Wei.of(new BigInteger(line[3].trim())));
                    count++;
                }
            }
        }
        log.info("Account balances loaded: " + count);
    }
}
