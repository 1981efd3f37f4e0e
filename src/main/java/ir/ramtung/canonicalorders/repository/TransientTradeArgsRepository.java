package ir.ramtung.canonicalorders.repository;

import ir.ramtung.canonicalorders.domain.entity.TradeArgs;
import org.springframework.stereotype.Component;

/**
 * Single-slot staging area for trade args set through a delegated call and taken
 * by the next fill whose inline price is zero.
 */
@Component
public class TransientTradeArgsRepository {
    private TradeArgs staged = TradeArgs.EMPTY;
    private final StateJournal journal;

    public TransientTradeArgsRepository(StateJournal journal) {
        this.journal = journal;
    }

    public void stage(TradeArgs tradeArgs) {
        replace(tradeArgs);
    }

    public TradeArgs consume() {
        TradeArgs taken = staged;
        replace(TradeArgs.EMPTY);
        return taken;
    }

    public TradeArgs peek() {
        return staged;
    }

    public void clear() {
        staged = TradeArgs.EMPTY;
    }

    private void replace(TradeArgs tradeArgs) {
        TradeArgs previous = staged;
        staged = tradeArgs;
        journal.record(() -> staged = previous);
    }
}
