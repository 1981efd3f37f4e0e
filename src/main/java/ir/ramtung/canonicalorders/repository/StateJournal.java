package ir.ramtung.canonicalorders.repository;

import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Single-writer transaction boundary over the in-memory stores. Operations run one
 * at a time; the repositories record an undo step for every mutation, and a failed
 * operation replays them in reverse so none of its writes survive. Commit hooks run
 * after the outermost operation succeeds, still under the lock, so their side effects
 * keep the order in which operations committed.
 */
@Component
public class StateJournal {
    private final Logger log = Logger.getLogger(this.getClass().getName());
    private final ReentrantLock lock = new ReentrantLock();
    private Deque<Runnable> undoLog;
    private List<Runnable> commitHooks;

    @FunctionalInterface
    public interface Work<T> {
        T run() throws InvalidRequestException;
    }

    public <T> T execute(Work<T> work) throws InvalidRequestException {
        return execute(work, null);
    }

    public <T> T execute(Work<T> work, Runnable onCommit) throws InvalidRequestException {
        lock.lock();
        try {
            if (undoLog != null) {
                T result = work.run();
                if (onCommit != null)
                    commitHooks.add(onCommit);
                return result;
            }
            undoLog = new ArrayDeque<>();
            commitHooks = new ArrayList<>();
            T result;
            try {
                result = work.run();
            } catch (InvalidRequestException | RuntimeException e) {
                rollback();
                throw e;
            }
            if (onCommit != null)
                commitHooks.add(onCommit);
            List<Runnable> hooks = commitHooks;
            undoLog = null;
            commitHooks = null;
            hooks.forEach(Runnable::run);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void record(Runnable undo) {
        if (undoLog != null)
            undoLog.push(undo);
    }

    private void rollback() {
        int steps = undoLog.size();
        while (!undoLog.isEmpty())
            undoLog.pop().run();
        undoLog = null;
        commitHooks = null;
        log.fine("Rolled back " + steps + " state changes");
    }
}
