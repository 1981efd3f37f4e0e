package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.repository.StateJournal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-wide flag that gates every fill. Only the configured owner may flip it.
 */
@Component
public class OperationalSwitch {
    private final Address owner;
    private final StateJournal journal;
    private boolean operational = true;

    public OperationalSwitch(@Value("${canonical.owner-address}") String owner, StateJournal journal) {
        this.owner = Address.of(owner);
        this.journal = journal;
    }

    public boolean isOperational() {
        return operational;
    }

    public boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    public void setOperational(boolean operational) {
        boolean previous = this.operational;
        this.operational = operational;
        journal.record(() -> this.operational = previous);
    }
}
