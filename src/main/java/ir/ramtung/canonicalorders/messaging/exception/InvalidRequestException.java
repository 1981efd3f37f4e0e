package ir.ramtung.canonicalorders.messaging.exception;

import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@ToString
public class InvalidRequestException extends Exception {
    @Getter
    private final TradeOutcome outcome;
    @Getter
    private final OrderHash orderHash;
    @Getter
    private final List<String> reasons;

    public InvalidRequestException(TradeOutcome outcome, OrderHash orderHash, List<String> reasons) {
        super(describe(reasons, orderHash));
        this.outcome = outcome;
        this.orderHash = orderHash;
        this.reasons = reasons;
    }

    public InvalidRequestException(TradeOutcome outcome, OrderHash orderHash, String reason) {
        this(outcome, orderHash, List.of(reason));
    }

    public InvalidRequestException(TradeOutcome outcome, String reason) {
        this(outcome, null, List.of(reason));
    }

    private static String describe(List<String> reasons, OrderHash orderHash) {
        String text = String.join(", ", reasons);
        return orderHash == null ? text : text + " <" + orderHash + ">";
    }
}
