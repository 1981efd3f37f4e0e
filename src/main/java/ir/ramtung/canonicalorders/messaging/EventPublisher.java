package ir.ramtung.canonicalorders.messaging;

import ir.ramtung.canonicalorders.messaging.event.Event;
import ir.ramtung.canonicalorders.messaging.event.RequestRejectedEvent;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.logging.Logger;

@Component
public class EventPublisher {
    private final Logger log = Logger.getLogger(this.getClass().getName());
    private final JmsTemplate jmsTemplate;
    @Value("${responseQueue}")
    private String responseQueue;

    public EventPublisher(JmsTemplate jmsTemplate) {
        this.jmsTemplate = jmsTemplate;
    }

    public void publish(Event event) {
        log.info("Published : " + event);
        jmsTemplate.convertAndSend(responseQueue, event);
    }

    public void publishAll(List<Event> events) {
        for (Event event : events)
            publish(event);
    }

    public void publishRequestRejectedEvent(long requestId, InvalidRequestException e) {
        log.warning("Rejected request " + requestId + ": " + e.getMessage());
        publish(new RequestRejectedEvent(requestId, e.getOutcome(), e.getOrderHash(), e.getReasons()));
    }
}
