package ir.ramtung.canonicalorders.messaging;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.TradeOutcome;
import ir.ramtung.canonicalorders.domain.entity.Wei;
import ir.ramtung.canonicalorders.messaging.event.OrderCanceledEvent;
import ir.ramtung.canonicalorders.messaging.event.RequestRejectedEvent;
import ir.ramtung.canonicalorders.messaging.event.TradeCostEvent;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jms.annotation.EnableJms;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.test.annotation.DirtiesContext;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@EnableJms
@DirtiesContext
public class EventPublisherTest {
    private static final OrderHash ORDER_HASH = OrderHash.of("0x" + "5a".repeat(32));
    @Autowired
    JmsTemplate jmsTemplate;
    @Autowired
    EventPublisher eventPublisher;
    @Value("${responseQueue}")
    private String responseQueue;

    @BeforeEach
    void emptyResponseQueue() {
        long receiveTimeout = jmsTemplate.getReceiveTimeout();
        jmsTemplate.setReceiveTimeout(1000);
        //noinspection StatementWithEmptyBody
        while (jmsTemplate.receive(responseQueue) != null) ;
        jmsTemplate.setReceiveTimeout(receiveTimeout);
    }

    private Object receive() {
        long receiveTimeout = jmsTemplate.getReceiveTimeout();
        jmsTemplate.setReceiveTimeout(1000);
        Object received = jmsTemplate.receiveAndConvert(responseQueue);
        jmsTemplate.setReceiveTimeout(receiveTimeout);
        return received;
    }

    @Test
    void response_channel_integration_works() {
        OrderCanceledEvent orderCanceledEvent = new OrderCanceledEvent(ORDER_HASH,
                Address.of("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf"), BigInteger.ZERO, BigInteger.ONE);
        eventPublisher.publish(orderCanceledEvent);

        assertEquals(orderCanceledEvent, receive());
    }

    @Test
    void signed_amounts_survive_the_round_trip() {
        TradeCostEvent tradeCostEvent = new TradeCostEvent(3, ORDER_HASH, Wei.of(-25));
        eventPublisher.publish(tradeCostEvent);

        assertEquals(tradeCostEvent, receive());
    }

    @Test
    void rejection_carries_reason_hash_and_messages() {
        eventPublisher.publishRequestRejectedEvent(4,
                new InvalidRequestException(TradeOutcome.OVERFILL, ORDER_HASH, Message.CANNOT_OVERFILL_ORDER));

        assertEquals(new RequestRejectedEvent(4, TradeOutcome.OVERFILL, ORDER_HASH, List.of(Message.CANNOT_OVERFILL_ORDER)),
                receive());
    }
}
