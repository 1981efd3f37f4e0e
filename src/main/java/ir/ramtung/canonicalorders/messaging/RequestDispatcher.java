package ir.ramtung.canonicalorders.messaging;

import ir.ramtung.canonicalorders.domain.service.OrderHandler;
import ir.ramtung.canonicalorders.messaging.request.ApproveOrderRq;
import ir.ramtung.canonicalorders.messaging.request.CallFunctionRq;
import ir.ramtung.canonicalorders.messaging.request.CancelOrderRq;
import ir.ramtung.canonicalorders.messaging.request.ChangeOperationalStateRq;
import ir.ramtung.canonicalorders.messaging.request.GetOrderStatesRq;
import ir.ramtung.canonicalorders.messaging.request.GetTradeCostRq;
import ir.ramtung.canonicalorders.messaging.request.UpdateAccountBalanceRq;
import ir.ramtung.canonicalorders.messaging.request.UpdateMarketPriceRq;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

import java.util.logging.Logger;

@Component
public class RequestDispatcher {
    private final Logger log = Logger.getLogger(this.getClass().getName());
    private final OrderHandler orderHandler;

    public RequestDispatcher(OrderHandler orderHandler) {
        this.orderHandler = orderHandler;
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.GetTradeCostRq'")
    public void receiveGetTradeCostRq(GetTradeCostRq getTradeCostRq) {
        log.info("Received message: " + getTradeCostRq);
        orderHandler.handleGetTradeCost(getTradeCostRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.CallFunctionRq'")
    public void receiveCallFunctionRq(CallFunctionRq callFunctionRq) {
        log.info("Received message: " + callFunctionRq);
        orderHandler.handleCallFunction(callFunctionRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.CancelOrderRq'")
    public void receiveCancelOrderRq(CancelOrderRq cancelOrderRq) {
        log.info("Received message: " + cancelOrderRq);
        orderHandler.handleCancelOrder(cancelOrderRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.ApproveOrderRq'")
    public void receiveApproveOrderRq(ApproveOrderRq approveOrderRq) {
        log.info("Received message: " + approveOrderRq);
        orderHandler.handleApproveOrder(approveOrderRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.GetOrderStatesRq'")
    public void receiveGetOrderStatesRq(GetOrderStatesRq getOrderStatesRq) {
        log.info("Received message: " + getOrderStatesRq);
        orderHandler.handleGetOrderStates(getOrderStatesRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.ChangeOperationalStateRq'")
    public void receiveChangeOperationalStateRq(ChangeOperationalStateRq changeOperationalStateRq) {
        log.info("Received message: " + changeOperationalStateRq);
        orderHandler.handleChangeOperationalState(changeOperationalStateRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.UpdateMarketPriceRq'")
    public void receiveUpdateMarketPriceRq(UpdateMarketPriceRq updateMarketPriceRq) {
        log.info("Received message: " + updateMarketPriceRq);
        orderHandler.handleUpdateMarketPrice(updateMarketPriceRq);
    }

    @JmsListener(destination = "${requestQueue}", selector = "_type='ir.ramtung.canonicalorders.messaging.request.UpdateAccountBalanceRq'")
    public void receiveUpdateAccountBalanceRq(UpdateAccountBalanceRq updateAccountBalanceRq) {
        log.info("Received message: " + updateAccountBalanceRq);
        orderHandler.handleUpdateAccountBalance(updateAccountBalanceRq);
    }
}
