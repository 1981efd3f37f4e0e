package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.*;
import ir.ramtung.canonicalorders.domain.service.control.TradeControlList;
import ir.ramtung.canonicalorders.messaging.EventPublisher;
import ir.ramtung.canonicalorders.messaging.Message;
import ir.ramtung.canonicalorders.messaging.codec.DecodedTrade;
import ir.ramtung.canonicalorders.messaging.codec.OrderCodec;
import ir.ramtung.canonicalorders.messaging.event.*;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import ir.ramtung.canonicalorders.messaging.request.*;
import ir.ramtung.canonicalorders.repository.LedgerSnapshotRepository;
import ir.ramtung.canonicalorders.repository.OrderStateRepository;
import ir.ramtung.canonicalorders.repository.StateJournal;
import ir.ramtung.canonicalorders.repository.TransientTradeArgsRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for every request the engine serves. Each operation runs as one
 * journaled unit: it either commits all of its writes and then publishes its
 * events, or leaves no trace.
 */
@Service
public class OrderHandler {
    private final StateJournal journal;
    private final OrderHasher orderHasher;
    private final SignatureVerifier signatureVerifier;
    private final OrderStateRepository orderStateRepository;
    private final TransientTradeArgsRepository transientTradeArgsRepository;
    private final LedgerSnapshotRepository ledgerSnapshotRepository;
    private final TradeControlList tradeControlList;
    private final FillAccountant fillAccountant;
    private final OperationalSwitch operationalSwitch;
    private final EventPublisher eventPublisher;
    private final Address ledger;

    public OrderHandler(StateJournal journal, OrderHasher orderHasher, SignatureVerifier signatureVerifier,
                        OrderStateRepository orderStateRepository,
                        TransientTradeArgsRepository transientTradeArgsRepository,
                        LedgerSnapshotRepository ledgerSnapshotRepository, TradeControlList tradeControlList,
                        FillAccountant fillAccountant, OperationalSwitch operationalSwitch,
                        EventPublisher eventPublisher, @Value("${canonical.ledger-address}") String ledger) {
        this.journal = journal;
        this.orderHasher = orderHasher;
        this.signatureVerifier = signatureVerifier;
        this.orderStateRepository = orderStateRepository;
        this.transientTradeArgsRepository = transientTradeArgsRepository;
        this.ledgerSnapshotRepository = ledgerSnapshotRepository;
        this.tradeControlList = tradeControlList;
        this.fillAccountant = fillAccountant;
        this.operationalSwitch = operationalSwitch;
        this.eventPublisher = eventPublisher;
        this.ledger = Address.of(ledger);
    }

    @FunctionalInterface
    private interface Operation<T> {
        T run(List<Event> events) throws InvalidRequestException;
    }

    private <T> T execute(Operation<T> operation) throws InvalidRequestException {
        List<Event> events = new ArrayList<>();
        return journal.execute(() -> operation.run(events), () -> eventPublisher.publishAll(events));
    }

    public void handleGetTradeCost(GetTradeCostRq getTradeCostRq) {
        try {
            FillResult result = getTradeCost(getTradeCostRq);
            eventPublisher.publish(new TradeCostEvent(getTradeCostRq.getRequestId(), result.getOrderHash(),
                    result.getOutputWei()));
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(getTradeCostRq.getRequestId(), e);
        }
    }

    public void handleCallFunction(CallFunctionRq callFunctionRq) {
        try {
            callFunction(callFunctionRq.getSender(), callFunctionRq.getAccountOwner(),
                    OrderCodec.fromHex(callFunctionRq.getData()));
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(callFunctionRq.getRequestId(), e);
        }
    }

    public void handleCancelOrder(CancelOrderRq cancelOrderRq) {
        try {
            cancelOrder(cancelOrderRq.getSender(), OrderCodec.decodeOrder(OrderCodec.fromHex(cancelOrderRq.getOrder())));
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(cancelOrderRq.getRequestId(), e);
        }
    }

    public void handleApproveOrder(ApproveOrderRq approveOrderRq) {
        try {
            approveOrder(approveOrderRq.getSender(), OrderCodec.decodeOrder(OrderCodec.fromHex(approveOrderRq.getOrder())));
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(approveOrderRq.getRequestId(), e);
        }
    }

    public void handleGetOrderStates(GetOrderStatesRq getOrderStatesRq) {
        try {
            List<OrderState> states = getOrderStates(getOrderStatesRq.getOrderHashes());
            eventPublisher.publish(new OrderStatesEvent(getOrderStatesRq.getRequestId(), states));
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(getOrderStatesRq.getRequestId(), e);
        }
    }

    public void handleChangeOperationalState(ChangeOperationalStateRq changeOperationalStateRq) {
        try {
            if (changeOperationalStateRq.isOperational())
                startUp(changeOperationalStateRq.getSender());
            else
                shutDown(changeOperationalStateRq.getSender());
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(changeOperationalStateRq.getRequestId(), e);
        }
    }

    public void handleUpdateMarketPrice(UpdateMarketPriceRq updateMarketPriceRq) {
        try {
            setMarketPrice(updateMarketPriceRq.getSender(), updateMarketPriceRq.getMarketId(),
                    updateMarketPriceRq.getPrice());
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(updateMarketPriceRq.getRequestId(), e);
        }
    }

    public void handleUpdateAccountBalance(UpdateAccountBalanceRq updateAccountBalanceRq) {
        try {
            setAccountBalance(updateAccountBalanceRq.getSender(), updateAccountBalanceRq.getAccount(),
                    updateAccountBalanceRq.getMarketId(), updateAccountBalanceRq.getBalance());
        } catch (InvalidRequestException e) {
            eventPublisher.publishRequestRejectedEvent(updateAccountBalanceRq.getRequestId(), e);
        }
    }

    public FillResult getTradeCost(GetTradeCostRq getTradeCostRq) throws InvalidRequestException {
        return execute(events -> {
            requireLedger(getTradeCostRq.getSender());
            if (!operationalSwitch.isOperational())
                throw new InvalidRequestException(TradeOutcome.MODULE_INACTIVE, Message.MODULE_NOT_OPERATIONAL);

            OrderInfo orderInfo = getOrderInfo(OrderCodec.fromHex(getTradeCostRq.getData()));
            TradeContext context = TradeContext.builder()
                    .inputMarketId(getTradeCostRq.getInputMarketId())
                    .outputMarketId(getTradeCostRq.getOutputMarketId())
                    .makerAccount(getTradeCostRq.getMakerAccount())
                    .takerAccount(getTradeCostRq.getTakerAccount())
                    .oldInputPar(getTradeCostRq.getOldInputPar())
                    .newInputPar(getTradeCostRq.getNewInputPar())
                    .inputWei(getTradeCostRq.getInputWei())
                    .orderInfo(orderInfo)
                    .build();

            TradeOutcome outcome = tradeControlList.canStartFill(context);
            if (outcome != TradeOutcome.OK)
                throw rejection(outcome, orderInfo.getOrderHash());

            FillResult result = fillAccountant.fill(context);

            outcome = tradeControlList.canAcceptFill(context, result);
            if (outcome != TradeOutcome.OK)
                throw rejection(outcome, orderInfo.getOrderHash());

            events.add(new OrderFilledEvent(result));
            return result;
        });
    }

    public void callFunction(Address sender, Address accountOwner, byte[] data) throws InvalidRequestException {
        execute(events -> {
            requireLedger(sender);
            DelegatedCall call = OrderCodec.decodeCall(data);
            switch (call.getType()) {
                case APPROVE -> approve(accountOwner, call.getOrder(), events);
                case CANCEL -> cancel(accountOwner, call.getOrder(), events);
                case SET_FILL_ARGS -> transientTradeArgsRepository.stage(call.getTradeArgs());
            }
            return null;
        });
    }

    public void cancelOrder(Address caller, Order order) throws InvalidRequestException {
        execute(events -> {
            cancel(caller, order, events);
            return null;
        });
    }

    public void approveOrder(Address caller, Order order) throws InvalidRequestException {
        execute(events -> {
            approve(caller, order, events);
            return null;
        });
    }

    public List<OrderState> getOrderStates(List<OrderHash> orderHashes) throws InvalidRequestException {
        return execute(events -> orderHashes.stream().map(orderStateRepository::getOrderState).toList());
    }

    public void shutDown(Address caller) throws InvalidRequestException {
        setOperational(caller, false);
    }

    public void startUp(Address caller) throws InvalidRequestException {
        setOperational(caller, true);
    }

    public void setMarketPrice(Address caller, BigInteger marketId, BigInteger price) throws InvalidRequestException {
        execute(events -> {
            requireLedger(caller);
            ledgerSnapshotRepository.setMarketPrice(marketId, price);
            return null;
        });
    }

    public void setAccountBalance(Address caller, AccountInfo account, BigInteger marketId, Wei balance)
            throws InvalidRequestException {
        execute(events -> {
            requireLedger(caller);
            ledgerSnapshotRepository.setAccountWei(account, marketId, balance);
            return null;
        });
    }

    private OrderInfo getOrderInfo(byte[] data) throws InvalidRequestException {
        DecodedTrade decoded = OrderCodec.decodeTrade(data);
        Order order = decoded.getOrder();
        OrderHash orderHash = orderHasher.hashOrder(order);

        TradeArgs tradeArgs = decoded.getTradeArgs();
        if (tradeArgs.isEmpty())
            tradeArgs = transientTradeArgsRepository.consume();
        if (tradeArgs.isEmpty())
            throw new InvalidRequestException(TradeOutcome.STALE_TRADE_ARGS, orderHash, Message.CANNOT_TAKE_EMPTY_ORDER);

        OrderStatus status = orderStateRepository.getStatus(orderHash);
        if (status == OrderStatus.CANCELED)
            throw new InvalidRequestException(TradeOutcome.ORDER_CANCELED, orderHash, Message.ORDER_CANCELED);
        if (status == OrderStatus.NULL
                && !signatureVerifier.isSignedBy(orderHash, decoded.getSignature(), order.getMakerAccountOwner()))
            throw new InvalidRequestException(TradeOutcome.INVALID_SIGNATURE, orderHash, Message.ORDER_INVALID_SIGNATURE);

        return new OrderInfo(order, tradeArgs, orderHash);
    }

    private void cancel(Address canceler, Order order, List<Event> events) throws InvalidRequestException {
        OrderHash orderHash = orderHasher.hashOrder(order);
        if (!order.getMakerAccountOwner().equals(canceler))
            throw new InvalidRequestException(TradeOutcome.UNAUTHORIZED, orderHash, Message.CANCELER_MUST_BE_MAKER);
        orderStateRepository.setStatus(orderHash, OrderStatus.CANCELED);
        events.add(new OrderCanceledEvent(orderHash, canceler, order.getBaseMarket(), order.getQuoteMarket()));
    }

    private void approve(Address approver, Order order, List<Event> events) throws InvalidRequestException {
        OrderHash orderHash = orderHasher.hashOrder(order);
        if (!order.getMakerAccountOwner().equals(approver))
            throw new InvalidRequestException(TradeOutcome.UNAUTHORIZED, orderHash, Message.APPROVER_MUST_BE_MAKER);
        if (orderStateRepository.getStatus(orderHash) == OrderStatus.CANCELED)
            throw new InvalidRequestException(TradeOutcome.ORDER_CANCELED, orderHash, Message.CANNOT_APPROVE_CANCELED_ORDER);
        orderStateRepository.setStatus(orderHash, OrderStatus.APPROVED);
        events.add(new OrderApprovedEvent(orderHash, approver, order.getBaseMarket(), order.getQuoteMarket()));
    }

    private void setOperational(Address caller, boolean operational) throws InvalidRequestException {
        execute(events -> {
            if (!operationalSwitch.isOwner(caller))
                throw new InvalidRequestException(TradeOutcome.UNAUTHORIZED, Message.ONLY_OWNER_CAN_CALL);
            operationalSwitch.setOperational(operational);
            events.add(new ContractStatusSetEvent(operational));
            return null;
        });
    }

    private void requireLedger(Address caller) throws InvalidRequestException {
        if (!ledger.equals(caller))
            throw new InvalidRequestException(TradeOutcome.UNAUTHORIZED, Message.ONLY_LEDGER_CAN_CALL);
    }

    private static InvalidRequestException rejection(TradeOutcome outcome, OrderHash orderHash) {
        String message = switch (outcome) {
            case PRICE_OUT_OF_BOUNDS -> Message.ORDER_PRICE_OUT_OF_BOUNDS;
            case FEE_OUT_OF_BOUNDS -> Message.ORDER_FEE_OUT_OF_BOUNDS;
            case NOT_TRIGGERED -> Message.ORDER_NOT_TRIGGERED;
            case PRICE_UNAVAILABLE -> Message.MARKET_PRICE_UNAVAILABLE;
            case EXPIRED -> Message.ORDER_EXPIRED;
            case ACCOUNT_MISMATCH -> Message.ORDER_MAKER_ACCOUNT_MISMATCH;
            case TAKER_MISMATCH -> Message.ORDER_TAKER_ACCOUNT_MISMATCH;
            case MARKET_MISMATCH -> Message.MARKET_MISMATCH;
            case ZERO_INPUT -> Message.INPUT_WEI_IS_ZERO;
            case DIRECTION_MISMATCH -> Message.WRONG_DIRECTION;
            case DECREASE_VIOLATION -> Message.POSITION_NOT_DECREASED;
            default -> throw new IllegalArgumentException("Invalid outcome for trade rejection: " + outcome);
        };
        return new InvalidRequestException(outcome, orderHash, message);
    }
}
