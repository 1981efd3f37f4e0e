package ir.ramtung.canonicalorders.domain;

import ir.ramtung.canonicalorders.config.MockedJMSTestConfig;
import ir.ramtung.canonicalorders.domain.entity.*;
import ir.ramtung.canonicalorders.domain.service.OperationalSwitch;
import ir.ramtung.canonicalorders.domain.service.OrderHandler;
import ir.ramtung.canonicalorders.domain.service.OrderHasher;
import ir.ramtung.canonicalorders.messaging.EventPublisher;
import ir.ramtung.canonicalorders.messaging.Message;
import ir.ramtung.canonicalorders.messaging.codec.OrderCodec;
import ir.ramtung.canonicalorders.messaging.event.OrderFilledEvent;
import ir.ramtung.canonicalorders.messaging.event.TradeCostEvent;
import ir.ramtung.canonicalorders.messaging.exception.InvalidRequestException;
import ir.ramtung.canonicalorders.messaging.request.GetTradeCostRq;
import ir.ramtung.canonicalorders.repository.LedgerSnapshotRepository;
import ir.ramtung.canonicalorders.repository.OrderStateRepository;
import ir.ramtung.canonicalorders.repository.TransientTradeArgsRepository;
import ir.ramtung.canonicalorders.testutil.OrderSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import(MockedJMSTestConfig.class)
public class TradeValidationTest {
    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final BigInteger PRICE = E18.multiply(BigInteger.TWO);
    private static final BigInteger BASE = BigInteger.ZERO;
    private static final BigInteger QUOTE = BigInteger.ONE;
    private static final BigInteger MAKER_KEY = BigInteger.ONE;
    private static final Address MAKER = OrderSigner.addressOf(MAKER_KEY);
    private static final Address TAKER = OrderSigner.addressOf(BigInteger.valueOf(3));
    @Autowired
    OrderHandler orderHandler;
    @Autowired
    EventPublisher eventPublisher;
    @Autowired
    OrderHasher orderHasher;
    @Autowired
    OrderStateRepository orderStateRepository;
    @Autowired
    TransientTradeArgsRepository transientTradeArgsRepository;
    @Autowired
    LedgerSnapshotRepository ledgerSnapshotRepository;
    @Autowired
    OperationalSwitch operationalSwitch;
    @Value("${canonical.ledger-address}")
    private String ledgerAddress;
    private Address ledger;

    @BeforeEach
    void setup() {
        orderStateRepository.clear();
        transientTradeArgsRepository.clear();
        ledgerSnapshotRepository.clear();
        operationalSwitch.setOperational(true);
        ledgerSnapshotRepository.setMarketPrice(BASE, E18);
        ledgerSnapshotRepository.setMarketPrice(QUOTE, E18.multiply(BigInteger.TWO));
        ledger = Address.of(ledgerAddress);
    }

    private Order.OrderBuilder orderBuilder(boolean buy) {
        return Order.builder()
                .flags(OrderFlags.builder().salt(BigInteger.valueOf(99)).buy(buy).build())
                .baseMarket(BASE)
                .quoteMarket(QUOTE)
                .amount(BigInteger.valueOf(100))
                .limitPrice(PRICE)
                .makerAccountOwner(MAKER);
    }

    private TradeArgs tradeArgs(BigInteger price) {
        return new TradeArgs(price, BigInteger.ZERO, false);
    }

    private GetTradeCostRq unsignedRq(Order order, TradeArgs tradeArgs, BigInteger inputMarket, long inputWei) {
        return tradeRq(order, inputMarket, inputWei, OrderCodec.encodeTrade(order, tradeArgs));
    }

    private GetTradeCostRq signedRq(Order order, TradeArgs tradeArgs, BigInteger inputMarket, long inputWei) {
        TypedSignature signature = OrderSigner.sign(orderHasher.hashOrder(order), MAKER_KEY);
        return tradeRq(order, inputMarket, inputWei, OrderCodec.encodeTrade(order, tradeArgs, signature));
    }

    private GetTradeCostRq tradeRq(Order order, BigInteger inputMarket, long inputWei, byte[] data) {
        BigInteger outputMarket = inputMarket.equals(BASE) ? QUOTE : BASE;
        return new GetTradeCostRq(1, ledger, inputMarket, outputMarket, order.getMakerAccount(),
                new AccountInfo(TAKER, BigInteger.ZERO), Wei.ZERO, Wei.of(inputWei), Wei.of(inputWei),
                OrderCodec.toHex(data));
    }

    private void assertRejected(GetTradeCostRq rq, TradeOutcome outcome) {
        assertThatThrownBy(() -> orderHandler.getTradeCost(rq))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("outcome").isEqualTo(outcome);
    }

    @Test
    void quote_input_fill_pays_out_base_at_the_order_price() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        OrderHash orderHash = orderHasher.hashOrder(order);

        FillResult result = orderHandler.getTradeCost(signedRq(order, tradeArgs(PRICE), QUOTE, 50));

        assertThat(result.getOutputWei()).isEqualTo(Wei.of(-25));
        assertThat(orderStateRepository.getFilledAmount(orderHash)).isEqualTo(BigInteger.valueOf(25));
        verify(eventPublisher).publishAll(List.of(new OrderFilledEvent(orderHash, MAKER, BigInteger.valueOf(25),
                BigInteger.valueOf(25), false, PRICE, BigInteger.ZERO, false)));
    }

    @Test
    void fill_that_would_overfill_is_rejected_and_changes_nothing() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        OrderHash orderHash = orderHasher.hashOrder(order);
        orderHandler.getTradeCost(signedRq(order, tradeArgs(PRICE), QUOTE, 50));

        assertRejected(signedRq(order, tradeArgs(PRICE), QUOTE, 152), TradeOutcome.OVERFILL);
        assertThat(orderStateRepository.getFilledAmount(orderHash)).isEqualTo(BigInteger.valueOf(25));
    }

    @Test
    void handled_request_publishes_the_trade_cost() {
        Order order = orderBuilder(false).build();
        OrderHash orderHash = orderHasher.hashOrder(order);

        orderHandler.handleGetTradeCost(signedRq(order, tradeArgs(PRICE), QUOTE, 50));

        verify(eventPublisher).publish(new TradeCostEvent(1, orderHash, Wei.of(-25)));
    }

    @Test
    void handled_request_publishes_the_rejection() {
        Order order = orderBuilder(false).build();

        orderHandler.handleGetTradeCost(unsignedRq(order, tradeArgs(PRICE), QUOTE, 50));

        ArgumentCaptor<InvalidRequestException> exceptionCaptor = ArgumentCaptor.forClass(InvalidRequestException.class);
        verify(eventPublisher).publishRequestRejectedEvent(eq(1L), exceptionCaptor.capture());
        assertThat(exceptionCaptor.getValue().getOutcome()).isEqualTo(TradeOutcome.INVALID_SIGNATURE);
        assertThat(exceptionCaptor.getValue().getOrderHash()).isEqualTo(orderHasher.hashOrder(order));
        assertThat(exceptionCaptor.getValue().getReasons()).containsExactly(Message.ORDER_INVALID_SIGNATURE);
    }

    @Test
    void caller_other_than_the_ledger_is_unauthorized() {
        GetTradeCostRq rq = signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 50);
        rq.setSender(TAKER);
        assertRejected(rq, TradeOutcome.UNAUTHORIZED);
    }

    @Test
    void fills_are_refused_while_the_module_is_shut_down() {
        operationalSwitch.setOperational(false);
        assertRejected(signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 50), TradeOutcome.MODULE_INACTIVE);
    }

    @Test
    void malformed_payload_is_a_decode_error() {
        GetTradeCostRq rq = signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 50);
        rq.setData("0x1234");
        assertRejected(rq, TradeOutcome.DECODE_ERROR);
    }

    @Test
    void signature_by_someone_else_is_invalid() {
        Order order = orderBuilder(false).build();
        TypedSignature signature = OrderSigner.sign(orderHasher.hashOrder(order), BigInteger.valueOf(5));
        GetTradeCostRq rq = tradeRq(order, QUOTE, 50, OrderCodec.encodeTrade(order, tradeArgs(PRICE), signature));
        assertRejected(rq, TradeOutcome.INVALID_SIGNATURE);
    }

    @Test
    void approved_order_fills_without_a_signature() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        orderHandler.approveOrder(MAKER, order);

        FillResult result = orderHandler.getTradeCost(unsignedRq(order, tradeArgs(PRICE), QUOTE, 50));

        assertThat(result.getFillAmount()).isEqualTo(BigInteger.valueOf(25));
    }

    @Test
    void canceled_order_cannot_be_filled_even_when_signed() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        orderHandler.cancelOrder(MAKER, order);
        assertRejected(signedRq(order, tradeArgs(PRICE), QUOTE, 50), TradeOutcome.ORDER_CANCELED);
    }

    @Test
    void buy_order_fills_at_its_limit_price_but_not_above() throws InvalidRequestException {
        Order order = orderBuilder(true).build();
        orderHandler.getTradeCost(signedRq(order, tradeArgs(PRICE), BASE, 10));
        assertRejected(signedRq(order, tradeArgs(PRICE.add(BigInteger.ONE)), BASE, 10), TradeOutcome.PRICE_OUT_OF_BOUNDS);
    }

    @Test
    void sell_order_fills_at_its_limit_price_but_not_below() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        orderHandler.getTradeCost(signedRq(order, tradeArgs(PRICE), QUOTE, 10));
        assertRejected(signedRq(order, tradeArgs(PRICE.subtract(BigInteger.ONE)), QUOTE, 10), TradeOutcome.PRICE_OUT_OF_BOUNDS);
    }

    @Test
    void fee_above_the_limit_is_refused_unless_it_is_negative() throws InvalidRequestException {
        BigInteger limitFee = E18.divide(BigInteger.valueOf(100));
        Order order = orderBuilder(true).limitFee(limitFee).limitPrice(PRICE.multiply(BigInteger.TWO)).build();
        BigInteger fee = limitFee.multiply(BigInteger.TWO);

        assertRejected(signedRq(order, new TradeArgs(PRICE, fee, false), BASE, 10), TradeOutcome.FEE_OUT_OF_BOUNDS);
        orderHandler.getTradeCost(signedRq(order, new TradeArgs(PRICE, fee, true), BASE, 10));
    }

    @Test
    void order_demanding_a_rebate_refuses_a_positive_fee() {
        BigInteger limitFee = E18.divide(BigInteger.valueOf(100));
        Order order = orderBuilder(true)
                .flags(OrderFlags.builder().buy(true).negativeFee(true).build())
                .limitFee(limitFee)
                .build();

        assertRejected(signedRq(order, new TradeArgs(PRICE, BigInteger.ZERO, false), BASE, 10), TradeOutcome.FEE_OUT_OF_BOUNDS);
        assertRejected(signedRq(order, new TradeArgs(PRICE, limitFee.subtract(BigInteger.ONE), true), BASE, 10),
                TradeOutcome.FEE_OUT_OF_BOUNDS);
    }

    @Test
    void trigger_price_gates_the_fill_by_direction() throws InvalidRequestException {
        BigInteger currentPrice = E18.divide(BigInteger.TWO);
        Order triggeredSell = orderBuilder(false).triggerPrice(currentPrice).build();
        Order untriggeredSell = orderBuilder(false).triggerPrice(currentPrice.subtract(BigInteger.ONE)).build();
        Order untriggeredBuy = orderBuilder(true).triggerPrice(currentPrice.add(BigInteger.ONE)).build();

        orderHandler.getTradeCost(signedRq(triggeredSell, tradeArgs(PRICE), QUOTE, 10));
        assertRejected(signedRq(untriggeredSell, tradeArgs(PRICE), QUOTE, 10), TradeOutcome.NOT_TRIGGERED);
        assertRejected(signedRq(untriggeredBuy, tradeArgs(PRICE), BASE, 10), TradeOutcome.NOT_TRIGGERED);
    }

    @Test
    void trigger_on_a_market_without_a_price_is_rejected() {
        Order order = orderBuilder(false).baseMarket(BigInteger.valueOf(7)).triggerPrice(BigInteger.ONE).build();
        GetTradeCostRq rq = signedRq(order, tradeArgs(PRICE), QUOTE, 10);
        rq.setOutputMarketId(BigInteger.valueOf(7));

        assertRejected(rq, TradeOutcome.PRICE_UNAVAILABLE);
    }

    @Test
    void trigger_against_a_zero_quote_price_is_rejected_and_published() {
        ledgerSnapshotRepository.setMarketPrice(QUOTE, BigInteger.ZERO);
        Order order = orderBuilder(false).triggerPrice(BigInteger.ONE).build();

        orderHandler.handleGetTradeCost(signedRq(order, tradeArgs(PRICE), QUOTE, 10));

        ArgumentCaptor<InvalidRequestException> exceptionCaptor = ArgumentCaptor.forClass(InvalidRequestException.class);
        verify(eventPublisher).publishRequestRejectedEvent(eq(1L), exceptionCaptor.capture());
        assertThat(exceptionCaptor.getValue().getOutcome()).isEqualTo(TradeOutcome.PRICE_UNAVAILABLE);
        assertThat(exceptionCaptor.getValue().getOrderHash()).isEqualTo(orderHasher.hashOrder(order));
        assertThat(exceptionCaptor.getValue().getReasons()).containsExactly(Message.MARKET_PRICE_UNAVAILABLE);
    }

    @Test
    void order_with_the_reserved_flag_bit_set_fills_with_the_makers_signature() throws InvalidRequestException {
        Order order = orderBuilder(false)
                .flags(OrderFlags.builder().salt(BigInteger.valueOf(99)).reserved(true).build())
                .build();
        OrderHash orderHash = orderHasher.hashOrder(order);
        assertThat(orderHash).isNotEqualTo(orderHasher.hashOrder(orderBuilder(false).build()));

        orderHandler.getTradeCost(signedRq(order, tradeArgs(PRICE), QUOTE, 50));

        assertThat(orderStateRepository.getFilledAmount(orderHash)).isEqualTo(BigInteger.valueOf(25));
    }

    @Test
    void expired_order_is_refused() throws InvalidRequestException {
        long now = Instant.now().getEpochSecond();
        Order expired = orderBuilder(false).expiration(BigInteger.valueOf(now - 60)).build();
        Order live = orderBuilder(false).expiration(BigInteger.valueOf(now + 3600)).build();

        assertRejected(signedRq(expired, tradeArgs(PRICE), QUOTE, 10), TradeOutcome.EXPIRED);
        orderHandler.getTradeCost(signedRq(live, tradeArgs(PRICE), QUOTE, 10));
    }

    @Test
    void maker_account_must_be_the_one_the_order_names() {
        GetTradeCostRq rq = signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 10);
        rq.setMakerAccount(new AccountInfo(MAKER, BigInteger.ONE));
        assertRejected(rq, TradeOutcome.ACCOUNT_MISMATCH);
    }

    @Test
    void restricted_order_only_fills_against_its_taker() throws InvalidRequestException {
        Order forTaker = orderBuilder(false).taker(TAKER).build();
        Order forOther = orderBuilder(false).taker(OrderSigner.addressOf(BigInteger.valueOf(4))).build();

        orderHandler.getTradeCost(signedRq(forTaker, tradeArgs(PRICE), QUOTE, 10));
        assertRejected(signedRq(forOther, tradeArgs(PRICE), QUOTE, 10), TradeOutcome.TAKER_MISMATCH);
    }

    @Test
    void markets_must_match_the_order_pair() {
        GetTradeCostRq rq = signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 10);
        rq.setOutputMarketId(BigInteger.TWO);
        assertRejected(rq, TradeOutcome.MARKET_MISMATCH);
    }

    @Test
    void zero_input_is_refused_before_direction_is_checked() {
        assertRejected(signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 0), TradeOutcome.ZERO_INPUT);
    }

    @Test
    void input_moving_the_wrong_way_is_refused() {
        assertRejected(signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, -10), TradeOutcome.DIRECTION_MISMATCH);
        assertRejected(signedRq(orderBuilder(true).build(), tradeArgs(PRICE), BASE, -10), TradeOutcome.DIRECTION_MISMATCH);
    }

    @Test
    void decrease_only_fill_that_grows_the_input_position_is_rolled_back() {
        Order order = orderBuilder(false).flags(OrderFlags.builder().decreaseOnly(true).build()).build();
        GetTradeCostRq rq = signedRq(order, tradeArgs(PRICE), QUOTE, 50);
        rq.setOldInputPar(Wei.of(-100));
        rq.setNewInputPar(Wei.of(-150));

        assertRejected(rq, TradeOutcome.DECREASE_VIOLATION);
        assertThat(orderStateRepository.getFilledAmount(orderHasher.hashOrder(order))).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void decrease_only_fill_that_shrinks_both_positions_is_accepted() throws InvalidRequestException {
        Order order = orderBuilder(false).flags(OrderFlags.builder().decreaseOnly(true).build()).build();
        ledgerSnapshotRepository.setAccountWei(order.getMakerAccount(), BASE, Wei.of(1000));
        GetTradeCostRq rq = signedRq(order, tradeArgs(PRICE), QUOTE, 50);
        rq.setOldInputPar(Wei.of(-100));
        rq.setNewInputPar(Wei.of(-50));

        FillResult result = orderHandler.getTradeCost(rq);

        assertThat(result.getOutputWei()).isEqualTo(Wei.of(-25));
    }

    @Test
    void decrease_only_fill_that_flips_the_output_position_is_refused() {
        Order order = orderBuilder(false).flags(OrderFlags.builder().decreaseOnly(true).build()).build();
        ledgerSnapshotRepository.setAccountWei(order.getMakerAccount(), BASE, Wei.of(10));
        GetTradeCostRq rq = signedRq(order, tradeArgs(PRICE), QUOTE, 50);
        rq.setOldInputPar(Wei.of(-100));
        rq.setNewInputPar(Wei.of(-50));

        assertRejected(rq, TradeOutcome.DECREASE_VIOLATION);
    }

    @Test
    void staged_trade_args_are_used_once_for_a_zero_price_fill() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        orderHandler.callFunction(ledger, MAKER, OrderCodec.encodeCall(DelegatedCall.setFillArgs(tradeArgs(PRICE))));

        FillResult result = orderHandler.getTradeCost(signedRq(order, TradeArgs.EMPTY, QUOTE, 50));

        assertThat(result.getTradeArgs()).isEqualTo(tradeArgs(PRICE));
        assertThat(transientTradeArgsRepository.peek().isEmpty()).isTrue();
        assertRejected(signedRq(order, TradeArgs.EMPTY, QUOTE, 50), TradeOutcome.STALE_TRADE_ARGS);
    }

    @Test
    void staged_trade_args_survive_a_failed_fill() throws InvalidRequestException {
        Order order = orderBuilder(false).build();
        orderHandler.callFunction(ledger, MAKER, OrderCodec.encodeCall(DelegatedCall.setFillArgs(tradeArgs(PRICE))));
        GetTradeCostRq rq = signedRq(order, TradeArgs.EMPTY, QUOTE, 50);
        rq.setOutputMarketId(BigInteger.TWO);

        assertRejected(rq, TradeOutcome.MARKET_MISMATCH);
        assertThat(transientTradeArgsRepository.peek()).isEqualTo(tradeArgs(PRICE));
    }

    @Test
    void inline_trade_args_leave_the_staged_ones_alone() throws InvalidRequestException {
        TradeArgs staged = tradeArgs(PRICE.add(BigInteger.ONE));
        orderHandler.callFunction(ledger, MAKER, OrderCodec.encodeCall(DelegatedCall.setFillArgs(staged)));

        orderHandler.getTradeCost(signedRq(orderBuilder(false).build(), tradeArgs(PRICE), QUOTE, 50));

        assertThat(transientTradeArgsRepository.peek()).isEqualTo(staged);
    }
}
