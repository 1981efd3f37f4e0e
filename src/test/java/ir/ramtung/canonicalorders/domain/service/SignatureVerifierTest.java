package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.OrderFlags;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.domain.entity.SignatureType;
import ir.ramtung.canonicalorders.domain.entity.TypedSignature;
import ir.ramtung.canonicalorders.testutil.OrderSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class SignatureVerifierTest {
    private static final BigInteger MAKER_KEY = BigInteger.ONE;
    private static final Address MAKER = Address.of("0x7E5F4552091A69125d5DfCb7b8C2659029395Bdf");
    private SignatureVerifier signatureVerifier;
    private OrderHasher orderHasher;
    private Order order;
    private OrderHash orderHash;

    @BeforeEach
    void setup() {
        signatureVerifier = new SignatureVerifier();
        orderHasher = new OrderHasher(1, "0x4a0f5b6dc9a9e39fd8a6a1d8f3d5f9e2a7c0b1d2");
        order = Order.builder()
                .flags(OrderFlags.builder().salt(BigInteger.valueOf(7)).build())
                .baseMarket(BigInteger.ZERO)
                .quoteMarket(BigInteger.ONE)
                .amount(BigInteger.valueOf(100))
                .limitPrice(BigInteger.TEN.pow(18))
                .makerAccountOwner(MAKER)
                .build();
        orderHash = orderHasher.hashOrder(order);
    }

    @Test
    void private_key_one_has_the_well_known_address() {
        assertThat(OrderSigner.addressOf(MAKER_KEY)).isEqualTo(MAKER);
    }

    @Test
    void signatures_of_every_valid_type_recover_the_maker() {
        for (SignatureType type : new SignatureType[]{SignatureType.NO_PREPEND, SignatureType.DECIMAL, SignatureType.HEXADECIMAL}) {
            TypedSignature signature = OrderSigner.sign(orderHash, MAKER_KEY, type);
            assertThat(signatureVerifier.recover(orderHash, signature)).isEqualTo(MAKER);
            assertThat(signatureVerifier.isSignedBy(orderHash, signature, MAKER)).isTrue();
        }
    }

    @Test
    void signature_type_is_part_of_what_is_verified() {
        TypedSignature signature = OrderSigner.sign(orderHash, MAKER_KEY, SignatureType.DECIMAL);
        byte[] bytes = signature.toBytes();
        bytes[65] = 2;
        assertThat(signatureVerifier.isSignedBy(orderHash, TypedSignature.wrap(bytes), MAKER)).isFalse();
    }

    @Test
    void any_single_bit_flip_in_r_or_s_breaks_the_signature() {
        byte[] bytes = OrderSigner.sign(orderHash, MAKER_KEY).toBytes();
        for (int bit = 0; bit < 64 * 8; bit += 37) {
            byte[] mutated = bytes.clone();
            mutated[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThat(signatureVerifier.isSignedBy(orderHash, TypedSignature.wrap(mutated), MAKER))
                    .as("bit %d", bit).isFalse();
        }
    }

    @Test
    void signature_over_another_order_does_not_verify() {
        OrderHash otherHash = orderHasher.hashOrder(order.toBuilder().amount(BigInteger.valueOf(101)).build());
        TypedSignature signature = OrderSigner.sign(otherHash, MAKER_KEY);
        assertThat(signatureVerifier.isSignedBy(orderHash, signature, MAKER)).isFalse();
    }

    @Test
    void v_outside_27_and_28_recovers_the_zero_address() {
        byte[] bytes = OrderSigner.sign(orderHash, MAKER_KEY).toBytes();
        bytes[64] = 29;
        assertThat(signatureVerifier.recover(orderHash, TypedSignature.wrap(bytes))).isEqualTo(Address.ZERO);
        bytes[64] = 0;
        assertThat(signatureVerifier.recover(orderHash, TypedSignature.wrap(bytes))).isEqualTo(Address.ZERO);
    }

    @Test
    void unknown_signature_type_never_verifies() {
        byte[] bytes = OrderSigner.sign(orderHash, MAKER_KEY).toBytes();
        bytes[65] = 3;
        TypedSignature signature = TypedSignature.wrap(bytes);
        assertThat(signature.getType()).isEqualTo(SignatureType.INVALID);
        assertThat(signatureVerifier.recover(orderHash, signature)).isEqualTo(Address.ZERO);
    }

    @Test
    void zero_address_is_never_a_valid_signer() {
        TypedSignature garbage = TypedSignature.of(BigInteger.ZERO, BigInteger.ZERO, 27, SignatureType.NO_PREPEND);
        assertThat(signatureVerifier.recover(orderHash, garbage)).isEqualTo(Address.ZERO);
        assertThat(signatureVerifier.isSignedBy(orderHash, garbage, Address.ZERO)).isFalse();
        assertThat(signatureVerifier.isSignedBy(orderHash, null, MAKER)).isFalse();
    }
}
