package ir.ramtung.canonicalorders.domain.service;

import ir.ramtung.canonicalorders.domain.entity.Address;
import ir.ramtung.canonicalorders.domain.entity.Order;
import ir.ramtung.canonicalorders.domain.entity.OrderHash;
import ir.ramtung.canonicalorders.messaging.codec.AbiWords;
import ir.ramtung.canonicalorders.messaging.codec.OrderCodec;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * EIP-712 typed hashing of canonical orders. The domain separator is fixed at
 * construction from the chain id and the address orders are signed for.
 */
@Component
public class OrderHasher {
    public static final String EIP712_DOMAIN_NAME = "CanonicalOrders";
    public static final String EIP712_DOMAIN_VERSION = "1.1";
    public static final String EIP712_DOMAIN_SCHEMA =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
    public static final String EIP712_ORDER_STRUCT_SCHEMA = "CanonicalOrder("
            + "bytes32 flags,"
            + "uint256 baseMarket,"
            + "uint256 quoteMarket,"
            + "uint256 amount,"
            + "uint256 limitPrice,"
            + "uint256 triggerPrice,"
            + "uint256 limitFee,"
            + "address makerAccountOwner,"
            + "uint256 makerAccountNumber,"
            + "address taker,"
            + "uint256 expiration"
            + ")";
    private static final byte[] EIP191_HEADER = {0x19, 0x01};
    private static final byte[] EIP712_DOMAIN_SCHEMA_HASH = Keccak.keccak256(EIP712_DOMAIN_SCHEMA);
    private static final byte[] EIP712_ORDER_STRUCT_SCHEMA_HASH = Keccak.keccak256(EIP712_ORDER_STRUCT_SCHEMA);

    @Getter
    private final byte[] domainSeparator;

    public OrderHasher(@Value("${canonical.chain-id}") long chainId,
                       @Value("${canonical.contract-address}") String contractAddress) {
        this.domainSeparator = Keccak.keccak256(
                EIP712_DOMAIN_SCHEMA_HASH,
                Keccak.keccak256(EIP712_DOMAIN_NAME),
                Keccak.keccak256(EIP712_DOMAIN_VERSION),
                AbiWords.uint256(BigInteger.valueOf(chainId)),
                AbiWords.address(Address.of(contractAddress)));
    }

    public OrderHash hashOrder(Order order) {
        byte[] structHash = Keccak.keccak256(EIP712_ORDER_STRUCT_SCHEMA_HASH, OrderCodec.encodeOrder(order));
        return OrderHash.wrap(Keccak.keccak256(EIP191_HEADER, domainSeparator, structHash));
    }
}
