package ir.ramtung.canonicalorders.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderState {
    private OrderStatus status;
    private BigInteger filledAmount;
}
