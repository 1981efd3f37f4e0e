package ir.ramtung.canonicalorders.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountInfo {
    private Address owner;
    private BigInteger number;
}
