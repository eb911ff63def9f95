package org.smtbridge.core;

import lombok.Getter;
import org.smtbridge.utils.Contracts;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 定宽整数类型，例如 uint256、int8。
 * 位宽为 8 到 256 之间 8 的倍数。
 * @author Ayalyt
 */
@Getter
public final class IntegerType extends Type {

    public static final int MAX_BITS = 256;

    private final int numBits;
    private final boolean signed;
    private final int hashCode;

    private IntegerType(int numBits, boolean signed) {
        Contracts.require(numBits > 0 && numBits <= MAX_BITS && numBits % 8 == 0,
                "IntegerType-构造函数: 非法位宽 {}", numBits);
        this.numBits = numBits;
        this.signed = signed;
        this.hashCode = Objects.hash(numBits, signed);
    }

    public static IntegerType unsigned(int numBits) {
        return new IntegerType(numBits, false);
    }

    public static IntegerType signed(int numBits) {
        return new IntegerType(numBits, true);
    }

    public static IntegerType of(int numBits, boolean signed) {
        return new IntegerType(numBits, signed);
    }

    /**
     * 无符号为 0，有符号为 -2^(n-1)。
     */
    public BigInteger minValue() {
        if (signed) {
            return BigInteger.ONE.shiftLeft(numBits - 1).negate();
        }
        return BigInteger.ZERO;
    }

    /**
     * 无符号为 2^n - 1，有符号为 2^(n-1) - 1。
     */
    public BigInteger maxValue() {
        if (signed) {
            return BigInteger.ONE.shiftLeft(numBits - 1).subtract(BigInteger.ONE);
        }
        return BigInteger.ONE.shiftLeft(numBits).subtract(BigInteger.ONE);
    }

    @Override
    public Category getCategory() {
        return Category.INTEGER;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        IntegerType other = (IntegerType) obj;
        return numBits == other.numBits && signed == other.signed;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return (signed ? "int" : "uint") + numBits;
    }
}
