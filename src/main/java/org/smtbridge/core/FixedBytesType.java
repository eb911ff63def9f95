package org.smtbridge.core;

import lombok.Getter;
import org.smtbridge.utils.Contracts;

/**
 * 定长字节串类型 bytes1 .. bytes32。
 */
@Getter
public final class FixedBytesType extends Type {

    public static final int MAX_BYTES = 32;

    private final int numBytes;

    private FixedBytesType(int numBytes) {
        Contracts.require(numBytes > 0 && numBytes <= MAX_BYTES, "FixedBytesType-构造函数: 非法字节数 {}", numBytes);
        this.numBytes = numBytes;
    }

    public static FixedBytesType of(int numBytes) {
        return new FixedBytesType(numBytes);
    }

    @Override
    public Category getCategory() {
        return Category.FIXED_BYTES;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return numBytes == ((FixedBytesType) obj).numBytes;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(numBytes);
    }

    @Override
    public String toString() {
        return "bytes" + numBytes;
    }
}
