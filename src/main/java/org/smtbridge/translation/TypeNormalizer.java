package org.smtbridge.translation;

import org.smtbridge.core.FixedBytesType;
import org.smtbridge.core.IntegerType;
import org.smtbridge.core.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 把类数值类别改写为求解器可用的规范整数类型：
 * address -> uint160，bytesN -> uint(8N)，有理数字面量 -> int256。
 * 其余类型原样返回；映射和函数的叶子类型由使用方按需规范化。
 */
public final class TypeNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TypeNormalizer.class);

    public static final int ADDRESS_BITS = 160;
    public static final int RATIONAL_BITS = 256;

    private TypeNormalizer() {
    }

    public static Type normalize(Type type) {
        Objects.requireNonNull(type, "TypeNormalizer: type 不能为 null");
        Type result = type;
        if (CategoryTaxonomy.isAddress(type.getCategory())) {
            result = IntegerType.unsigned(ADDRESS_BITS);
        } else if (CategoryTaxonomy.isFixedBytes(type.getCategory())) {
            result = IntegerType.unsigned(((FixedBytesType) type).getNumBytes() * 8);
        } else if (CategoryTaxonomy.isRational(type.getCategory())) {
            result = IntegerType.signed(RATIONAL_BITS);
        }
        if (result != type) {
            logger.debug("规范化类型 {} -> {}", type, result);
        }
        return result;
    }
}
