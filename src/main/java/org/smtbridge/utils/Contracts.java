package org.smtbridge.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * 断言式的契约检查：先记录 error 日志，再抛出 {@link ContractViolationException}。
 */
public final class Contracts {

    private static final Logger logger = LoggerFactory.getLogger(Contracts.class);

    private Contracts() {
    }

    /**
     * 条件不成立时中止当前调用。
     * @param condition 必须成立的条件。
     * @param message SLF4J 风格的消息模板，{} 为占位符。
     * @param args 模板参数。
     * @throws ContractViolationException 如果条件不成立。
     */
    public static void require(boolean condition, String message, Object... args) {
        if (!condition) {
            throw violation(message, args);
        }
    }

    /**
     * 构造（并记录）一个契约违反异常，供调用者直接 throw。
     */
    public static ContractViolationException violation(String message, Object... args) {
        String formatted = MessageFormatter.arrayFormat(message, args).getMessage();
        logger.error("契约违反: {}", formatted);
        return new ContractViolationException(formatted);
    }
}
