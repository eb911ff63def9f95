package org.smtbridge.utils;

/**
 * 内部不变式被破坏时抛出。
 * 表示本层或宿主类型系统的编程错误，而不是可恢复的运行时状况。
 * @author Ayalyt
 */
public class ContractViolationException extends IllegalStateException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
