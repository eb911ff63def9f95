package org.smtbridge.smt;

/**
 * 求解器能直接理解的排序种类。
 */
public enum Kind {
    INT,
    BOOL,
    FUNCTION,
    ARRAY
}
