package org.smtbridge.symbolic;

import org.smtbridge.core.IntegerType;
import org.smtbridge.translation.TypeNormalizer;

/**
 * 地址符号变量，固定为 160 位无符号整数。
 */
public class SymbolicAddressVariable extends SymbolicIntVariable {

    public SymbolicAddressVariable(String uniqueName, String ssaSeparator, SolverInterface solver) {
        super(IntegerType.unsigned(TypeNormalizer.ADDRESS_BITS), uniqueName, false, ssaSeparator, solver);
    }
}
