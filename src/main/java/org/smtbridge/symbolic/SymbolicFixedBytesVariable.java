package org.smtbridge.symbolic;

import lombok.Getter;
import org.smtbridge.core.IntegerType;

/**
 * bytesN 的符号变量，按 8N 位无符号整数建模。
 */
@Getter
public class SymbolicFixedBytesVariable extends SymbolicIntVariable {

    private final int numBytes;

    public SymbolicFixedBytesVariable(int numBytes, String uniqueName, String ssaSeparator, SolverInterface solver) {
        super(IntegerType.unsigned(numBytes * 8), uniqueName, false, ssaSeparator, solver);
        this.numBytes = numBytes;
    }
}
