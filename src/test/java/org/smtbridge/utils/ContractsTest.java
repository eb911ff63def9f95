package org.smtbridge.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContractsTest {

    @Test
    void testRequire_ShouldFormatMessage() {
        ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> Contracts.require(false, "期望 {} 个返回类型，实际为 {}", 1, 2));

        assertEquals("期望 1 个返回类型，实际为 2", e.getMessage());
    }

    @Test
    void testRequire_WhenConditionHolds() {
        assertDoesNotThrow(() -> Contracts.require(true, "unused {}", 0));
    }

    @Test
    void testViolationIsIllegalState() {
        assertInstanceOf(IllegalStateException.class, Contracts.violation("x"));
    }
}
