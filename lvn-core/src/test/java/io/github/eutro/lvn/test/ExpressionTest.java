package io.github.eutro.lvn.test;

import io.github.eutro.lvn.numbering.Expression;
import io.github.eutro.lvn.ops.BinaryOpcode;
import org.junit.jupiter.api.Test;

import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionTest {
    @Test
    void testCommutativeOpcodesSortOperands() {
        for (BinaryOpcode opcode : new BinaryOpcode[]{BinaryOpcode.ADD, BinaryOpcode.MUL}) {
            Expression forward = Expression.of(opcode, 3, 7);
            Expression backward = Expression.of(opcode, 7, 3);
            assertEquals(forward, backward);
            assertEquals(forward.hashCode(), backward.hashCode());
            assertEquals(0, forward.compareTo(backward));
            assertEquals(3, backward.lhs);
            assertEquals(7, backward.rhs);
        }
    }

    @Test
    void testOtherOpcodesKeepOrder() {
        for (BinaryOpcode opcode : BinaryOpcode.values()) {
            if (opcode.commutative) continue;
            Expression forward = Expression.of(opcode, 3, 7);
            Expression backward = Expression.of(opcode, 7, 3);
            assertNotEquals(forward, backward);
            assertNotEquals(0, forward.compareTo(backward));
        }
    }

    @Test
    void testOpcodeIsPartOfTheKey() {
        assertNotEquals(Expression.of(BinaryOpcode.ADD, 1, 2), Expression.of(BinaryOpcode.MUL, 1, 2));
        assertTrue(Expression.of(BinaryOpcode.ADD, 9, 9).compareTo(Expression.of(BinaryOpcode.SUB, 1, 1)) < 0);
    }

    @Test
    void testUsableAsOrderedKey() {
        TreeMap<Expression, Integer> table = new TreeMap<>();
        table.put(Expression.of(BinaryOpcode.ADD, 2, 1), 3);
        table.put(Expression.of(BinaryOpcode.SUB, 2, 1), 4);
        assertEquals(3, table.get(Expression.of(BinaryOpcode.ADD, 1, 2)));
        assertNull(table.get(Expression.of(BinaryOpcode.SUB, 1, 2)));
        assertEquals("1 add 2", table.firstKey().toString());
    }
}
