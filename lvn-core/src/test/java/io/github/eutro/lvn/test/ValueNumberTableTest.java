package io.github.eutro.lvn.test;

import io.github.eutro.lvn.numbering.ValueNumberTable;
import io.github.eutro.lvn.ops.CommonOps;
import io.github.eutro.lvn.ssa.Function;
import io.github.eutro.lvn.ssa.IRBuilder;
import io.github.eutro.lvn.ssa.Var;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueNumberTableTest {
    @Test
    void testNumbersByIdentity() {
        ValueNumberTable table = new ValueNumberTable();
        Var a = new Var("a", 0);
        Var alsoA = new Var("a", 0);
        assertEquals(1, table.numberOf(a));
        assertEquals(2, table.numberOf(alsoA));
        assertEquals(1, table.numberOf(a));
        assertEquals(2, table.size());
    }

    @Test
    void testConstantsShareNumbers() {
        ValueNumberTable table = new ValueNumberTable();
        assertEquals(1, table.numberOfConstant(5));
        assertEquals(2, table.numberOfConstant(-5));
        assertEquals(1, table.numberOfConstant(5));
        assertEquals(3, table.allocate());
    }

    @Test
    void testResolveInternsLiterals() {
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var k = ib.insert(CommonOps.constant(42), "k");
        Var kLong = ib.insert(CommonOps.constant(42L), "k");
        Var kChar = ib.insert(CommonOps.constant('*'), "k");
        Var arg = ib.insert(CommonOps.ARG.create(0).insn(), "arg");

        ValueNumberTable table = new ValueNumberTable();
        assertEquals(1, table.resolve(k));
        assertEquals(1, table.resolve(kLong));
        assertEquals(1, table.resolve(kChar));
        assertEquals(2, table.resolve(arg));
        assertEquals(1, table.values().get(kLong));
        assertEquals(Long.valueOf(42), CommonOps.integralConstant(kChar));
        assertNull(CommonOps.integralConstant(arg));
        assertNull(CommonOps.integralConstant(new Var("free", 0)));
    }

    @Test
    void testPointersLastWriteWins() {
        ValueNumberTable table = new ValueNumberTable();
        Var p = new Var("p", 0);
        assertNull(table.pointerNumber(p));
        table.recordPointerNumber(p, 4);
        table.recordPointerNumber(p, 2);
        assertEquals(2, table.pointerNumber(p));
        // pointers have their own map
        assertEquals(1, table.numberOf(p));
        assertEquals(0, new ValueNumberTable().size());
    }
}
