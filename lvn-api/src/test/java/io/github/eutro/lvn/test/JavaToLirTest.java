package io.github.eutro.lvn.test;

import io.github.eutro.lvn.ClassAnalyzer;
import io.github.eutro.lvn.convert.JavaToLir;
import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.numbering.ValueNumbering;
import io.github.eutro.lvn.ops.ArithOps;
import io.github.eutro.lvn.ops.CommonOps;
import io.github.eutro.lvn.ops.MemoryOps;
import io.github.eutro.lvn.ops.Op;
import io.github.eutro.lvn.passes.meta.LocalValueNumbering;
import io.github.eutro.lvn.ssa.BasicBlock;
import io.github.eutro.lvn.ssa.Effect;
import io.github.eutro.lvn.ssa.Function;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JavaToLirTest {
    @SuppressWarnings("unused")
    static class Samples {
        static int commutative(int x, int y) {
            int a = x + y;
            int b = y + x;
            return a - b;
        }

        static int nonCommutative(int x, int y) {
            int a = x - y;
            int b = y - x;
            return a * b;
        }

        static int increment(int x) {
            x++;
            return x + 1;
        }

        static int literal() {
            int a = 5;
            int b = a;
            return b + 5;
        }

        static long wide(long a, long b) {
            long c = a + b;
            return c + (b + a);
        }

        static int abs(int x) {
            if (x < 0) return -x;
            return x;
        }

        int instance(int x) {
            return x * x;
        }
    }

    private static MethodNode sample(String name) {
        ClassNode node = new ClassNode();
        ClassAnalyzer.getClassReaderFor(Samples.class).accept(node, ClassReader.SKIP_DEBUG);
        for (MethodNode method : node.methods) {
            if (method.name.equals(name)) return method;
        }
        throw new AssertionError("no method " + name);
    }

    private static Function convert(String name) {
        return new JavaToLir(null).run(sample(name));
    }

    private static ValueNumbering number(Function func) {
        return new LocalValueNumbering(line -> {
        }).run(func);
    }

    private static List<Effect> effects(Function func, Op op) {
        List<Effect> found = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                if (effect.insn().op == op) found.add(effect);
            }
        }
        return found;
    }

    private static List<String> lines(BasicBlock block) {
        return block.getEffects().stream().map(Effect::toString).collect(Collectors.toList());
    }

    private static Function convert(String desc, AbstractInsnNode... insns) {
        MethodNode method = new MethodNode(Opcodes.ACC_STATIC, "m", desc, null, null);
        for (AbstractInsnNode insn : insns) {
            method.instructions.add(insn);
        }
        return new JavaToLir(null).run(method);
    }

    @Test
    void testEntryBlock() {
        Function func = convert("commutative");
        assertEquals("commutative(II)I", func.getExtOrThrow(CommonExts.FUNCTION_NAME));
        assertEquals(Arrays.asList(
                "$local0 = local 0",
                "$local1 = local 1",
                "$local2 = local 2",
                "$local3 = local 3",
                "$arg0 = arg 0",
                "store $arg0 $local0",
                "$arg1 = arg 1",
                "store $arg1 $local1"
        ), lines(func.blocks.get(0)).subList(0, 8));
    }

    @Test
    void testInstanceEntryBlock() {
        Function func = convert("instance");
        assertEquals(Arrays.asList(
                "$local0 = local 0",
                "$local1 = local 1",
                "$this = arg 0",
                "store $this $local0",
                "$arg1 = arg 1",
                "store $arg1 $local1"
        ), lines(func.blocks.get(0)).subList(0, 6));
    }

    @Test
    void testCommutativeRedundant() {
        Function func = convert("commutative");
        ValueNumbering vn = number(func);
        List<Effect> adds = effects(func, ArithOps.ADD);
        assertEquals(2, adds.size());
        assertEquals(Arrays.asList(adds.get(1)), vn.getRedundant());
        assertEquals(vn.getNumber(adds.get(0).getAssignsTo().get(0)),
                vn.getNumber(adds.get(1).getAssignsTo().get(0)));
    }

    @Test
    void testNonCommutativeDistinct() {
        Function func = convert("nonCommutative");
        ValueNumbering vn = number(func);
        List<Effect> subs = effects(func, ArithOps.SUB);
        assertEquals(2, subs.size());
        assertTrue(vn.getRedundant().isEmpty());
        assertNotEquals(vn.getNumber(subs.get(0).getAssignsTo().get(0)),
                vn.getNumber(subs.get(1).getAssignsTo().get(0)));
    }

    @Test
    void testIincLowering() {
        Function func = convert("increment");
        assertEquals(1, func.blocks.size());
        assertEquals(Arrays.asList(
                "$local0 = local 0",
                "$arg0 = arg 0",
                "store $arg0 $local0",
                "$v = load $local0",
                "$v.1 = const 1",
                "$v.2 = add $v $v.1",
                "store $v.2 $local0",
                "$v.3 = load $local0",
                "$v.4 = const 1",
                "$v.5 = add $v.3 $v.4"
        ), lines(func.blocks.get(0)));
        assertEquals("return $v.5", func.blocks.get(0).getControl().toString());

        ValueNumbering vn = number(func);
        List<Effect> loads = effects(func, MemoryOps.LOAD);
        List<Effect> adds = effects(func, ArithOps.ADD);
        // the reload sees the incremented value
        assertEquals(vn.getNumber(adds.get(0).getAssignsTo().get(0)),
                vn.getNumber(loads.get(1).getAssignsTo().get(0)));
        assertTrue(vn.getRedundant().isEmpty());
    }

    @Test
    void testStoredLiteralReloaded() {
        Function func = convert("literal");
        ValueNumbering vn = number(func);
        List<Effect> consts = new ArrayList<>();
        for (Effect effect : func.blocks.get(0).getEffects()) {
            if (CommonOps.CONST.checkNullable(effect.insn().op) != null) consts.add(effect);
        }
        assertEquals(2, consts.size());
        Integer five = vn.getNumber(consts.get(0).getAssignsTo().get(0));
        assertNotNull(five);
        assertEquals(five, vn.getNumber(consts.get(1).getAssignsTo().get(0)));
        for (Effect load : effects(func, MemoryOps.LOAD)) {
            assertEquals(five, vn.getNumber(load.getAssignsTo().get(0)));
        }
    }

    @Test
    void testWideSlots() {
        Function func = convert("wide");
        List<String> lines = lines(func.blocks.get(0));
        assertEquals(Arrays.asList(
                "$local0 = local 0",
                "$local1 = local 1",
                "$local2 = local 2",
                "$local3 = local 3",
                "$local4 = local 4",
                "$local5 = local 5",
                "$arg0 = arg 0",
                "store $arg0 $local0",
                "$arg1 = arg 1",
                "store $arg1 $local2"
        ), lines.subList(0, 10));
        assertTrue(lines.contains("store $v.2 $local4"));

        ValueNumbering vn = number(func);
        List<Effect> adds = effects(func, ArithOps.ADD);
        assertEquals(3, adds.size());
        assertEquals(Arrays.asList(adds.get(1)), vn.getRedundant());
    }

    @Test
    void testBranches() {
        Function func = convert("abs");
        assertEquals(3, func.blocks.size());
        assertEquals("br_cond IFGE $v -> @2 @1", func.blocks.get(0).getControl().toString());
        assertEquals(Arrays.asList(
                "$v.1 = load $local0",
                "$v.2 = insn INEG $v.1"
        ), lines(func.blocks.get(1)));
        assertEquals("return $v.2", func.blocks.get(1).getControl().toString());
        assertEquals(Arrays.asList("$v.3 = load $local0"), lines(func.blocks.get(2)));
        assertEquals("return $v.3", func.blocks.get(2).getControl().toString());
    }

    @Test
    void testInsnArgs() {
        Function func = convert("abs");
        Effect neg = func.blocks.get(1).getEffects().get(1);
        assertEquals(1, neg.insn().args().size());
        assertSame(func.blocks.get(1).getEffects().get(0).getAssignsTo().get(0), neg.insn().args().get(0));
    }

    @Test
    void testDup2Wide() {
        Function func = convert("()J",
                new InsnNode(Opcodes.LCONST_1),
                new InsnNode(Opcodes.DUP2),
                new InsnNode(Opcodes.LADD),
                new InsnNode(Opcodes.LRETURN));
        assertEquals(Arrays.asList("$v = const 1", "$v.1 = add $v $v"), lines(func.blocks.get(0)));
        assertEquals("return $v.1", func.blocks.get(0).getControl().toString());
    }

    @Test
    void testDup2Narrow() {
        Function func = convert("()I",
                new InsnNode(Opcodes.ICONST_1),
                new InsnNode(Opcodes.ICONST_2),
                new InsnNode(Opcodes.DUP2),
                new InsnNode(Opcodes.IADD),
                new InsnNode(Opcodes.IADD),
                new InsnNode(Opcodes.IADD),
                new InsnNode(Opcodes.IRETURN));
        assertEquals(Arrays.asList(
                "$v = const 1",
                "$v.1 = const 2",
                "$v.2 = add $v $v.1",
                "$v.3 = add $v.1 $v.2",
                "$v.4 = add $v $v.3"
        ), lines(func.blocks.get(0)));
    }

    @Test
    void testDupX1AndSwap() {
        Function func = convert("()I",
                new InsnNode(Opcodes.ICONST_1),
                new InsnNode(Opcodes.ICONST_2),
                new InsnNode(Opcodes.DUP_X1),
                new InsnNode(Opcodes.ISUB),
                new InsnNode(Opcodes.SWAP),
                new InsnNode(Opcodes.ISUB),
                new InsnNode(Opcodes.IRETURN));
        assertEquals(Arrays.asList(
                "$v = const 1",
                "$v.1 = const 2",
                "$v.2 = sub $v $v.1",
                "$v.3 = sub $v.2 $v.1"
        ), lines(func.blocks.get(0)));
    }

    @Test
    void testJoinWithoutFrames() {
        // x + (y == 0 ? 2 : 1), as compiled before stack map frames
        LabelNode elseLabel = new LabelNode();
        LabelNode join = new LabelNode();
        Function func = convert("(II)I",
                new VarInsnNode(Opcodes.ILOAD, 0),
                new VarInsnNode(Opcodes.ILOAD, 1),
                new JumpInsnNode(Opcodes.IFEQ, elseLabel),
                new InsnNode(Opcodes.ICONST_1),
                new JumpInsnNode(Opcodes.GOTO, join),
                elseLabel,
                new InsnNode(Opcodes.ICONST_2),
                join,
                new InsnNode(Opcodes.IADD),
                new InsnNode(Opcodes.IRETURN));
        assertEquals(4, func.blocks.size());
        assertEquals("br_cond IFEQ $v.1 -> @2 @1", func.blocks.get(0).getControl().toString());
        assertEquals(Arrays.asList("$v.4 = const 2"), lines(func.blocks.get(2)));
        assertEquals(Arrays.asList("$v.5 = add $v.3 $v.4"), lines(func.blocks.get(3)));
        assertEquals("return $v.5", func.blocks.get(3).getControl().toString());
    }

    @Test
    void testWideJoinWithoutFrames() {
        LabelNode target = new LabelNode();
        Function func = convert("(JI)J",
                new VarInsnNode(Opcodes.LLOAD, 0),
                new VarInsnNode(Opcodes.ILOAD, 2),
                new JumpInsnNode(Opcodes.IFEQ, target),
                new InsnNode(Opcodes.LCONST_1),
                new InsnNode(Opcodes.LADD),
                new InsnNode(Opcodes.LRETURN),
                target,
                new InsnNode(Opcodes.DUP2),
                new InsnNode(Opcodes.LADD),
                new InsnNode(Opcodes.LRETURN));
        BasicBlock last = func.blocks.get(func.blocks.size() - 1);
        assertEquals(Arrays.asList("$v.5 = add $v.4 $v.4"), lines(last));
    }

    @Test
    void testIntAndLongShareNumbers() {
        // 5 + 5 and 5L + 5L get the same number: widths share opcode and constant keys
        Function func = convert("()V",
                new InsnNode(Opcodes.ICONST_5),
                new InsnNode(Opcodes.ICONST_5),
                new InsnNode(Opcodes.IADD),
                new InsnNode(Opcodes.POP),
                new LdcInsnNode(5L),
                new LdcInsnNode(5L),
                new InsnNode(Opcodes.LADD),
                new InsnNode(Opcodes.POP2),
                new InsnNode(Opcodes.RETURN));
        ValueNumbering vn = number(func);
        List<Effect> adds = effects(func, ArithOps.ADD);
        assertEquals(2, adds.size());
        assertEquals(Arrays.asList(adds.get(1)), vn.getRedundant());
    }

    @Test
    void testSplitWideValue() {
        assertThrows(IllegalStateException.class, () -> convert("()V",
                new InsnNode(Opcodes.ICONST_1),
                new InsnNode(Opcodes.LCONST_0),
                new InsnNode(Opcodes.SWAP)));
    }

    @Test
    void testStackUnderflow() {
        assertThrows(IllegalStateException.class, () -> convert("()I",
                new InsnNode(Opcodes.ICONST_1),
                new InsnNode(Opcodes.IADD)));
    }

    @Test
    void testJsrRejected() {
        LabelNode label = new LabelNode();
        assertThrows(IllegalArgumentException.class, () -> convert("()V",
                new JumpInsnNode(Opcodes.JSR, label),
                label,
                new InsnNode(Opcodes.RETURN)));
    }

    @Test
    void testOpaqueInvoke() {
        Function func = convert("()V",
                new InsnNode(Opcodes.ICONST_1),
                new MethodInsnNode(Opcodes.INVOKESTATIC, "java/lang/Integer", "valueOf",
                        "(I)Ljava/lang/Integer;", false),
                new InsnNode(Opcodes.POP),
                new InsnNode(Opcodes.RETURN));
        List<String> lines = lines(func.blocks.get(0));
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).startsWith("$v.1 = insn INVOKESTATIC"), lines.get(1));
        assertTrue(lines.get(1).endsWith(" $v"), lines.get(1));
        assertEquals("return", func.blocks.get(0).getControl().toString());
    }
}
