package io.github.eutro.lvn.ops;

import io.github.eutro.lvn.util.Disassembler;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;

import java.util.List;

/**
 * Operations that only come out of Java bytecode.
 */
public class JavaOps {
    /**
     * Effect: any bytecode instruction that has no dedicated operation.
     * Its arguments are the values it pops, its results the value it pushes, if any.
     */
    public static final UnaryOpKey<AbstractInsnNode> INSN = new UnaryOpKey<>("insn", Disassembler::disassembleInsn);

    /**
     * Control: jumps to the first target if the condition holds on the arguments,
     * otherwise to the second.
     */
    public static final UnaryOpKey<JumpType> BR_COND = new UnaryOpKey<>("br_cond");
    /**
     * Control: jumps to the target after the default whose key equals the argument,
     * or to the first (default) target if none does.
     */
    public static final UnaryOpKey<List<Integer>> SWITCH = new UnaryOpKey<>("switch");
    /**
     * Control: throws its argument.
     */
    public static final Op THROW = new SimpleOpKey("throw").create();

    /**
     * A conditional jump's condition. The jump is taken if the condition holds.
     */
    public enum JumpType {
        IFEQ(Opcodes.IFEQ, 1),
        IFNE(Opcodes.IFNE, 1),
        IFLT(Opcodes.IFLT, 1),
        IFGE(Opcodes.IFGE, 1),
        IFGT(Opcodes.IFGT, 1),
        IFLE(Opcodes.IFLE, 1),
        IF_ICMPEQ(Opcodes.IF_ICMPEQ, 2),
        IF_ICMPNE(Opcodes.IF_ICMPNE, 2),
        IF_ICMPLT(Opcodes.IF_ICMPLT, 2),
        IF_ICMPGE(Opcodes.IF_ICMPGE, 2),
        IF_ICMPGT(Opcodes.IF_ICMPGT, 2),
        IF_ICMPLE(Opcodes.IF_ICMPLE, 2),
        IF_ACMPEQ(Opcodes.IF_ACMPEQ, 2),
        IF_ACMPNE(Opcodes.IF_ACMPNE, 2),
        IFNULL(Opcodes.IFNULL, 1),
        IFNONNULL(Opcodes.IFNONNULL, 1),
        ;

        public final int opcode;
        /**
         * The number of values the jump pops.
         */
        public final int arity;

        JumpType(int opcode, int arity) {
            this.opcode = opcode;
            this.arity = arity;
        }

        public static JumpType fromOpcode(int opcode) {
            for (JumpType type : values()) {
                if (type.opcode == opcode) return type;
            }
            throw new IllegalArgumentException("Not a conditional jump: " + Disassembler.getMnemonic(opcode));
        }
    }
}
