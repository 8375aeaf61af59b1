package io.github.eutro.lvn.ops;

import io.github.eutro.lvn.ext.CommonExts;

import java.util.EnumMap;
import java.util.Map;

/**
 * Two-operand arithmetic operations, one per {@link BinaryOpcode}.
 * <p>
 * Each key carries its opcode as {@link CommonExts#BINARY_OPCODE}.
 */
public class ArithOps {
    private static final Map<BinaryOpcode, Op> OPS = new EnumMap<>(BinaryOpcode.class);

    public static final Op ADD = binary(BinaryOpcode.ADD);
    public static final Op SUB = binary(BinaryOpcode.SUB);
    public static final Op MUL = binary(BinaryOpcode.MUL);
    public static final Op DIV = binary(BinaryOpcode.DIV);
    public static final Op REM = binary(BinaryOpcode.REM);
    public static final Op AND = binary(BinaryOpcode.AND);
    public static final Op OR = binary(BinaryOpcode.OR);
    public static final Op XOR = binary(BinaryOpcode.XOR);
    public static final Op SHL = binary(BinaryOpcode.SHL);
    public static final Op SHR = binary(BinaryOpcode.SHR);
    public static final Op USHR = binary(BinaryOpcode.USHR);

    private static Op binary(BinaryOpcode opcode) {
        SimpleOpKey key = CommonExts.markPure(new SimpleOpKey(opcode.mnemonic));
        key.attachExt(CommonExts.BINARY_OPCODE, opcode);
        Op op = key.create();
        OPS.put(opcode, op);
        return op;
    }

    public static Op forOpcode(BinaryOpcode opcode) {
        return OPS.get(opcode);
    }
}
