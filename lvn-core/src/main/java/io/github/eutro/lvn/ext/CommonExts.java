package io.github.eutro.lvn.ext;

import io.github.eutro.lvn.ops.BinaryOpcode;
import io.github.eutro.lvn.ssa.BasicBlock;
import io.github.eutro.lvn.ssa.Control;
import io.github.eutro.lvn.ssa.Effect;
import io.github.eutro.lvn.ssa.Function;

/**
 * Exts used throughout the IR.
 */
public class CommonExts {
    public static final Ext<String> FUNCTION_NAME = Ext.create(String.class, "FUNCTION_NAME");

    /**
     * Marks operation keys which compute a value from their arguments alone.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");
    /**
     * Attached to the keys of two-operand arithmetic operations.
     */
    public static final Ext<BinaryOpcode> BINARY_OPCODE = Ext.create(BinaryOpcode.class, "BINARY_OPCODE");

    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
