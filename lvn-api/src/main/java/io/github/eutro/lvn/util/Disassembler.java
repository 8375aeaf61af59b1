package io.github.eutro.lvn.util;

import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.LabelNode;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders Java bytecode instructions as text.
 */
public class Disassembler {
    private static Map<Integer, String> opcodeMnemonics = null;

    /**
     * Look up the mnemonic of a Java opcode, e.g. {@code "IADD"}.
     *
     * @param opcode The opcode.
     * @return The mnemonic, or null if there is no such opcode.
     */
    @Nullable
    public static String getMnemonic(int opcode) {
        if (opcodeMnemonics == null) generateMnemonics();
        return opcodeMnemonics.get(opcode);
    }

    /**
     * Disassemble one instruction: its mnemonic, then each of its
     * operands as {@code name=value}. Labels are left out.
     *
     * @param insn The instruction.
     * @return The text.
     */
    public static String disassembleInsn(AbstractInsnNode insn) {
        StringBuilder sb = new StringBuilder();
        String mnemonic = getMnemonic(insn.getOpcode());
        sb.append(mnemonic == null ? "<" + insn.getOpcode() + ">" : mnemonic);
        for (Field field : insn.getClass().getFields()) {
            if (Modifier.isStatic(field.getModifiers())) continue;
            Class<?> type = field.getType();
            if (LabelNode.class.isAssignableFrom(type) || List.class.isAssignableFrom(type)) continue;
            Object value;
            try {
                value = field.get(insn);
            } catch (IllegalAccessException e) {
                // getFields() only returns public fields
                throw new IllegalStateException(e);
            }
            if (value == null) continue;
            sb.append(' ')
                    .append(field.getName())
                    .append('=')
                    .append(value instanceof Object[] ? Arrays.toString((Object[]) value) : value);
        }
        return sb.toString();
    }

    private static synchronized void generateMnemonics() {
        if (opcodeMnemonics != null) return;
        Map<Integer, String> mnemonics = new HashMap<>();
        for (Field field : Opcodes.class.getFields()) {
            int mods = field.getModifiers();
            if (!(Modifier.isStatic(mods) && Modifier.isFinal(mods) && field.getType() == int.class)) continue;
            String name = field.getName();
            // flags, array types, handle kinds, frame kinds and versions share the opcodes' values
            if (name.startsWith("ACC_") || name.startsWith("T_") || name.startsWith("H_")
                    || name.startsWith("F_") || name.startsWith("V") || name.startsWith("ASM")
                    || name.startsWith("SOURCE_")) {
                continue;
            }
            try {
                mnemonics.put(field.getInt(null), name);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
        }
        opcodeMnemonics = mnemonics;
    }
}
