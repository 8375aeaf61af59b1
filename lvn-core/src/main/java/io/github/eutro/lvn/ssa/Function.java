package io.github.eutro.lvn.ssa;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.ext.Ext;
import io.github.eutro.lvn.ext.ExtHolder;
import io.github.eutro.lvn.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function: a list of basic blocks, the first of which is the entry.
 */
public final class Function extends ExtHolder {
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    };

    private final Map<String, Integer> varCounts = new HashMap<>();

    public Function() {
    }

    public Function(String name) {
        attachExt(CommonExts.FUNCTION_NAME, name);
    }

    /**
     * Create a new variable. Variables of the same name are numbered in
     * creation order, so the first {@code "x"} prints as {@code $x} and the
     * next as {@code $x.1}.
     *
     * @param name The name of the variable.
     * @return The variable.
     */
    public Var newVar(String name) {
        int index = varCounts.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(getExt(CommonExts.FUNCTION_NAME).orElse("")).append("() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append('}');
        return sb.toString();
    }

    // exts
    private String name = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.FUNCTION_NAME) {
            return (T) name;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.FUNCTION_NAME) {
            name = (String) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.FUNCTION_NAME) {
            name = null;
            return;
        }
        super.removeExt(ext);
    }
}
