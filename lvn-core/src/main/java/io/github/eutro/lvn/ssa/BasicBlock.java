package io.github.eutro.lvn.ssa;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.ext.Ext;
import io.github.eutro.lvn.ext.ExtContainer;
import io.github.eutro.lvn.ext.ExtHolder;
import io.github.eutro.lvn.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A straight-line sequence of {@link Effect}s, ended by a {@link Control}.
 */
public final class BasicBlock extends ExtHolder {
    private final List<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            registerWithThis(elt);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    private <T extends ExtContainer> T registerWithThis(T extable) {
        if (extable != null) {
            extable.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        return extable;
    }

    /**
     * Get the effects of this block, in execution order. Changes to the list
     * keep the effects' {@link CommonExts#OWNING_BLOCK} up to date.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        this.control = registerWithThis(control);
    }

    /**
     * Get how this block is referred to as a jump target.
     *
     * @return The label, its position in the owning function if it has one.
     */
    public String toTargetString() {
        if (owner != null) {
            return "@" + owner.blocks.indexOf(this);
        }
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(" {\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        if (control != null) {
            sb.append("  ").append(control).append('\n');
        }
        sb.append('}');
        return sb.toString();
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
