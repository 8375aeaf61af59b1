package io.github.eutro.lvn.passes.meta;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.numbering.DiagnosticSink;
import io.github.eutro.lvn.numbering.Expression;
import io.github.eutro.lvn.numbering.ValueNumberTable;
import io.github.eutro.lvn.numbering.ValueNumbering;
import io.github.eutro.lvn.ops.BinaryOpcode;
import io.github.eutro.lvn.ops.MemoryOps;
import io.github.eutro.lvn.passes.IRPass;
import io.github.eutro.lvn.ssa.BasicBlock;
import io.github.eutro.lvn.ssa.Effect;
import io.github.eutro.lvn.ssa.Function;
import io.github.eutro.lvn.ssa.Insn;
import io.github.eutro.lvn.ssa.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Local value numbering: walks every block of a function in order, numbering
 * the values of {@code store}s, {@code load}s and binary operations, and
 * finding binary operations that recompute an expression seen earlier in the walk.
 * <p>
 * Each handled effect produces one diagnostic line, the effect's text padded to
 * the column width followed by its numbers:
 * <pre>
 * store $k $p          1 = 1
 * $x = load $p         1 = 1
 * $y = add $x $x       2 = 1 add 1
 * $z = add $x $x       2 = 1 add 1 (redundant)
 * </pre>
 * Other effects, and block controls, are skipped. The function is not modified.
 */
public class LocalValueNumbering implements IRPass<Function, ValueNumbering> {
    public static final int DEFAULT_COLUMN_WIDTH = 40;

    private final DiagnosticSink sink;
    private final int columnWidth;

    public LocalValueNumbering(DiagnosticSink sink, int columnWidth) {
        if (columnWidth < 0) {
            throw new IllegalArgumentException("negative column width: " + columnWidth);
        }
        this.sink = sink;
        this.columnWidth = columnWidth;
    }

    public LocalValueNumbering(DiagnosticSink sink) {
        this(sink, DEFAULT_COLUMN_WIDTH);
    }

    @Override
    public boolean isAnalysis() {
        return true;
    }

    @Override
    public ValueNumbering run(Function func) {
        return new Walker(func).walk();
    }

    private class Walker {
        private final Function func;
        private final ValueNumberTable table = new ValueNumberTable();
        private final Map<Expression, Integer> expressions = new TreeMap<>();
        private final List<Effect> redundant = new ArrayList<>();
        private final List<String> diagnostics = new ArrayList<>();

        Walker(Function func) {
            this.func = func;
        }

        ValueNumbering walk() {
            emit("ValueNumbering: " + func.getExt(CommonExts.FUNCTION_NAME).orElse("<anonymous>"));
            for (BasicBlock block : func.blocks) {
                for (Effect effect : block.getEffects()) {
                    visit(effect);
                }
            }
            return new ValueNumbering(func, table, redundant, diagnostics);
        }

        private void visit(Effect effect) {
            Insn insn = effect.insn();
            List<Var> args = insn.args();
            List<Var> results = effect.getAssignsTo();
            if (insn.op.key == MemoryOps.STORE.key) {
                if (args.size() == 2) visitStore(effect, args.get(0), args.get(1));
            } else if (insn.op.key == MemoryOps.LOAD.key) {
                if (args.size() == 1 && results.size() == 1) visitLoad(effect, results.get(0), args.get(0));
            } else {
                BinaryOpcode opcode = insn.getNullable(CommonExts.BINARY_OPCODE);
                if (opcode != null && args.size() == 2 && results.size() == 1) {
                    visitBinary(effect, opcode, results.get(0), args.get(0), args.get(1));
                }
            }
        }

        private void visitStore(Effect effect, Var value, Var pointer) {
            int number = table.resolve(value);
            table.recordPointerNumber(pointer, number);
            emit(effect, number + " = " + number);
        }

        private void visitLoad(Effect effect, Var result, Var pointer) {
            Integer stored = table.pointerNumber(pointer);
            int number = stored == null ? table.allocate() : stored;
            table.assign(result, number);
            emit(effect, number + " = " + (stored == null ? "?" : stored.toString()));
        }

        private void visitBinary(Effect effect, BinaryOpcode opcode, Var result, Var lhs, Var rhs) {
            int lhsNumber = table.resolve(lhs);
            int rhsNumber = table.resolve(rhs);
            Expression expr = Expression.of(opcode, lhsNumber, rhsNumber);
            String operands = lhsNumber + " " + opcode + " " + rhsNumber;
            Integer known = expressions.get(expr);
            if (known != null) {
                table.assign(result, known);
                redundant.add(effect);
                emit(effect, known + " = " + operands + " (redundant)");
            } else {
                int number = table.allocate();
                table.assign(result, number);
                expressions.put(expr, number);
                emit(effect, number + " = " + operands);
            }
        }

        private void emit(Effect effect, String numbers) {
            StringBuilder sb = new StringBuilder(effect.toString());
            while (sb.length() < columnWidth) {
                sb.append(' ');
            }
            emit(sb.append(' ').append(numbers).toString());
        }

        private void emit(String line) {
            diagnostics.add(line);
            sink.emit(line);
        }
    }
}
