package io.github.eutro.lvn.convert;

import io.github.eutro.lvn.ops.ArithOps;
import io.github.eutro.lvn.ops.CommonOps;
import io.github.eutro.lvn.ops.JavaOps;
import io.github.eutro.lvn.ops.MemoryOps;
import io.github.eutro.lvn.ops.Op;
import io.github.eutro.lvn.passes.IRPass;
import io.github.eutro.lvn.ssa.BasicBlock;
import io.github.eutro.lvn.ssa.Control;
import io.github.eutro.lvn.ssa.Function;
import io.github.eutro.lvn.ssa.IRBuilder;
import io.github.eutro.lvn.ssa.Insn;
import io.github.eutro.lvn.ssa.Var;
import io.github.eutro.lvn.util.Disassembler;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.*;

import java.util.*;

/**
 * Converts a method's bytecode to the IR.
 * <p>
 * Local variable slots become pointers, allocated in the entry block with
 * {@link MemoryOps#LOCAL}, so that every {@code xLOAD} and {@code xSTORE}
 * is a {@link MemoryOps#LOAD} or {@link MemoryOps#STORE} through them.
 * The operand stack is simulated, with a fresh variable for every value pushed.
 */
public class JavaToLir implements IRPass<MethodNode, Function> {
    private final @Nullable String owner;

    /**
     * @param owner The internal name of the class the methods belong to,
     *              used to name the converted functions. May be null.
     */
    public JavaToLir(@Nullable String owner) {
        this.owner = owner;
    }

    @Override
    public Function run(MethodNode method) {
        String name = method.name + method.desc;
        Function func = new Function(owner == null ? name : owner + "." + name);
        new Converter(func, method).convert();
        return func;
    }

    private static class Converter {
        private final Function func;
        private final MethodNode method;
        private final IRBuilder ib;
        private final BasicBlock entry;

        private final Map<LabelNode, BasicBlock> labelMap = new HashMap<>();
        private final Set<LabelNode> handlers = new HashSet<>();
        // the stack at the first jump to each label, true for category 2 entries
        private final Map<LabelNode, List<Boolean>> jumpShapes = new HashMap<>();
        private final List<Var> slots = new ArrayList<>();
        private int slotEffects = 0;

        // null if unknown, after an unconditional jump
        private @Nullable List<Var> stack = new ArrayList<>();
        private final Set<Var> wide = Collections.newSetFromMap(new IdentityHashMap<>());

        private Converter(Function func, MethodNode method) {
            this.func = func;
            this.method = method;
            entry = func.newBb();
            ib = new IRBuilder(func, entry);
        }

        void convert() {
            for (int i = 0; i < method.maxLocals; i++) {
                slot(i);
            }
            if (method.tryCatchBlocks != null) {
                for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
                    handlers.add(tcb.handler);
                }
            }

            int argIdx = 0;
            int slotIdx = 0;
            if ((method.access & Opcodes.ACC_STATIC) == 0) {
                Var thisVar = ib.insert(CommonOps.ARG.create(argIdx++).insn(), "this");
                ib.insert(MemoryOps.STORE.insn(thisVar, slot(slotIdx++)).assignTo());
            }
            Type[] argTypes = Type.getArgumentTypes(method.desc);
            for (Type argType : argTypes) {
                Var arg = ib.insert(CommonOps.ARG.create(argIdx).insn(), "arg" + argIdx);
                argIdx++;
                ib.insert(MemoryOps.STORE.insn(arg, slot(slotIdx)).assignTo());
                slotIdx += argType.getSize();
            }

            for (AbstractInsnNode insn : method.instructions) {
                execute(insn);
            }
        }

        Var slot(int n) {
            while (slots.size() <= n) {
                int i = slots.size();
                Var ptr = func.newVar("local" + i);
                // pointers go before anything else in the entry block, even if allocated late
                entry.getEffects().add(slotEffects++, MemoryOps.LOCAL.create(i).insn().assignTo(ptr));
                slots.add(ptr);
            }
            return slots.get(n);
        }

        List<Var> knownStack() {
            if (stack == null) throw new IllegalStateException("unknown stack");
            return stack;
        }

        void push(Var var) {
            knownStack().add(var);
        }

        Var push(boolean isWide) {
            Var var = func.newVar("v");
            if (isWide) wide.add(var);
            push(var);
            return var;
        }

        Var pop() {
            List<Var> stack = knownStack();
            if (stack.isEmpty()) throw new IllegalStateException("stack underflow");
            return stack.remove(stack.size() - 1);
        }

        List<Var> pop(int n) {
            Var[] vars = new Var[n];
            for (int i = n - 1; i >= 0; i--) {
                vars[i] = pop();
            }
            return Arrays.asList(vars);
        }

        /**
         * Pop values off the stack that occupy exactly {@code n} words.
         *
         * @return The values, bottom first.
         */
        List<Var> popWords(int n) {
            LinkedList<Var> vars = new LinkedList<>();
            int words = 0;
            while (words < n) {
                Var var = pop();
                words += wide.contains(var) ? 2 : 1;
                vars.addFirst(var);
            }
            if (words != n) throw new IllegalStateException("splits a long or double");
            return vars;
        }

        void pushAll(List<Var> vars) {
            for (Var var : vars) push(var);
        }

        void insert(Insn insn, int results, boolean isWide) {
            if (results == 0) {
                ib.insert(insn.assignTo());
            } else {
                Var result = func.newVar("v");
                ib.insert(insn, result);
                if (isWide) wide.add(result);
                push(result);
            }
        }

        void constant(Object k, boolean isWide) {
            Var var = ib.insert(CommonOps.constant(k), "v");
            if (isWide) wide.add(var);
            push(var);
        }

        void opaque(AbstractInsnNode insn, int arity, boolean hasResult) {
            List<Var> args = pop(arity);
            insert(JavaOps.INSN.create(insn.clone(Collections.emptyMap())).insn(args),
                    hasResult ? 1 : 0,
                    isWideResult(insn));
        }

        void binary(Op op, AbstractInsnNode insn) {
            List<Var> args = pop(2);
            insert(op.insn(args), 1, isWideResult(insn));
        }

        BasicBlock block(LabelNode label) {
            return labelMap.computeIfAbsent(label, $ -> new BasicBlock());
        }

        /**
         * Get the block for a label that is being jumped to from the current stack.
         */
        BasicBlock jumpTarget(LabelNode label) {
            if (!jumpShapes.containsKey(label)) {
                List<Boolean> shape = new ArrayList<>();
                for (Var var : knownStack()) {
                    shape.add(wide.contains(var));
                }
                jumpShapes.put(label, shape);
            }
            return block(label);
        }

        void enter(BasicBlock target) {
            func.blocks.add(target);
            ib.setBlock(target);
        }

        void jump(Control ctrl) {
            ib.insertCtrl(ctrl);
        }

        void setLabel(LabelNode label) {
            BasicBlock bb = ib.getBlock();
            BasicBlock target = labelMap.get(label);
            if (target == null) {
                if (bb != entry && bb.getEffects().isEmpty() && bb.getControl() == null) {
                    labelMap.put(label, bb);
                    target = bb;
                } else {
                    target = block(label);
                }
            }
            if (target != bb) {
                if (bb.getControl() == null) {
                    jump(Control.br(target));
                }
                enter(target);
            }
            if (stack == null) {
                // no frame may follow, as in class files before version 50
                stack = new ArrayList<>();
                if (handlers.contains(label)) {
                    push(false);
                } else {
                    List<Boolean> shape = jumpShapes.get(label);
                    if (shape != null) {
                        for (boolean isWide : shape) push(isWide);
                    }
                }
            }
        }

        void setFrame(FrameNode frame) {
            stack = new ArrayList<>();
            if (frame.stack == null) return;
            for (Object type : frame.stack) {
                push(type == Opcodes.LONG || type == Opcodes.DOUBLE);
            }
        }

        void execute(AbstractInsnNode insn) {
            int opcode = insn.getOpcode();
            switch (insn.getType()) {
                case AbstractInsnNode.LABEL:
                    setLabel((LabelNode) insn);
                    return;
                case AbstractInsnNode.FRAME:
                    setFrame((FrameNode) insn);
                    return;
                case AbstractInsnNode.LINE:
                    return;
            }

            switch (opcode) {
                case Opcodes.NOP:
                    break;

                case Opcodes.ACONST_NULL:
                    constant(null, false);
                    break;
                case Opcodes.ICONST_M1:
                case Opcodes.ICONST_0:
                case Opcodes.ICONST_1:
                case Opcodes.ICONST_2:
                case Opcodes.ICONST_3:
                case Opcodes.ICONST_4:
                case Opcodes.ICONST_5:
                    constant(opcode - Opcodes.ICONST_0, false);
                    break;
                case Opcodes.LCONST_0:
                case Opcodes.LCONST_1:
                    constant((long) (opcode - Opcodes.LCONST_0), true);
                    break;
                case Opcodes.FCONST_0:
                case Opcodes.FCONST_1:
                case Opcodes.FCONST_2:
                    constant((float) (opcode - Opcodes.FCONST_0), false);
                    break;
                case Opcodes.DCONST_0:
                case Opcodes.DCONST_1:
                    constant((double) (opcode - Opcodes.DCONST_0), true);
                    break;
                case Opcodes.BIPUSH:
                case Opcodes.SIPUSH:
                    constant(((IntInsnNode) insn).operand, false);
                    break;
                case Opcodes.LDC: {
                    Object cst = ((LdcInsnNode) insn).cst;
                    constant(cst, cst instanceof Long || cst instanceof Double);
                    break;
                }

                case Opcodes.ILOAD:
                case Opcodes.LLOAD:
                case Opcodes.FLOAD:
                case Opcodes.DLOAD:
                case Opcodes.ALOAD: {
                    Var ptr = slot(((VarInsnNode) insn).var);
                    insert(MemoryOps.LOAD.insn(ptr), 1, opcode == Opcodes.LLOAD || opcode == Opcodes.DLOAD);
                    break;
                }
                case Opcodes.ISTORE:
                case Opcodes.LSTORE:
                case Opcodes.FSTORE:
                case Opcodes.DSTORE:
                case Opcodes.ASTORE: {
                    Var ptr = slot(((VarInsnNode) insn).var);
                    ib.insert(MemoryOps.STORE.insn(pop(), ptr).assignTo());
                    break;
                }
                case Opcodes.IINC: {
                    IincInsnNode iinc = (IincInsnNode) insn;
                    Var ptr = slot(iinc.var);
                    Var value = ib.insert(MemoryOps.LOAD.insn(ptr), "v");
                    Var incr = ib.insert(CommonOps.constant(iinc.incr), "v");
                    Var sum = ib.insert(ArithOps.ADD.insn(value, incr), "v");
                    ib.insert(MemoryOps.STORE.insn(sum, ptr).assignTo());
                    break;
                }

                case Opcodes.IADD:
                case Opcodes.LADD:
                case Opcodes.FADD:
                case Opcodes.DADD:
                    binary(ArithOps.ADD, insn);
                    break;
                case Opcodes.ISUB:
                case Opcodes.LSUB:
                case Opcodes.FSUB:
                case Opcodes.DSUB:
                    binary(ArithOps.SUB, insn);
                    break;
                case Opcodes.IMUL:
                case Opcodes.LMUL:
                case Opcodes.FMUL:
                case Opcodes.DMUL:
                    binary(ArithOps.MUL, insn);
                    break;
                case Opcodes.IDIV:
                case Opcodes.LDIV:
                case Opcodes.FDIV:
                case Opcodes.DDIV:
                    binary(ArithOps.DIV, insn);
                    break;
                case Opcodes.IREM:
                case Opcodes.LREM:
                case Opcodes.FREM:
                case Opcodes.DREM:
                    binary(ArithOps.REM, insn);
                    break;
                case Opcodes.ISHL:
                case Opcodes.LSHL:
                    binary(ArithOps.SHL, insn);
                    break;
                case Opcodes.ISHR:
                case Opcodes.LSHR:
                    binary(ArithOps.SHR, insn);
                    break;
                case Opcodes.IUSHR:
                case Opcodes.LUSHR:
                    binary(ArithOps.USHR, insn);
                    break;
                case Opcodes.IAND:
                case Opcodes.LAND:
                    binary(ArithOps.AND, insn);
                    break;
                case Opcodes.IOR:
                case Opcodes.LOR:
                    binary(ArithOps.OR, insn);
                    break;
                case Opcodes.IXOR:
                case Opcodes.LXOR:
                    binary(ArithOps.XOR, insn);
                    break;

                case Opcodes.POP:
                    popWords(1);
                    break;
                case Opcodes.POP2:
                    popWords(2);
                    break;
                case Opcodes.DUP: {
                    List<Var> top = popWords(1);
                    pushAll(top);
                    pushAll(top);
                    break;
                }
                case Opcodes.DUP_X1:
                    dupX(1, 1);
                    break;
                case Opcodes.DUP_X2:
                    dupX(1, 2);
                    break;
                case Opcodes.DUP2: {
                    List<Var> top = popWords(2);
                    pushAll(top);
                    pushAll(top);
                    break;
                }
                case Opcodes.DUP2_X1:
                    dupX(2, 1);
                    break;
                case Opcodes.DUP2_X2:
                    dupX(2, 2);
                    break;
                case Opcodes.SWAP: {
                    List<Var> top = popWords(1);
                    List<Var> under = popWords(1);
                    pushAll(top);
                    pushAll(under);
                    break;
                }

                case Opcodes.GETSTATIC:
                case Opcodes.NEW:
                    opaque(insn, 0, true);
                    break;
                case Opcodes.INEG:
                case Opcodes.LNEG:
                case Opcodes.FNEG:
                case Opcodes.DNEG:
                case Opcodes.I2L:
                case Opcodes.I2F:
                case Opcodes.I2D:
                case Opcodes.L2I:
                case Opcodes.L2F:
                case Opcodes.L2D:
                case Opcodes.F2I:
                case Opcodes.F2L:
                case Opcodes.F2D:
                case Opcodes.D2I:
                case Opcodes.D2L:
                case Opcodes.D2F:
                case Opcodes.I2B:
                case Opcodes.I2C:
                case Opcodes.I2S:
                case Opcodes.GETFIELD:
                case Opcodes.NEWARRAY:
                case Opcodes.ANEWARRAY:
                case Opcodes.ARRAYLENGTH:
                case Opcodes.CHECKCAST:
                case Opcodes.INSTANCEOF:
                    opaque(insn, 1, true);
                    break;
                case Opcodes.IALOAD:
                case Opcodes.LALOAD:
                case Opcodes.FALOAD:
                case Opcodes.DALOAD:
                case Opcodes.AALOAD:
                case Opcodes.BALOAD:
                case Opcodes.CALOAD:
                case Opcodes.SALOAD:
                case Opcodes.LCMP:
                case Opcodes.FCMPL:
                case Opcodes.FCMPG:
                case Opcodes.DCMPL:
                case Opcodes.DCMPG:
                    opaque(insn, 2, true);
                    break;
                case Opcodes.PUTSTATIC:
                case Opcodes.MONITORENTER:
                case Opcodes.MONITOREXIT:
                    opaque(insn, 1, false);
                    break;
                case Opcodes.PUTFIELD:
                    opaque(insn, 2, false);
                    break;
                case Opcodes.IASTORE:
                case Opcodes.LASTORE:
                case Opcodes.FASTORE:
                case Opcodes.DASTORE:
                case Opcodes.AASTORE:
                case Opcodes.BASTORE:
                case Opcodes.CASTORE:
                case Opcodes.SASTORE:
                    opaque(insn, 3, false);
                    break;
                case Opcodes.MULTIANEWARRAY:
                    opaque(insn, ((MultiANewArrayInsnNode) insn).dims, true);
                    break;
                case Opcodes.INVOKEVIRTUAL:
                case Opcodes.INVOKESPECIAL:
                case Opcodes.INVOKESTATIC:
                case Opcodes.INVOKEINTERFACE:
                case Opcodes.INVOKEDYNAMIC: {
                    String desc = opcode == Opcodes.INVOKEDYNAMIC
                            ? ((InvokeDynamicInsnNode) insn).desc
                            : ((MethodInsnNode) insn).desc;
                    boolean hasReceiver = opcode != Opcodes.INVOKESTATIC && opcode != Opcodes.INVOKEDYNAMIC;
                    int arity = Type.getArgumentTypes(desc).length + (hasReceiver ? 1 : 0);
                    opaque(insn, arity, Type.getReturnType(desc).getSort() != Type.VOID);
                    break;
                }

                case Opcodes.GOTO:
                    jump(Control.br(jumpTarget(((JumpInsnNode) insn).label)));
                    stack = null;
                    break;
                case Opcodes.IFEQ:
                case Opcodes.IFNE:
                case Opcodes.IFLT:
                case Opcodes.IFGE:
                case Opcodes.IFGT:
                case Opcodes.IFLE:
                case Opcodes.IF_ICMPEQ:
                case Opcodes.IF_ICMPNE:
                case Opcodes.IF_ICMPLT:
                case Opcodes.IF_ICMPGE:
                case Opcodes.IF_ICMPGT:
                case Opcodes.IF_ICMPLE:
                case Opcodes.IF_ACMPEQ:
                case Opcodes.IF_ACMPNE:
                case Opcodes.IFNULL:
                case Opcodes.IFNONNULL: {
                    JavaOps.JumpType type = JavaOps.JumpType.fromOpcode(opcode);
                    List<Var> args = pop(type.arity);
                    BasicBlock taken = jumpTarget(((JumpInsnNode) insn).label);
                    BasicBlock fallthrough = new BasicBlock();
                    jump(JavaOps.BR_COND.create(type).insn(args).jumpsTo(taken, fallthrough));
                    enter(fallthrough);
                    break;
                }
                case Opcodes.TABLESWITCH: {
                    TableSwitchInsnNode ts = (TableSwitchInsnNode) insn;
                    List<Integer> keys = new ArrayList<>();
                    for (int k = ts.min; k <= ts.max; k++) keys.add(k);
                    switchTo(keys, ts.dflt, ts.labels);
                    break;
                }
                case Opcodes.LOOKUPSWITCH: {
                    LookupSwitchInsnNode ls = (LookupSwitchInsnNode) insn;
                    switchTo(new ArrayList<>(ls.keys), ls.dflt, ls.labels);
                    break;
                }
                case Opcodes.IRETURN:
                case Opcodes.LRETURN:
                case Opcodes.FRETURN:
                case Opcodes.DRETURN:
                case Opcodes.ARETURN:
                    jump(CommonOps.RETURN.insn(pop()).jumpsTo());
                    stack = null;
                    break;
                case Opcodes.RETURN:
                    jump(CommonOps.RETURN.insn().jumpsTo());
                    stack = null;
                    break;
                case Opcodes.ATHROW:
                    jump(JavaOps.THROW.insn(pop()).jumpsTo());
                    stack = null;
                    break;

                case Opcodes.JSR:
                case Opcodes.RET:
                    throw new IllegalArgumentException("JSR/RET are not supported");
                default:
                    throw new IllegalArgumentException("Unsupported opcode: " + Disassembler.getMnemonic(opcode));
            }
        }

        void dupX(int topWords, int underWords) {
            List<Var> top = popWords(topWords);
            List<Var> under = popWords(underWords);
            pushAll(top);
            pushAll(under);
            pushAll(top);
        }

        void switchTo(List<Integer> keys, LabelNode dflt, List<LabelNode> labels) {
            Var key = pop();
            List<BasicBlock> targets = new ArrayList<>();
            targets.add(jumpTarget(dflt));
            for (LabelNode label : labels) {
                targets.add(jumpTarget(label));
            }
            jump(JavaOps.SWITCH.create(keys).insn(key).jumpsTo(targets));
            stack = null;
        }

        static boolean isWideResult(AbstractInsnNode insn) {
            switch (insn.getOpcode()) {
                case Opcodes.LALOAD:
                case Opcodes.DALOAD:
                case Opcodes.LADD:
                case Opcodes.DADD:
                case Opcodes.LSUB:
                case Opcodes.DSUB:
                case Opcodes.LMUL:
                case Opcodes.DMUL:
                case Opcodes.LDIV:
                case Opcodes.DDIV:
                case Opcodes.LREM:
                case Opcodes.DREM:
                case Opcodes.LNEG:
                case Opcodes.DNEG:
                case Opcodes.LSHL:
                case Opcodes.LSHR:
                case Opcodes.LUSHR:
                case Opcodes.LAND:
                case Opcodes.LOR:
                case Opcodes.LXOR:
                case Opcodes.I2L:
                case Opcodes.I2D:
                case Opcodes.L2D:
                case Opcodes.F2L:
                case Opcodes.F2D:
                case Opcodes.D2L:
                    return true;
                case Opcodes.GETSTATIC:
                case Opcodes.GETFIELD:
                    return Type.getType(((FieldInsnNode) insn).desc).getSize() == 2;
                case Opcodes.INVOKEVIRTUAL:
                case Opcodes.INVOKESPECIAL:
                case Opcodes.INVOKESTATIC:
                case Opcodes.INVOKEINTERFACE:
                    return Type.getReturnType(((MethodInsnNode) insn).desc).getSize() == 2;
                case Opcodes.INVOKEDYNAMIC:
                    return Type.getReturnType(((InvokeDynamicInsnNode) insn).desc).getSize() == 2;
                default:
                    return false;
            }
        }
    }
}
