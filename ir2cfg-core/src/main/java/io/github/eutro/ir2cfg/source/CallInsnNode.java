package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call, either of a named routine ({@link ValueNode.SymbolValue}) or through a pointer.
 */
public class CallInsnNode extends AbstractInsnNode {
    public final boolean tail;
    /**
     * The type of the callee, a function type or a pointer to one.
     */
    public final TypeNode calleeType;
    public final ValueNode callee;
    public final List<TypedValue> args;

    public CallInsnNode(boolean tail, TypeNode calleeType, ValueNode callee, List<TypedValue> args) {
        super(Opcode.CALL);
        this.tail = tail;
        this.calleeType = Objects.requireNonNull(calleeType);
        this.callee = Objects.requireNonNull(callee);
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Get the symbol of the callee, if it is called directly.
     *
     * @return The symbol, or null for an indirect call.
     */
    public @Nullable String calleeSymbol() {
        return callee instanceof ValueNode.SymbolValue ? ((ValueNode.SymbolValue) callee).symbol : null;
    }

    @Override
    public String toString() {
        return (tail ? "tail " : "") + opcode + " " + calleeType + " " + callee
                + args.stream().map(Objects::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
