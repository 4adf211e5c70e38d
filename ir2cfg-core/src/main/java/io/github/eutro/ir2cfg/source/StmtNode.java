package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement: an instruction, the identifier its result is bound to (if any),
 * and its metadata attachments.
 */
public final class StmtNode {
    @Nullable
    public final Ident result;
    public final AbstractInsnNode insn;
    public final List<DebugAnnotation> annotations;

    public StmtNode(@Nullable Ident result, AbstractInsnNode insn, List<DebugAnnotation> annotations) {
        this.result = result;
        this.insn = Objects.requireNonNull(insn);
        this.annotations = Collections.unmodifiableList(new ArrayList<>(annotations));
    }

    public static StmtNode result(Ident result, AbstractInsnNode insn, DebugAnnotation... annotations) {
        return new StmtNode(result, insn, List.of(annotations));
    }

    public static StmtNode effect(AbstractInsnNode insn, DebugAnnotation... annotations) {
        return new StmtNode(null, insn, List.of(annotations));
    }

    /**
     * Get a copy of this statement with different metadata attachments.
     *
     * @param annotations The attachments.
     * @return The new statement.
     */
    public StmtNode withAnnotations(List<DebugAnnotation> annotations) {
        return new StmtNode(result, insn, annotations);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (result != null) sb.append(result).append(" = ");
        sb.append(insn);
        for (DebugAnnotation annotation : annotations) {
            sb.append(", ").append(annotation);
        }
        return sb.toString();
    }
}
