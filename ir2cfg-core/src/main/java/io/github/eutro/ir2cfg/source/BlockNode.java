package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A source basic block. Only the first block of a routine may be unlabeled, and then
 * the routine cannot be translated.
 */
public final class BlockNode {
    @Nullable
    public final BlockLabel label;
    public final List<StmtNode> stmts;

    public BlockNode(@Nullable BlockLabel label, List<StmtNode> stmts) {
        this.label = label;
        this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (label != null) sb.append(label.name).append(":\n");
        for (StmtNode stmt : stmts) {
            sb.append("  ").append(stmt).append('\n');
        }
        return sb.toString();
    }
}
