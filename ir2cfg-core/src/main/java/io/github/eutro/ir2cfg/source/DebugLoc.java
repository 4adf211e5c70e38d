package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * A source position attached to a statement, relative to a scope.
 */
public final class DebugLoc {
    public final int line;
    public final int col;
    public final ValMd scope;

    public DebugLoc(int line, int col, ValMd scope) {
        this.line = line;
        this.col = col;
        this.scope = Objects.requireNonNull(scope);
    }

    @Override
    public String toString() {
        return "!DILocation(line: " + line + ", column: " + col + ", scope: " + scope + ")";
    }
}
