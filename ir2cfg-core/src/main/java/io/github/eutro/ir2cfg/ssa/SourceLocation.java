package io.github.eutro.ir2cfg.ssa;

import java.util.Objects;

/**
 * A position in the source program.
 */
public final class SourceLocation {
    /**
     * The location of code with no source position, such as translator-generated blocks.
     */
    public static final SourceLocation INTERNAL = new SourceLocation("<internal>", 0, 0);

    public final String file;
    public final int line;
    public final int col;

    public SourceLocation(String file, int line, int col) {
        this.file = Objects.requireNonNull(file);
        this.line = line;
        this.col = col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && col == that.col && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, col);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + col;
    }
}
