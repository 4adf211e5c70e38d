package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Structured debug information nodes.
 * <p>
 * Scopes nest: a lexical block sits in a subprogram or another lexical block, and any of
 * them may name the file it lives in.
 */
public abstract class DebugInfo {
    DebugInfo() {
    }

    public static final class File extends DebugInfo {
        public final String filename;
        public final String directory;

        public File(String filename, String directory) {
            this.filename = Objects.requireNonNull(filename);
            this.directory = Objects.requireNonNull(directory);
        }

        /**
         * Get the path of this file, as the directory and filename joined with a slash.
         *
         * @return The path.
         */
        public String path() {
            return directory + "/" + filename;
        }

        @Override
        public String toString() {
            return "!DIFile(" + path() + ")";
        }
    }

    public static final class LexicalBlock extends DebugInfo {
        @Nullable
        public final ValMd scope;
        @Nullable
        public final ValMd file;
        public final int line;
        public final int col;

        public LexicalBlock(@Nullable ValMd scope, @Nullable ValMd file, int line, int col) {
            this.scope = scope;
            this.file = file;
            this.line = line;
            this.col = col;
        }

        @Override
        public String toString() {
            return "!DILexicalBlock(scope: " + scope + ", file: " + file + ", line: " + line + ")";
        }
    }

    /**
     * A lexical block whose file overrides that of its scope, as after an {@code #include}.
     */
    public static final class LexicalBlockFile extends DebugInfo {
        public final ValMd scope;
        @Nullable
        public final ValMd file;
        public final int discriminator;

        public LexicalBlockFile(ValMd scope, @Nullable ValMd file, int discriminator) {
            this.scope = Objects.requireNonNull(scope);
            this.file = file;
            this.discriminator = discriminator;
        }

        @Override
        public String toString() {
            return "!DILexicalBlockFile(scope: " + scope + ", file: " + file + ")";
        }
    }

    public static final class Subprogram extends DebugInfo {
        public final String name;
        @Nullable
        public final ValMd scope;
        @Nullable
        public final ValMd file;
        public final int line;

        public Subprogram(String name, @Nullable ValMd scope, @Nullable ValMd file, int line) {
            this.name = Objects.requireNonNull(name);
            this.scope = scope;
            this.file = file;
            this.line = line;
        }

        @Override
        public String toString() {
            return "!DISubprogram(name: " + name + ", file: " + file + ", line: " + line + ")";
        }
    }

    /**
     * A source-level variable, as named by a debug declaration.
     */
    public static final class LocalVariable extends DebugInfo {
        public final String name;
        @Nullable
        public final ValMd scope;
        @Nullable
        public final ValMd file;
        public final int line;

        public LocalVariable(String name, @Nullable ValMd scope, @Nullable ValMd file, int line) {
            this.name = Objects.requireNonNull(name);
            this.scope = scope;
            this.file = file;
            this.line = line;
        }

        @Override
        public String toString() {
            return "!DILocalVariable(name: " + name + ", line: " + line + ")";
        }
    }
}
