package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A metadata value, as attached to statements and definitions, or passed to debug intrinsics.
 */
public abstract class ValMd {
    ValMd() {
    }

    public static Ref ref(int id) {
        return new Ref(id);
    }

    public static Tuple tuple(@Nullable ValMd... elements) {
        return new Tuple(Arrays.asList(elements));
    }

    public static Str string(String value) {
        return new Str(value);
    }

    public static Loc loc(DebugLoc loc) {
        return new Loc(loc);
    }

    public static Value value(TypedValue value) {
        return new Value(value);
    }

    public static Info info(DebugInfo info) {
        return new Info(info);
    }

    /**
     * A reference to a numbered node in the module's metadata table.
     */
    public static final class Ref extends ValMd {
        public final int id;

        Ref(int id) {
            this.id = id;
        }

        @Override
        public String toString() {
            return "!" + id;
        }
    }

    /**
     * A generic metadata tuple, possibly with empty slots.
     */
    public static final class Tuple extends ValMd {
        public final List<@Nullable ValMd> elements;

        Tuple(List<@Nullable ValMd> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public String toString() {
            return elements.stream()
                    .map(it -> it == null ? "null" : it.toString())
                    .collect(Collectors.joining(", ", "!{", "}"));
        }
    }

    public static final class Str extends ValMd {
        public final String value;

        Str(String value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public String toString() {
            return "!\"" + value + "\"";
        }
    }

    public static final class Loc extends ValMd {
        public final DebugLoc loc;

        Loc(DebugLoc loc) {
            this.loc = Objects.requireNonNull(loc);
        }

        @Override
        public String toString() {
            return loc.toString();
        }
    }

    /**
     * A value wrapped as metadata, as in {@code metadata i32* %x}.
     */
    public static final class Value extends ValMd {
        public final TypedValue value;

        Value(TypedValue value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class Info extends ValMd {
        public final DebugInfo info;

        Info(DebugInfo info) {
            this.info = Objects.requireNonNull(info);
        }

        @Override
        public String toString() {
            return info.toString();
        }
    }
}
