package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.GlobalNode;
import io.github.eutro.ir2cfg.source.ValueNode;
import io.github.eutro.ir2cfg.types.CType;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * How to initialise one global: its lifted type and initial value, or why its type could not be lifted.
 */
public final class GlobalInitializer {
    public final GlobalNode global;
    @Nullable
    private final CType type;
    @Nullable
    private final String error;

    private GlobalInitializer(GlobalNode global, @Nullable CType type, @Nullable String error) {
        this.global = global;
        this.type = type;
        this.error = error;
    }

    public static GlobalInitializer of(GlobalNode global, CType type) {
        return new GlobalInitializer(global, type, null);
    }

    public static GlobalInitializer failed(GlobalNode global, String error) {
        return new GlobalInitializer(global, null, error);
    }

    public Optional<CType> type() {
        return Optional.ofNullable(type);
    }

    public Optional<ValueNode> init() {
        return Optional.ofNullable(global.init);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "@" + global.symbol + ": " + (type == null ? "error: " + error : type + " = " + global.init);
    }
}
