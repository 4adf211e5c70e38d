package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class PhiInsnNode extends AbstractInsnNode {
    public final TypeNode type;
    public final List<Incoming> incoming;

    public PhiInsnNode(TypeNode type, List<Incoming> incoming) {
        super(Opcode.PHI);
        this.type = Objects.requireNonNull(type);
        this.incoming = Collections.unmodifiableList(new ArrayList<>(incoming));
    }

    /**
     * A value flowing into a phi from one predecessor.
     */
    public static final class Incoming {
        public final ValueNode value;
        public final BlockLabel from;

        public Incoming(ValueNode value, BlockLabel from) {
            this.value = Objects.requireNonNull(value);
            this.from = Objects.requireNonNull(from);
        }

        @Override
        public String toString() {
            return "[ " + value + ", " + from + " ]";
        }
    }

    @Override
    public String toString() {
        return opcode + " " + type + " "
                + incoming.stream().map(Objects::toString).collect(Collectors.joining(", "));
    }
}
