package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class SwitchInsnNode extends AbstractInsnNode {
    public final TypedValue value;
    public final BlockLabel dflt;
    public final List<Case> cases;

    public SwitchInsnNode(TypedValue value, BlockLabel dflt, List<Case> cases) {
        super(Opcode.SWITCH);
        this.value = Objects.requireNonNull(value);
        this.dflt = Objects.requireNonNull(dflt);
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
    }

    public static final class Case {
        public final long key;
        public final BlockLabel target;

        public Case(long key, BlockLabel target) {
            this.key = key;
            this.target = Objects.requireNonNull(target);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(opcode).append(' ').append(value)
                .append(", label ").append(dflt).append(" [");
        for (Case c : cases) {
            sb.append(' ').append(c.key).append(": ").append(c.target);
        }
        return sb.append(" ]").toString();
    }
}
