package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class IndirectBrInsnNode extends AbstractInsnNode {
    public final TypedValue address;
    public final List<BlockLabel> targets;

    public IndirectBrInsnNode(TypedValue address, List<BlockLabel> targets) {
        super(Opcode.INDIRECTBR);
        this.address = Objects.requireNonNull(address);
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    @Override
    public String toString() {
        return opcode + " " + address + ", " + targets;
    }
}
