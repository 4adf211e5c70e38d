package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * An {@code icmp} or {@code fcmp} instruction.
 */
public class CmpInsnNode extends AbstractInsnNode {
    public final Predicate predicate;
    public final TypedValue lhs;
    public final ValueNode rhs;

    public CmpInsnNode(Predicate predicate, TypedValue lhs, ValueNode rhs) {
        super(predicate.floating ? Opcode.FCMP : Opcode.ICMP);
        this.predicate = predicate;
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    /**
     * Comparison predicates. Those with {@link #floating} set belong to {@code fcmp}.
     */
    public enum Predicate {
        EQ, NE, UGT, UGE, ULT, ULE, SGT, SGE, SLT, SLE,
        FALSE(true), OEQ(true), OGT(true), OGE(true), OLT(true), OLE(true), ONE(true), ORD(true),
        UEQ(true), FUGT(true), FUGE(true), FULT(true), FULE(true), UNE(true), UNO(true), TRUE(true),
        ;

        public final boolean floating;

        Predicate(boolean floating) {
            this.floating = floating;
        }

        Predicate() {
            this(false);
        }

        @Override
        public String toString() {
            String name = name().toLowerCase();
            return name.startsWith("fu") ? name.substring(1) : name;
        }
    }

    @Override
    public String toString() {
        return opcode + " " + predicate + " " + lhs + ", " + rhs;
    }
}
