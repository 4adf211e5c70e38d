package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.passes.IRPass;
import io.github.eutro.ir2cfg.passes.Passes;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.types.DefaultTypeLifter;
import io.github.eutro.ir2cfg.types.TypeLifter;

import java.util.Objects;

/**
 * Settings for a {@link ModuleTranslator}. Immutable; build with {@link #builder()}.
 */
public final class TranslatorConfig {
    public static final TranslatorConfig DEFAULT = builder().build();

    private final TypeLifter typeLifter;
    private final IRPass<Function, Function> structurer;
    private final GlobalInitializerBuilder globalInitializerBuilder;
    private final HandleAllocator allocator;
    private final boolean parallel;
    private final boolean strictRedeclarations;
    private final boolean verify;

    private TranslatorConfig(Builder b) {
        typeLifter = b.typeLifter;
        structurer = b.structurer;
        globalInitializerBuilder = b.globalInitializerBuilder;
        allocator = b.allocator;
        parallel = b.parallel;
        strictRedeclarations = b.strictRedeclarations;
        verify = b.verify;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TypeLifter getTypeLifter() {
        return typeLifter;
    }

    public IRPass<Function, Function> getStructurer() {
        return structurer;
    }

    public GlobalInitializerBuilder getGlobalInitializerBuilder() {
        return globalInitializerBuilder;
    }

    public HandleAllocator getAllocator() {
        return allocator;
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isStrictRedeclarations() {
        return strictRedeclarations;
    }

    public boolean isVerify() {
        return verify;
    }

    public static final class Builder {
        private TypeLifter typeLifter = DefaultTypeLifter.INSTANCE;
        private IRPass<Function, Function> structurer = Passes.STRUCTURE;
        private GlobalInitializerBuilder globalInitializerBuilder = GlobalInitializerBuilder.DEFAULT;
        private HandleAllocator allocator = HandleAllocator.GLOBAL;
        private boolean parallel = false;
        private boolean strictRedeclarations = false;
        private boolean verify = false;

        private Builder() {
        }

        public Builder setTypeLifter(TypeLifter typeLifter) {
            this.typeLifter = Objects.requireNonNull(typeLifter);
            return this;
        }

        /**
         * Set the pass run on every lowered CFG, before it is verified.
         *
         * @param structurer The pass.
         * @return This builder.
         */
        public Builder setStructurer(IRPass<Function, Function> structurer) {
            this.structurer = Objects.requireNonNull(structurer);
            return this;
        }

        public Builder setGlobalInitializerBuilder(GlobalInitializerBuilder globalInitializerBuilder) {
            this.globalInitializerBuilder = Objects.requireNonNull(globalInitializerBuilder);
            return this;
        }

        public Builder setAllocator(HandleAllocator allocator) {
            this.allocator = Objects.requireNonNull(allocator);
            return this;
        }

        /**
         * Set whether routines are translated concurrently.
         *
         * @param parallel Whether to translate in parallel.
         * @return This builder.
         */
        public Builder setParallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /**
         * Set whether a repeated declaration must agree with the first declaration of its symbol.
         * When off, later declarations are ignored.
         *
         * @param strict Whether to check repeated declarations.
         * @return This builder.
         */
        public Builder setStrictRedeclarations(boolean strict) {
            this.strictRedeclarations = strict;
            return this;
        }

        /**
         * Set whether every CFG is checked with {@link io.github.eutro.ir2cfg.passes.meta.CheckCfg} after structuring.
         *
         * @param verify Whether to verify.
         * @return This builder.
         */
        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public TranslatorConfig build() {
            return new TranslatorConfig(this);
        }
    }
}
