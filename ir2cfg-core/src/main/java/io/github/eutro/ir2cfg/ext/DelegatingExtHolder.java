package io.github.eutro.ir2cfg.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another container for exts it does not hold itself.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to look exts up in when this does not have them.
     *
     * @return The delegate.
     */
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        return getDelegate().getNullable(ext);
    }
}
