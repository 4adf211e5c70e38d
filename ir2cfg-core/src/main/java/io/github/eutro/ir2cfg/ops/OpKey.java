package io.github.eutro.ir2cfg.ops;

import io.github.eutro.ir2cfg.ext.ExtHolder;

/**
 * An operation key, representing a type of operation, without immediates.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
