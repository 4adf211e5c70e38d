/**
 * The ext API associates arbitrary typed data with
 * instances of {@link io.github.eutro.ir2cfg.ext.ExtContainer}.
 *
 * <pre>{@code
 * Var reg = func.newVar("x");
 * reg.attachExt(CfgExts.REG_TYPE, CType.bitvector(32));
 *
 * reg.getExtOrThrow(CfgExts.REG_TYPE); // => bv32
 * }</pre>
 * <p>
 * The translator uses this for everything the target CFG carries beside its
 * instructions: register types, source locations, debug annotations, owning
 * handles and predecessor lists. Passes may attach scratch data and drop it after.
 * <p>
 * Specialised implementations of {@link io.github.eutro.ir2cfg.ext.ExtContainer}
 * may implement fast-paths for certain {@link io.github.eutro.ir2cfg.ext.Ext}s
 * by storing them directly in fields of the class.
 */
package io.github.eutro.ir2cfg.ext;
