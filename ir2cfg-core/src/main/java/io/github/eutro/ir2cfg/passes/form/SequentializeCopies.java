package io.github.eutro.ir2cfg.passes.form;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.MetadataState;
import io.github.eutro.ir2cfg.ops.CommonOps;
import io.github.eutro.ir2cfg.passes.InPlaceIRPass;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.SourceLocation;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.translate.HandleAllocator;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

/**
 * Lowers parallel copies ({@link CommonOps#IDENTITY} effects with several targets) into
 * sequences of single moves with the same meaning.
 * <p>
 * A move is emitted once no other pending move still reads its target. When only cycles
 * remain, one target is saved to a temporary first, and its readers read that instead.
 * Temporaries take their ids from the function's {@link CfgExts#ALLOCATOR}, or
 * {@link HandleAllocator#GLOBAL} if it has none.
 */
public class SequentializeCopies implements InPlaceIRPass<Function> {
    public static final SequentializeCopies INSTANCE = new SequentializeCopies();

    @Override
    public void runInPlace(Function func) {
        HandleAllocator allocator = func.getNullable(CfgExts.ALLOCATOR);
        if (allocator == null) allocator = HandleAllocator.GLOBAL;
        boolean changed = false;
        for (BasicBlock block : func.blocks) {
            ListIterator<Effect> it = block.getEffects().listIterator();
            while (it.hasNext()) {
                Effect effect = it.next();
                if (effect.insn().op != CommonOps.IDENTITY || effect.getAssignsTo().size() < 2) continue;
                it.remove();
                for (Effect move : sequentialize(func, allocator, effect)) {
                    it.add(move);
                }
                changed = true;
            }
        }
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        if (changed) ms.varsChanged();
        ms.validate(MetadataState.COPIES_SEQUENTIAL);
    }

    private static final class Move {
        final Var dst;
        Var src;

        Move(Var dst, Var src) {
            this.dst = dst;
            this.src = src;
        }
    }

    private static List<Effect> sequentialize(Function func, HandleAllocator allocator, Effect copy) {
        List<Var> dsts = copy.getAssignsTo();
        List<Var> srcs = copy.insn().args();
        List<Move> pending = new ArrayList<>();
        for (int i = 0; i < dsts.size(); i++) {
            if (dsts.get(i) != srcs.get(i)) {
                pending.add(new Move(dsts.get(i), srcs.get(i)));
            }
        }

        @Nullable SourceLocation loc = copy.getNullable(CfgExts.LOCATION);
        List<Effect> out = new ArrayList<>();
        while (!pending.isEmpty()) {
            Move ready = null;
            for (Move m : pending) {
                if (!isRead(pending, m.dst)) {
                    ready = m;
                    break;
                }
            }
            if (ready != null) {
                pending.remove(ready);
                out.add(move(ready.dst, ready.src, loc));
                continue;
            }

            // only cycles left, free one target
            Var blocked = pending.get(0).dst;
            Var tmp = func.newReg(blocked.name + ".tmp", allocator.nextRegister(), blocked.getType());
            out.add(move(tmp, blocked, loc));
            for (Move m : pending) {
                if (m.src == blocked) m.src = tmp;
            }
        }
        return out;
    }

    private static boolean isRead(List<Move> pending, Var var) {
        for (Move m : pending) {
            if (m.src == var) return true;
        }
        return false;
    }

    private static Effect move(Var dst, Var src, @Nullable SourceLocation loc) {
        Effect fx = CommonOps.IDENTITY.insn(src).assignTo(dst);
        fx.attachExt(CommonExts.IS_PHI, true);
        if (loc != null) fx.attachExt(CfgExts.LOCATION, loc);
        return fx;
    }
}
