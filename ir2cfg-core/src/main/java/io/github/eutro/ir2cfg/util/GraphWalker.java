package io.github.eutro.ir2cfg.util;

import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Function;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Depth-first traversal of a graph given by a root and a children function.
 *
 * @param <T> The type of nodes.
 */
public class GraphWalker<T> {
    final T root;
    final F<T, ? extends Iterable<T>> getChildren;

    public GraphWalker(T root, F<T, ? extends Iterable<T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Walk the blocks of a function reachable from its entry block.
     *
     * @param func The function.
     * @return The walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.entry(), BasicBlock::successors);
    }

    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
