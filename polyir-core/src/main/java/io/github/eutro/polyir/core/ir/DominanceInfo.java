package io.github.eutro.polyir.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Dominance between operations and blocks, computed lazily per region.
 * <p>
 * The immediate dominators of the blocks of a region are computed the first time they are
 * needed, and cached until {@link #invalidate()}. Blocks unreachable from the entry block of
 * their region are dominated only by themselves.
 */
public final class DominanceInfo {
    private final Map<Region, Map<Block, Block>> idoms = new HashMap<>();

    /**
     * Whether {@code a} dominates {@code b}: they are the same operation, or {@code a} properly dominates {@code b}.
     *
     * @param a The dominating operation.
     * @param b The dominated operation.
     * @return Whether a dominates b.
     */
    public boolean dominates(Operation a, Operation b) {
        return a == b || properlyDominates(a, b);
    }

    /**
     * Whether every path to {@code b} goes through {@code a} first, where {@code a != b}.
     * <p>
     * An operation does not properly dominate the operations nested in it.
     *
     * @param a The dominating operation.
     * @param b The dominated operation.
     * @return Whether a properly dominates b.
     */
    public boolean properlyDominates(Operation a, Operation b) {
        Block aBlock = a.getBlock();
        if (aBlock == null) return false;
        Region region = aBlock.getParent();

        Operation ancestor = b;
        while (ancestor != null && (ancestor.getBlock() == null || ancestor.getBlock().getParent() != region)) {
            ancestor = ancestor.getParentOp();
        }
        if (ancestor == null) return false;

        Block bBlock = ancestor.getBlock();
        if (aBlock == bBlock) {
            return a != ancestor && a.isBeforeInBlock(ancestor);
        }
        return dominates(aBlock, bBlock);
    }

    /**
     * Whether every path from the entry block of their region to {@code b} goes through {@code a}.
     *
     * @param a The dominating block.
     * @param b The dominated block.
     * @return Whether a dominates b, false if they are in different regions.
     */
    public boolean dominates(Block a, Block b) {
        if (a == b) return true;
        Region region = a.getParent();
        if (region == null || region != b.getParent()) return false;
        Map<Block, Block> regionIdoms = idoms.computeIfAbsent(region, DominanceInfo::computeIdoms);
        Block current = b;
        while (true) {
            Block idom = regionIdoms.get(current);
            if (idom == null || idom == current) return false;
            if (idom == a) return true;
            current = idom;
        }
    }

    /**
     * Get the immediate dominator of a block.
     *
     * @param block The block.
     * @return The immediate dominator, or null for entry and unreachable blocks.
     */
    public @Nullable Block getIdom(Block block) {
        Region region = block.getParent();
        if (region == null) return null;
        Block idom = idoms.computeIfAbsent(region, DominanceInfo::computeIdoms).get(block);
        return idom == block ? null : idom;
    }

    /**
     * Forget every computed dominator, after the control flow of a region changed.
     */
    public void invalidate() {
        idoms.clear();
    }

    /*
     Keith D. Cooper, Timothy J. Harvey and Ken Kennedy. A Simple, Fast Dominance Algorithm.
     Software Practice and Experience, 4:1-10, 2001.
    */
    private static Map<Block, Block> computeIdoms(Region region) {
        Map<Block, Block> idom = new HashMap<>();
        if (region.isEmpty()) return idom;

        Block entry = region.front();
        List<Block> postOrder = new ArrayList<>();
        postOrder(entry, new HashSet<>(), postOrder);
        Map<Block, Integer> index = new HashMap<>();
        for (int i = 0; i < postOrder.size(); i++) {
            index.put(postOrder.get(i), i);
        }

        idom.put(entry, entry);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = postOrder.size() - 1; i >= 0; i--) {
                Block block = postOrder.get(i);
                if (block == entry) continue;
                Block newIdom = null;
                for (Operation pred : block.getPredecessorOps()) {
                    Block predBlock = pred.getBlock();
                    if (predBlock == null || !idom.containsKey(predBlock)) continue;
                    newIdom = newIdom == null ? predBlock : intersect(predBlock, newIdom, idom, index);
                }
                if (newIdom != null && idom.get(block) != newIdom) {
                    idom.put(block, newIdom);
                    changed = true;
                }
            }
        }
        return idom;
    }

    private static void postOrder(Block block, Set<Block> seen, List<Block> out) {
        if (!seen.add(block)) return;
        for (Block succ : block.getSuccessors()) {
            postOrder(succ, seen, out);
        }
        out.add(block);
    }

    private static Block intersect(Block a, Block b, Map<Block, Block> idom, Map<Block, Integer> index) {
        while (a != b) {
            while (index.get(a) < index.get(b)) a = idom.get(a);
            while (index.get(b) < index.get(a)) b = idom.get(b);
        }
        return a;
    }
}
