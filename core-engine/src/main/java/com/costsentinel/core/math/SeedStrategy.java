package com.costsentinel.core.math;

/**
 * Maps an isolation-tree index to the seed of that tree's random generator.
 *
 * <p>
 * Trees must be reproducible across runs, so the seed depends only on the tree
 * index (and optionally a fixed offset), never on global random state.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SeedStrategy {

    long seedFor(int treeIndex);

    /**
     * @return strategy where the seed equals the tree index
     */
    static SeedStrategy treeIndex() {
        return treeIndex -> treeIndex;
    }

    /**
     * @param baseSeed value added to every tree index
     * @return strategy seeding tree {@code t} with {@code baseSeed + t}
     */
    static SeedStrategy offset(long baseSeed) {
        return treeIndex -> baseSeed + treeIndex;
    }
}
