package edu.isi.wfst;

/**
 * Combines the weights two sparse tuples hold at the same key. Must be defined
 * for every key, including {@link PairwiseMerge#NO_KEY}, which is passed once
 * when the two defaults are combined.
 */
@FunctionalInterface
public interface WeightMapper<W extends Weight<W>> {
	public W map(int key, W v1, W v2);
}
