package edu.isi.wfst;

/**
 * Walks the stored (key, weight) pairs of a {@link SparseTupleWeight} in key
 * order. The default value is not visited. The iterator never changes the
 * weight, and any number of iterators can walk the same weight at once.
 * Pushing to the weight mid-walk is not supported.
 */
public class SparseTupleWeightIterator<W extends Weight<W>> {
	private final SparseTupleWeight<W> w;
	// -1 is the inline first pair, 0.. index the overflow
	private int index;

	public SparseTupleWeightIterator(SparseTupleWeight<W> w) {
		this.w = w;
		index = -1;
	}

	public boolean done() {
		if (index < 0)
			return !w.hasFirst();
		return index >= w.restSize();
	}

	public int key() {
		return index < 0 ? w.firstKey() : w.restKey(index);
	}

	public W weight() {
		return index < 0 ? w.firstValue() : w.restValue(index);
	}

	// the current pair
	public Pair<Integer, W> value() {
		return new Pair<Integer, W>(key(), weight());
	}

	public void next() {
		index++;
	}

	public void reset() {
		index = -1;
	}
}
