package edu.isi.wfst;

/**
 * Sorted merge-join over the stored pairs of two sparse tuple weights.
 * Keys stored in only one of the weights are paired with the other weight's
 * default, so the result is correct for every key, stored or not. Linear in
 * the number of stored pairs.
 */
public class PairwiseMerge {
	/** key handed to the mapper when combining the defaults. Never stored */
	public static final int NO_KEY = -1;

	private PairwiseMerge() { }

	/**
	 * @return a new weight whose value at every key k is mapper.map(k, w1(k), w2(k)), and whose default is
	 *         mapper.map(NO_KEY, w1's default, w2's default)
	 */
	public static <W extends Weight<W>> SparseTupleWeight<W> map(SparseTupleWeight<W> w1,
																	SparseTupleWeight<W> w2,
																	WeightMapper<W> mapper) {
		boolean debug = false;
		W v1Def = w1.getDefaultValue();
		W v2Def = w2.getDefaultValue();
		SparseTupleWeight<W> ret = new SparseTupleWeight<W>(w1.getSemiring(), mapper.map(NO_KEY, v1Def, v2Def));
		SparseTupleWeightIterator<W> it1 = new SparseTupleWeightIterator<W>(w1);
		SparseTupleWeightIterator<W> it2 = new SparseTupleWeightIterator<W>(w2);
		while (!it1.done() || !it2.done()) {
			int k1 = it1.done() ? it2.key() : it1.key();
			int k2 = it2.done() ? it1.key() : it2.key();
			if (k1 == k2) {
				W v1 = it1.done() ? v1Def : it1.weight();
				W v2 = it2.done() ? v2Def : it2.weight();
				ret.push(k1, mapper.map(k1, v1, v2));
				if (!it1.done()) it1.next();
				if (!it2.done()) it2.next();
			}
			else if (k1 < k2) {
				ret.push(k1, mapper.map(k1, it1.weight(), v2Def));
				it1.next();
			}
			else {
				ret.push(k2, mapper.map(k2, v1Def, it2.weight()));
				it2.next();
			}
		}
		if (debug) Debug.debug(debug, w1+" and "+w2+" merged to "+ret);
		return ret;
	}

	/**
	 * True if the two weights agree at every key. Stops at the first
	 * disagreement. The element types may differ, in which case values are
	 * compared with their own equals.
	 */
	public static <A extends Weight<A>, B extends Weight<B>> boolean equal(SparseTupleWeight<A> w1, SparseTupleWeight<B> w2) {
		A v1Def = w1.getDefaultValue();
		B v2Def = w2.getDefaultValue();
		if (!v1Def.equals(v2Def))
			return false;
		SparseTupleWeightIterator<A> it1 = new SparseTupleWeightIterator<A>(w1);
		SparseTupleWeightIterator<B> it2 = new SparseTupleWeightIterator<B>(w2);
		while (!it1.done() || !it2.done()) {
			int k1 = it1.done() ? it2.key() : it1.key();
			int k2 = it2.done() ? it1.key() : it2.key();
			if (k1 == k2) {
				A v1 = it1.done() ? v1Def : it1.weight();
				B v2 = it2.done() ? v2Def : it2.weight();
				if (!v1.equals(v2))
					return false;
				if (!it1.done()) it1.next();
				if (!it2.done()) it2.next();
			}
			else if (k1 < k2) {
				if (!it1.weight().equals(v2Def))
					return false;
				it1.next();
			}
			else {
				if (!v1Def.equals(it2.weight()))
					return false;
				it2.next();
			}
		}
		return true;
	}
}
