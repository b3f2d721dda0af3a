package edu.isi.wfst;

import java.io.DataInput;
import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Semiring over sparse tuple weights: plus and times are the element
 * semiring's plus and times, key by key. One instance per element semiring,
 * holding the shared ZERO, ONE and NOWEIGHT tuples.
 */
public class SparsePowerSemiring<W extends Weight<W>> extends Semiring<SparseTupleWeight<W>> {

	private static final ConcurrentHashMap<Semiring<?>, SparsePowerSemiring<?>> instances =
		new ConcurrentHashMap<Semiring<?>, SparsePowerSemiring<?>>();

	public static <W extends Weight<W>> SparsePowerSemiring<W> of(Semiring<W> elementSemiring) {
		return (SparsePowerSemiring<W>)instances.computeIfAbsent(elementSemiring,
			s -> new SparsePowerSemiring<W>(elementSemiring));
	}

	private final Semiring<W> elementSemiring;
	private final SparseTupleWeight<W> zero;
	private final SparseTupleWeight<W> one;
	private final SparseTupleWeight<W> noWeight;
	private final WeightMapper<W> plusMapper;
	private final WeightMapper<W> timesMapper;

	private SparsePowerSemiring(Semiring<W> elementSemiring) {
		this.elementSemiring = elementSemiring;
		zero = new SparseTupleWeight<W>(elementSemiring, elementSemiring.ZERO()).freeze();
		one = new SparseTupleWeight<W>(elementSemiring, elementSemiring.ONE()).freeze();
		noWeight = new SparseTupleWeight<W>(elementSemiring, elementSemiring.NOWEIGHT()).freeze();
		plusMapper = (k, v1, v2) -> elementSemiring.plus(v1, v2);
		timesMapper = (k, v1, v2) -> elementSemiring.times(v1, v2);
	}

	public Semiring<W> getElementSemiring() { return elementSemiring; }

	public SparseTupleWeight<W> plus(SparseTupleWeight<W> a, SparseTupleWeight<W> b) {
		return PairwiseMerge.map(a, b, plusMapper);
	}
	public SparseTupleWeight<W> times(SparseTupleWeight<W> a, SparseTupleWeight<W> b) {
		return PairwiseMerge.map(a, b, timesMapper);
	}
	public SparseTupleWeight<W> ZERO() { return zero; }
	public SparseTupleWeight<W> ONE() { return one; }
	public SparseTupleWeight<W> NOWEIGHT() { return noWeight; }

	public SparseTupleWeight<W> read(DataInput in) throws IOException {
		return SparseTupleWeight.read(in, elementSemiring);
	}
	public SparseTupleWeight<W> parse(String s) throws DataFormatException {
		return SparseTupleWeight.parse(s, elementSemiring);
	}

	public String getName() { return "sparse_power_"+elementSemiring.getName(); }

	public boolean equals(Object o) {
		return o instanceof SparsePowerSemiring
			&& ((SparsePowerSemiring<?>)o).elementSemiring.equals(elementSemiring);
	}
	public int hashCode() { return 31*elementSemiring.hashCode() + 7; }
}
