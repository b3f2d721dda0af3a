package edu.isi.wfst;

import java.io.DataInput;
import java.io.IOException;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends Semiring<TropicalWeight> {
	public static final String NAME = "tropical";

	private static final TropicalWeight zero = new TropicalWeight(Double.POSITIVE_INFINITY);
	private static final TropicalWeight one = new TropicalWeight(0);
	private static final TropicalWeight noWeight = new TropicalWeight(Double.NaN);

	public TropicalWeight plus(TropicalWeight a, TropicalWeight b) {
		if (!a.member() || !b.member())
			return noWeight;
		return a.getValue() <= b.getValue() ? a : b;
	}
	public TropicalWeight times(TropicalWeight a, TropicalWeight b) {
		if (!a.member() || !b.member())
			return noWeight;
		return new TropicalWeight(a.getValue()+b.getValue());
	}
	public TropicalWeight ZERO() { return zero; }
	public TropicalWeight ONE() { return one; }
	public TropicalWeight NOWEIGHT() { return noWeight; }

	public TropicalWeight read(DataInput in) throws IOException {
		return new TropicalWeight(in.readDouble());
	}
	public TropicalWeight parse(String s) throws DataFormatException {
		return new TropicalWeight(FloatWeight.parseValue(s));
	}
	public String getName() { return NAME; }
}
