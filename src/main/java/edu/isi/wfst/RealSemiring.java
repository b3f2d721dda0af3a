package edu.isi.wfst;

import java.io.DataInput;
import java.io.IOException;

// real is +, *, 0, 1. No log-space protection against underflow
public class RealSemiring extends Semiring<RealWeight> {
	public static final String NAME = "real";

	private static final RealWeight zero = new RealWeight(0);
	private static final RealWeight one = new RealWeight(1);
	private static final RealWeight noWeight = new RealWeight(Double.NaN);

	public RealWeight plus(RealWeight a, RealWeight b) {
		if (!a.member() || !b.member())
			return noWeight;
		return new RealWeight(a.getValue()+b.getValue());
	}
	public RealWeight times(RealWeight a, RealWeight b) {
		if (!a.member() || !b.member())
			return noWeight;
		return new RealWeight(a.getValue()*b.getValue());
	}
	public RealWeight ZERO() { return zero; }
	public RealWeight ONE() { return one; }
	public RealWeight NOWEIGHT() { return noWeight; }

	public RealWeight read(DataInput in) throws IOException {
		return new RealWeight(in.readDouble());
	}
	public RealWeight parse(String s) throws DataFormatException {
		return new RealWeight(FloatWeight.parseValue(s));
	}
	public String getName() { return NAME; }
}
