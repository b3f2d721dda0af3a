package edu.isi.wfst;

// plain probabilities: +, *, 0, 1
public final class RealWeight extends FloatWeight<RealWeight> {
	public RealWeight(double value) { super(value); }

	protected RealWeight make(double v) { return new RealWeight(v); }

	public boolean member() {
		return super.member() && !Double.isInfinite(getValue());
	}
}
