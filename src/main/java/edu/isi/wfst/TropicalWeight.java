package edu.isi.wfst;

// min, +, +INF, 0
public final class TropicalWeight extends FloatWeight<TropicalWeight> {
	public TropicalWeight(double value) { super(value); }

	protected TropicalWeight make(double v) { return new TropicalWeight(v); }

	// -INF is not a member: no path can be that good
	public boolean member() {
		return super.member() && getValue() != Double.NEGATIVE_INFINITY;
	}
}
