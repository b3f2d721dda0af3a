package edu.isi.wfst;

// negated log probabilities: log-add, +, +INF, 0
public final class LogWeight extends FloatWeight<LogWeight> {
	public LogWeight(double value) { super(value); }

	protected LogWeight make(double v) { return new LogWeight(v); }

	public boolean member() {
		return super.member() && getValue() != Double.NEGATIVE_INFINITY;
	}
}
