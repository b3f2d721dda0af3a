package edu.isi.wfst;

import java.io.DataInput;
import java.io.IOException;

// log is -log(e^-a + e^-b), +, +INF, 0
public class LogSemiring extends Semiring<LogWeight> {
	public static final String NAME = "log";

	// if one operand is this much worse than the other, it doesn't change the sum
	static private int TOLERANCE=16;

	private static final LogWeight zero = new LogWeight(Double.POSITIVE_INFINITY);
	private static final LogWeight one = new LogWeight(0);
	private static final LogWeight noWeight = new LogWeight(Double.NaN);

	public LogWeight plus(LogWeight a, LogWeight b) {
		if (!a.member() || !b.member())
			return noWeight;
		if (a.getValue() == Double.POSITIVE_INFINITY) return b;
		if (b.getValue() == Double.POSITIVE_INFINITY) return a;

		double x, y;
		if ((-a.getValue()) > (-b.getValue())) {
			x = -a.getValue();
			y = -b.getValue();
		}
		else {
			x = -b.getValue();
			y = -a.getValue();
		}
		// x>=y. If x>>y, estimate as x
		if (x >= y+TOLERANCE)
			return new LogWeight(-x);

		double diff = y-x;
		double logtotal = Math.log1p(Math.exp(diff));
		return new LogWeight(-(x + logtotal));
	}
	public LogWeight times(LogWeight a, LogWeight b) {
		if (!a.member() || !b.member())
			return noWeight;
		return new LogWeight(a.getValue()+b.getValue());
	}
	public LogWeight ZERO() { return zero; }
	public LogWeight ONE() { return one; }
	public LogWeight NOWEIGHT() { return noWeight; }

	public LogWeight read(DataInput in) throws IOException {
		return new LogWeight(in.readDouble());
	}
	public LogWeight parse(String s) throws DataFormatException {
		return new LogWeight(FloatWeight.parseValue(s));
	}
	public String getName() { return NAME; }
}
