package edu.isi.wfst;

import java.io.DataOutput;
import java.io.IOException;

/**
 * Weight backed by a single double. Subclasses fix the semiring and
 * the membership test.
 */
public abstract class FloatWeight<W extends FloatWeight<W>> implements Weight<W> {
	private final double value;

	protected FloatWeight(double value) { this.value = value; }

	public double getValue() { return value; }

	// build a weight of the same type
	protected abstract W make(double v);

	public boolean member() {
		return !Double.isNaN(value);
	}

	public W quantize(float delta) {
		if (Double.isInfinite(value) || Double.isNaN(value))
			return make(value);
		return make(Math.floor(value/delta + 0.5) * delta);
	}

	// every semiring here is commutative, so the reverse weight has the same value
	public W reverse() {
		return make(value);
	}

	public void write(DataOutput out) throws IOException {
		out.writeDouble(value);
	}

	// exact comparison. NaN equals NaN so NoWeight is equal to itself
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || o.getClass() != getClass())
			return false;
		return Double.compare(value, ((FloatWeight<?>)o).value) == 0
			|| value == ((FloatWeight<?>)o).value;
	}

	public int hashCode() {
		// 0.0 and -0.0 compare equal, so they must hash alike
		return value == 0 ? 0 : Double.hashCode(value);
	}

	public String toString() {
		return Double.toString(value);
	}

	// shared by the semirings' text decoders
	static double parseValue(String s) throws DataFormatException {
		try {
			return Double.parseDouble(s.trim());
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Not a number: "+s, e);
		}
	}
}
