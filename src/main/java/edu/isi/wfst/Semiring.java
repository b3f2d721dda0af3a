package edu.isi.wfst;

import java.io.DataInput;
import java.io.IOException;
import java.io.Serializable;

// the general semiring. Subclasses do the operations and know how to build their weights
public abstract class Semiring<W extends Weight<W>> implements Serializable {
	public abstract W plus(W a, W b);
	public abstract W times(W a, W b);
	public abstract W ZERO();
	public abstract W ONE();
	// the invalid weight. Never a member
	public abstract W NOWEIGHT();

	// binary and text decoders, the inverses of Weight.write and toString
	public abstract W read(DataInput in) throws IOException;
	public abstract W parse(String s) throws DataFormatException;

	// the key the semiring is registered under
	public abstract String getName();

	// semirings are stateless, so all instances of a class are interchangeable
	public boolean equals(Object o) {
		return o != null && o.getClass() == getClass();
	}
	public int hashCode() { return getClass().hashCode(); }

	public String toString() { return getName(); }
}
