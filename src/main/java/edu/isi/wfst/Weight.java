package edu.isi.wfst;

import java.io.DataOutput;
import java.io.IOException;

/**
 * A semiring value. Identities, plus, times and the decoders live on the
 * {@link Semiring} that produced the weight; the weight itself knows how to
 * check, round, reverse, and write itself.
 *
 * Implementations must override equals and hashCode consistently.
 */
public interface Weight<W extends Weight<W>> {
	/** default quantization step */
	float DELTA = 1.0F / 1024.0F;

	// false for NoWeight and other invalid values
	public boolean member();

	public W quantize(float delta);

	// reverse weights have the same java type as their forward weights
	public W reverse();

	public void write(DataOutput out) throws IOException;
}
