package edu.isi.wfst;

import gnu.trove.TIntArrayList;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;

/**
 * Arbitrary dimension tuple weight, stored sparsely as (key, weight) pairs
 * sorted by key. Keys that aren't stored resolve to the default value, which is
 * ZERO unless set otherwise. No stored weight ever equals the default.
 * <p>
 * The first pair lives in its own fields so that the common one-dimensional
 * weight doesn't allocate the overflow lists. Use
 * {@link SparseTupleWeightIterator} to walk the stored pairs; the default is
 * not part of the walk.
 * <p>
 * Pairs must be pushed in strictly ascending key order. This isn't checked.
 * <p>
 * hashCode covers the stored pairs only, while equals compares resolved
 * values. The two agree only for weights in canonical form: every pair pushed
 * with the default check and the default not changed afterwards through
 * {@link #setDefaultValue}. Only such weights are safe as hash keys.
 */
public class SparseTupleWeight<W extends Weight<W>> implements Weight<SparseTupleWeight<W>> {

	private final Semiring<W> semiring;
	private W defaultValue;

	// the first pair, if hasFirst
	private boolean hasFirst;
	private int firstKey;
	private W firstValue;

	// everything after the first pair. Created on demand
	private TIntArrayList restKeys;
	private ArrayList<W> restValues;

	// shared identities can't be changed
	private boolean frozen = false;

	// the additive identity: every key is ZERO
	public SparseTupleWeight(Semiring<W> semiring) {
		this(semiring, semiring.ZERO());
	}

	// every key resolves to defaultValue
	public SparseTupleWeight(Semiring<W> semiring, W defaultValue) {
		this.semiring = semiring;
		init(defaultValue);
	}

	public SparseTupleWeight(Semiring<W> semiring, int key, W w) {
		this(semiring);
		push(key, w);
	}

	// assumes pairs are sorted by key
	public SparseTupleWeight(Semiring<W> semiring, Iterable<Pair<Integer, W>> pairs) {
		this(semiring);
		for (Pair<Integer, W> p : pairs)
			push(p);
	}

	// independent copy. pairs are pushed again rather than sharing storage
	public SparseTupleWeight(SparseTupleWeight<W> w) {
		this(w.semiring, w.defaultValue);
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(w); !it.done(); it.next())
			push(it.key(), it.weight());
	}

	public static <W extends Weight<W>> SparseTupleWeight<W> zero(Semiring<W> semiring) {
		return SparsePowerSemiring.of(semiring).ZERO();
	}
	public static <W extends Weight<W>> SparseTupleWeight<W> one(Semiring<W> semiring) {
		return SparsePowerSemiring.of(semiring).ONE();
	}
	public static <W extends Weight<W>> SparseTupleWeight<W> noWeight(Semiring<W> semiring) {
		return SparsePowerSemiring.of(semiring).NOWEIGHT();
	}

	// clear out all pairs and start over with a new default
	public void init(W defaultValue) {
		checkMutable();
		this.defaultValue = defaultValue;
		hasFirst = false;
		firstKey = 0;
		firstValue = null;
		restKeys = null;
		restValues = null;
	}

	public void push(int key, W w) {
		push(key, w, true);
	}

	public void push(Pair<Integer, W> p) {
		push(p.l(), p.r(), true);
	}

	/**
	 * Appends a pair. With checkDefault on, a weight equal to the default is
	 * dropped so the stored pairs stay sparse.
	 */
	public void push(int key, W w, boolean checkDefault) {
		checkMutable();
		if (checkDefault && w.equals(defaultValue))
			return;
		if (!hasFirst) {
			hasFirst = true;
			firstKey = key;
			firstValue = w;
			return;
		}
		if (restKeys == null) {
			restKeys = new TIntArrayList();
			restValues = new ArrayList<W>();
		}
		restKeys.add(key);
		restValues.add(w);
	}

	public void setDefaultValue(W w) {
		checkMutable();
		defaultValue = w;
	}

	public W getDefaultValue() { return defaultValue; }

	public Semiring<W> getSemiring() { return semiring; }

	// number of stored (non-default) pairs
	public int size() {
		if (!hasFirst)
			return 0;
		return restKeys == null ? 1 : restKeys.size()+1;
	}

	// the weight at key, whether stored or not
	public W get(int key) {
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(this); !it.done(); it.next()) {
			if (it.key() == key)
				return it.weight();
			if (it.key() > key)
				break;
		}
		return defaultValue;
	}

	public boolean member() {
		if (!defaultValue.member())
			return false;
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(this); !it.done(); it.next()) {
			if (!it.weight().member())
				return false;
		}
		return true;
	}

	// only the stored pairs are hashed. the default doesn't contribute
	public int hashCode() {
		int h = 0;
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(this); !it.done(); it.next()) {
			h = 5*h + Integer.hashCode(it.key());
			h = 13*h + it.weight().hashCode();
		}
		return h;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof SparseTupleWeight))
			return false;
		return PairwiseMerge.equal(this, (SparseTupleWeight<?>)o);
	}

	public SparseTupleWeight<W> quantize() {
		return quantize(DELTA);
	}

	// stored weights are quantized; the default is kept as is
	public SparseTupleWeight<W> quantize(float delta) {
		SparseTupleWeight<W> w = new SparseTupleWeight<W>(semiring, defaultValue);
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(this); !it.done(); it.next())
			w.push(it.key(), it.weight().quantize(delta));
		return w;
	}

	// stored weights are reversed; the default is carried over as is
	public SparseTupleWeight<W> reverse() {
		SparseTupleWeight<W> w = new SparseTupleWeight<W>(semiring, defaultValue);
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(this); !it.done(); it.next())
			w.push(it.key(), it.weight().reverse());
		return w;
	}

	/**
	 * Binary form: the default, a flag for the first pair and the pair itself,
	 * then the number of remaining pairs and the pairs.
	 */
	public void write(DataOutput out) throws IOException {
		defaultValue.write(out);
		out.writeBoolean(hasFirst);
		if (hasFirst) {
			out.writeInt(firstKey);
			firstValue.write(out);
		}
		int rest = restKeys == null ? 0 : restKeys.size();
		out.writeInt(rest);
		for (int i = 0; i < rest; i++) {
			out.writeInt(restKeys.get(i));
			restValues.get(i).write(out);
		}
	}

	// reads what write wrote. A short stream shows up as the stream's EOFException
	public static <W extends Weight<W>> SparseTupleWeight<W> read(DataInput in, Semiring<W> semiring) throws IOException {
		SparseTupleWeight<W> w = new SparseTupleWeight<W>(semiring, semiring.read(in));
		if (in.readBoolean()) {
			int key = in.readInt();
			w.push(key, semiring.read(in), false);
		}
		int rest = in.readInt();
		if (rest < 0)
			throw new IOException("Negative pair count "+rest+" in sparse tuple weight");
		for (int i = 0; i < rest; i++) {
			int key = in.readInt();
			w.push(key, semiring.read(in), false);
		}
		return w;
	}

	// default first, then key and weight of each stored pair
	public String toString() {
		StringBuilder buf = new StringBuilder();
		CompositeWeightWriter writer = new CompositeWeightWriter(buf);
		writer.writeBegin();
		writer.writeElement(defaultValue);
		for (SparseTupleWeightIterator<W> it = new SparseTupleWeightIterator<W>(this); !it.done(); it.next()) {
			writer.writeElement(it.key());
			writer.writeElement(it.weight());
		}
		writer.writeEnd();
		return buf.toString();
	}

	/**
	 * Reads what toString wrote. Pairs go through the default check, so entries
	 * equal to the default are dropped.
	 */
	public static <W extends Weight<W>> SparseTupleWeight<W> parse(String s, Semiring<W> semiring) throws DataFormatException {
		boolean debug = false;
		CompositeWeightReader reader = new CompositeWeightReader(s);
		reader.readBegin();
		SparseTupleWeight<W> w = new SparseTupleWeight<W>(semiring);
		w.init(semiring.parse(reader.readElement()));
		while (reader.hasMore()) {
			String keyString = reader.readElement();
			if (!reader.hasMore())
				throw new DataFormatException("Key "+keyString+" has no weight in \""+s+"\"");
			int key;
			try {
				key = Integer.parseInt(keyString);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad key "+keyString+" in \""+s+"\"", e);
			}
			W v = semiring.parse(reader.readElement());
			if (debug) Debug.debug(debug, "Read pair "+key+" -> "+v);
			w.push(key, v);
		}
		reader.readEnd();
		return w;
	}

	// used for cached identities
	SparseTupleWeight<W> freeze() {
		frozen = true;
		return this;
	}

	private void checkMutable() {
		if (frozen)
			throw new IllegalStateException("Shared weight "+this+" can't be modified; copy it first");
	}

	// iterator access
	boolean hasFirst() { return hasFirst; }
	int firstKey() { return firstKey; }
	W firstValue() { return firstValue; }
	int restSize() { return restKeys == null ? 0 : restKeys.size(); }
	int restKey(int i) { return restKeys.get(i); }
	W restValue(int i) { return restValues.get(i); }
}
