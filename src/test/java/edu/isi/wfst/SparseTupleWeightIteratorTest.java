package edu.isi.wfst;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SparseTupleWeightIteratorTest {
  private static final LogSemiring LOG = new LogSemiring();

  @Test
  void emptyWeightIsDoneImmediately() {
    SparseTupleWeightIterator<LogWeight> it = new SparseTupleWeightIterator<>(new SparseTupleWeight<>(LOG));
    assertTrue(it.done());
  }

  @Test
  void walksInlineThenOverflow() {
    SparseTupleWeight<LogWeight> w = new SparseTupleWeight<>(LOG);
    w.push(2, new LogWeight(0.5));
    w.push(4, new LogWeight(1.5));
    w.push(9, new LogWeight(2.5));

    List<Pair<Integer, LogWeight>> seen = new ArrayList<>();
    for (SparseTupleWeightIterator<LogWeight> it = new SparseTupleWeightIterator<>(w); !it.done(); it.next())
      seen.add(it.value());
    assertEquals(List.of(
        new Pair<>(2, new LogWeight(0.5)),
        new Pair<>(4, new LogWeight(1.5)),
        new Pair<>(9, new LogWeight(2.5))), seen);
  }

  @Test
  void resetRewindsAndIteratorsAreIndependent() {
    SparseTupleWeight<LogWeight> w = new SparseTupleWeight<>(LOG);
    w.push(1, new LogWeight(1));
    w.push(3, new LogWeight(3));

    SparseTupleWeightIterator<LogWeight> a = new SparseTupleWeightIterator<>(w);
    SparseTupleWeightIterator<LogWeight> b = new SparseTupleWeightIterator<>(w);
    a.next();
    assertEquals(3, a.key());
    assertEquals(1, b.key());
    a.next();
    assertTrue(a.done());
    assertFalse(b.done());
    a.reset();
    assertEquals(1, a.key());
    assertEquals(new LogWeight(1), a.weight());
    assertEquals(2, w.size());
  }
}
