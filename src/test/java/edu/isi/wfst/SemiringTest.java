package edu.isi.wfst;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SemiringTest {

  @Test
  void tropical() {
    TropicalSemiring s = new TropicalSemiring();
    assertEquals(new TropicalWeight(1), s.plus(new TropicalWeight(1), new TropicalWeight(4)));
    assertEquals(new TropicalWeight(5), s.times(new TropicalWeight(1), new TropicalWeight(4)));
    assertEquals(new TropicalWeight(4), s.plus(s.ZERO(), new TropicalWeight(4)));
    assertEquals(s.ZERO(), s.times(s.ZERO(), new TropicalWeight(4)));
    assertFalse(s.NOWEIGHT().member());
    assertFalse(new TropicalWeight(Double.NEGATIVE_INFINITY).member());
    assertTrue(s.ZERO().member());
  }

  @Test
  void logAddsInProbabilitySpace() {
    LogSemiring s = new LogSemiring();
    LogWeight sum = s.plus(new LogWeight(1), new LogWeight(1));
    assertEquals(1 - Math.log(2), sum.getValue(), 1e-12);
    assertEquals(new LogWeight(3), s.plus(s.ZERO(), new LogWeight(3)));
    // far apart: the smaller probability is lost
    assertEquals(new LogWeight(1), s.plus(new LogWeight(1), new LogWeight(100)));
    assertEquals(new LogWeight(3), s.times(new LogWeight(1), new LogWeight(2)));
  }

  @Test
  void real() {
    RealSemiring s = new RealSemiring();
    assertEquals(new RealWeight(0.75), s.plus(new RealWeight(0.5), new RealWeight(0.25)));
    assertEquals(new RealWeight(0.125), s.times(new RealWeight(0.5), new RealWeight(0.25)));
    assertFalse(new RealWeight(Double.POSITIVE_INFINITY).member());
    assertFalse(s.plus(s.NOWEIGHT(), s.ONE()).member());
  }

  @Test
  void quantizeRoundsToNearestStep() {
    assertEquals(new RealWeight(0.25), new RealWeight(0.3).quantize(0.25f));
    assertEquals(new RealWeight(0.5), new RealWeight(0.4).quantize(0.25f));
    assertEquals(new TropicalWeight(Double.POSITIVE_INFINITY),
        new TropicalWeight(Double.POSITIVE_INFINITY).quantize(Weight.DELTA));
    assertFalse(new RealWeight(Double.NaN).quantize(Weight.DELTA).member());
  }

  @Test
  void equalityIsExactAndTyped() {
    assertEquals(new RealWeight(0.0), new RealWeight(-0.0));
    assertEquals(new RealWeight(0.0).hashCode(), new RealWeight(-0.0).hashCode());
    assertEquals(new RealWeight(Double.NaN), new RealWeight(Double.NaN));
    assertNotEquals(new RealWeight(1), new LogWeight(1));
    assertEquals(new TropicalSemiring(), new TropicalSemiring());
    assertNotEquals(new TropicalSemiring(), new LogSemiring());
  }

  @Test
  void parseAndWriteText() throws DataFormatException {
    TropicalSemiring s = new TropicalSemiring();
    assertEquals(s.ZERO(), s.parse(s.ZERO().toString()));
    assertEquals(new TropicalWeight(2.5), s.parse(" 2.5 "));
    assertThrows(DataFormatException.class, () -> s.parse("two"));
  }
}
