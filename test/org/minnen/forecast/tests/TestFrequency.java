package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.util.ForecastLib;
import org.minnen.forecast.util.Frequency;
import org.minnen.forecast.util.TimeLib;

public class TestFrequency
{
  @Test
  public void testParse()
  {
    Frequency freq = Frequency.parse("15min");
    assertEquals(Frequency.Unit.Minute, freq.unit);
    assertEquals(15, freq.multiple);
    assertEquals("15min", freq.toString());

    freq = Frequency.parse("M");
    assertEquals(Frequency.Unit.Month, freq.unit);
    assertTrue(freq.bPeriodEnd);
    assertFalse(Frequency.parse("MS").bPeriodEnd);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknown()
  {
    Frequency.parse("fortnight");
  }

  @Test
  public void testAdvance()
  {
    long jan31 = TimeLib.toMs(2024, 1, 31);
    assertEquals(TimeLib.toMs(2024, 2, 29), Frequency.parse("M").advance(jan31, 1));
    assertEquals(TimeLib.toMs(2024, 2, 3), Frequency.parse("D").advance(jan31, 3));
    assertEquals(TimeLib.toMs(2024, 2, 14), Frequency.parse("2W").advance(jan31, 1));

    // Friday + 1 business day is Monday.
    long friday = TimeLib.toMs(2024, 2, 2);
    assertEquals(TimeLib.toMs(2024, 2, 5), Frequency.parse("B").advance(friday, 1));
  }

  @Test
  public void testSeasonality()
  {
    assertEquals(7, Frequency.parse("D").getSeasonality());
    assertEquals(12, Frequency.parse("MS").getSeasonality());
    assertEquals(24, Frequency.parse("H").getSeasonality());
    assertEquals(4, Frequency.parse("15min").getSeasonality());
    assertEquals(1, Frequency.parse("W").getSeasonality());
  }

  @Test
  public void testInfer()
  {
    Sequence seq = new Sequence("a");
    seq.addData(AllTests.START_MS, 1.0);
    assertNull(ForecastLib.inferFrequency(seq));
    seq.addData(AllTests.START_MS + TimeLib.MS_IN_HOUR, 2.0);
    Frequency freq = ForecastLib.inferFrequency(seq);
    assertEquals(AllTests.START_MS + 3 * TimeLib.MS_IN_HOUR, freq.advance(AllTests.START_MS + TimeLib.MS_IN_HOUR, 2));
  }
}
