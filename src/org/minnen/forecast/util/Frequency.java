package org.minnen.forecast.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sampling frequency of a time series, parsed from a pandas-style frequency string ("D", "h", "15min", "W-SUN",
 * "MS", "QE", ...).
 *
 * Anchors such as "-SUN" are accepted but ignored: stepping always starts from the last observed timestamp.
 */
public class Frequency
{
  public enum Unit {
    Millis, Second, Minute, Hour, Day, BusinessDay, Week, Month, Quarter, Year
  }

  private static final Pattern           pattern = Pattern.compile("^(\\d*)([A-Za-z]+)(-[A-Za-z]+)?$");
  private static final Map<String, Unit> aliases = new HashMap<>();

  /** Aliases that refer to the end of a period (month end, quarter end, year end). */
  private static final Map<String, Unit> endAliases = new HashMap<>();

  static {
    aliases.put("S", Unit.Second);
    aliases.put("s", Unit.Second);
    aliases.put("T", Unit.Minute);
    aliases.put("min", Unit.Minute);
    aliases.put("H", Unit.Hour);
    aliases.put("h", Unit.Hour);
    aliases.put("D", Unit.Day);
    aliases.put("B", Unit.BusinessDay);
    aliases.put("W", Unit.Week);
    aliases.put("MS", Unit.Month);
    aliases.put("QS", Unit.Quarter);
    aliases.put("AS", Unit.Year);
    aliases.put("YS", Unit.Year);

    endAliases.put("M", Unit.Month);
    endAliases.put("ME", Unit.Month);
    endAliases.put("Q", Unit.Quarter);
    endAliases.put("QE", Unit.Quarter);
    endAliases.put("A", Unit.Year);
    endAliases.put("Y", Unit.Year);
    endAliases.put("YE", Unit.Year);
  }

  public final Unit    unit;
  public final int     multiple;
  public final boolean bPeriodEnd;
  private final String text;

  private Frequency(Unit unit, int multiple, boolean bPeriodEnd, String text)
  {
    if (multiple <= 0) {
      throw new IllegalArgumentException(String.format("Frequency multiple must be positive: %d", multiple));
    }
    this.unit = unit;
    this.multiple = multiple;
    this.bPeriodEnd = bPeriodEnd;
    this.text = text;
  }

  /**
   * Parse a frequency string.
   *
   * @param freq frequency string such as "D" or "15min"
   * @return parsed frequency
   * @throws IllegalArgumentException if the string is not a known frequency
   */
  public static Frequency parse(String freq)
  {
    Matcher m = pattern.matcher(freq.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException(String.format("Unknown frequency: [%s]", freq));
    }
    int multiple = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
    String code = m.group(2);
    if (aliases.containsKey(code)) {
      return new Frequency(aliases.get(code), multiple, false, freq);
    } else if (endAliases.containsKey(code)) {
      return new Frequency(endAliases.get(code), multiple, true, freq);
    } else {
      throw new IllegalArgumentException(String.format("Unknown frequency: [%s]", freq));
    }
  }

  /** @return frequency that steps by a fixed number of milliseconds */
  public static Frequency ofMillis(long ms)
  {
    if (ms <= 0 || ms > Integer.MAX_VALUE) {
      return new Frequency(Unit.Day, (int) Math.max(1, ms / TimeLib.MS_IN_DAY), false, ms + "ms");
    }
    return new Frequency(Unit.Millis, (int) ms, false, ms + "ms");
  }

  /**
   * Advance the given time by `steps` periods of this frequency.
   *
   * @param ms starting time in ms
   * @param steps number of periods to move forward
   * @return time in ms after stepping
   */
  public long advance(long ms, int steps)
  {
    final long n = (long) steps * multiple;
    switch (unit) {
    case Millis:
      return ms + n;
    case Second:
      return ms + n * TimeLib.MS_IN_SEC;
    case Minute:
      return ms + n * TimeLib.MS_IN_MIN;
    case Hour:
      return ms + n * TimeLib.MS_IN_HOUR;
    case Day:
      return ms + n * TimeLib.MS_IN_DAY;
    case Week:
      return ms + n * 7 * TimeLib.MS_IN_DAY;
    case BusinessDay:
      return advanceBusinessDays(ms, n);
    case Month:
      return addMonths(ms, n);
    case Quarter:
      return addMonths(ms, 3 * n);
    case Year:
      return addMonths(ms, 12 * n);
    default:
      throw new IllegalStateException("Unhandled unit: " + unit);
    }
  }

  private long addMonths(long ms, long nMonths)
  {
    LocalDateTime time = TimeLib.ms2time(ms);
    LocalDate date = time.toLocalDate();
    boolean bLastDay = date.equals(date.with(TemporalAdjusters.lastDayOfMonth()));
    LocalDateTime next = time.plusMonths(nMonths);
    if (bPeriodEnd && bLastDay) {
      next = next.with(TemporalAdjusters.lastDayOfMonth());
    }
    return TimeLib.toMs(next);
  }

  private static long advanceBusinessDays(long ms, long nDays)
  {
    LocalDateTime time = TimeLib.ms2time(ms);
    while (nDays > 0) {
      time = time.plusDays(1);
      if (!TimeLib.isWeekend(time.toLocalDate())) {
        --nDays;
      }
    }
    return TimeLib.toMs(time);
  }

  /** @return typical seasonal period for this frequency (e.g. 7 for daily data) */
  public int getSeasonality()
  {
    int period;
    switch (unit) {
    case Second:
    case Minute:
      period = 60;
      break;
    case Hour:
      period = 24;
      break;
    case Day:
      period = 7;
      break;
    case BusinessDay:
      period = 5;
      break;
    case Month:
      period = 12;
      break;
    case Quarter:
      period = 4;
      break;
    default:
      period = 1;
    }
    return Math.max(1, period / multiple);
  }

  @Override
  public String toString()
  {
    return text;
  }
}
