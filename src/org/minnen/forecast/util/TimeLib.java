package org.minnen.forecast.util;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Conversions between epoch milliseconds and calendar times. All times are interpreted in UTC. */
public class TimeLib
{
  public final static long              TIME_ERROR  = Library.LNAN;
  public final static long              MS_IN_SEC   = 1000L;
  public final static long              MS_IN_MIN   = 60 * MS_IN_SEC;
  public final static long              MS_IN_HOUR  = 60 * MS_IN_MIN;
  public final static long              MS_IN_DAY   = 24 * MS_IN_HOUR;
  public final static long              NS_IN_SEC   = 1000000000L;

  public final static ZoneOffset        ZeroOffset  = ZoneOffset.ofTotalSeconds(0);

  public final static DateTimeFormatter dtfYMD      = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  public final static DateTimeFormatter dtfDateTime = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  public static LocalDateTime ms2time(long ms)
  {
    return LocalDateTime.ofInstant(Instant.ofEpochMilli(ms), ZeroOffset);
  }

  /** @return ms for midnight at the start of the given day */
  public static long toMs(LocalDate date)
  {
    return toMs(date.atStartOfDay());
  }

  public static long toMs(LocalDateTime time)
  {
    return time.toInstant(ZeroOffset).toEpochMilli();
  }

  public static long toMs(int year, int month, int day)
  {
    return toMs(LocalDate.of(year, month, day));
  }

  /** @return number of seconds between two readings of a nanosecond clock */
  public static double secondsBetween(long startNanos, long endNanos)
  {
    return (endNanos - startNanos) / (double) NS_IN_SEC;
  }

  /** @return true if the given day falls on a Saturday or Sunday */
  public static boolean isWeekend(LocalDate date)
  {
    DayOfWeek day = date.getDayOfWeek();
    return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
  }

  /** @return date only (yyyy-MM-dd) if the time is midnight, otherwise date and time */
  public static String formatTime(long ms)
  {
    if (ms == TIME_ERROR) return null;
    LocalDateTime time = ms2time(ms);
    if (time.toLocalTime().toSecondOfDay() == 0 && time.getNano() == 0) {
      return time.format(dtfYMD);
    }
    return time.format(dtfDateTime);
  }

  /**
   * Parse a timestamp written as "yyyy-MM-dd", "yyyy-MM-dd HH:mm:ss" or ISO-8601 ("yyyy-MM-ddTHH:mm:ss").
   *
   * @param s timestamp string
   * @return time in ms (UTC)
   * @throws IllegalArgumentException if the string can't be parsed
   */
  public static long parseTime(String s)
  {
    s = s.trim();
    try {
      if (s.length() == 10) {
        return toMs(LocalDate.parse(s, dtfYMD));
      } else if (s.indexOf('T') > 0) {
        return toMs(LocalDateTime.parse(s));
      } else {
        return toMs(LocalDateTime.parse(s, dtfDateTime));
      }
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(String.format("Can't parse timestamp: [%s]", s), e);
    }
  }
}
