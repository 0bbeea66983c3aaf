package geosat.system;

import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.Date;
import java.util.GregorianCalendar;
import java.util.SimpleTimeZone;

/**
 * Calendar conversions in UTC. None of the methods depend on the default time
 * zone or locale of the JVM.
 * @author aaron.cherney
 */
public abstract class TimeUtil
{
	/**
	 * Zero offset time zone used by every conversion
	 */
	public static final SimpleTimeZone UTC = new SimpleTimeZone(0, "");


	/**
	 * Seconds from 1970-01-01T00:00:00Z to 2000-01-01T00:00:00Z
	 */
	public static final long EPOCH_2000 = 946684800L;


	/**
	 * @return a cleared Gregorian calendar in UTC
	 */
	private static GregorianCalendar newCalendar()
	{
		GregorianCalendar oCal = new GregorianCalendar(UTC);
		oCal.clear();
		return oCal;
	}


	/**
	 * @param nYear year
	 * @return true if the year is a leap year
	 */
	public static boolean isLeapYear(int nYear)
	{
		return newCalendar().isLeapYear(nYear);
	}


	/**
	 * Gets the number of days in the given month
	 * @param nYear year
	 * @param nMonth month, 1 = January
	 * @return number of days in the month
	 */
	public static int daysInMonth(int nYear, int nMonth)
	{
		GregorianCalendar oCal = newCalendar();
		oCal.set(nYear, nMonth - 1, 1);
		return oCal.getActualMaximum(Calendar.DAY_OF_MONTH);
	}


	/**
	 * Converts a UTC date and time to seconds since 1970-01-01T00:00:00Z
	 * @param nYear year
	 * @param nMonth month, 1 = January
	 * @param nDay day of the month
	 * @param nHour hour of the day
	 * @param nMinute minute of the hour
	 * @return seconds since the Unix epoch
	 */
	public static long toEpochSeconds(int nYear, int nMonth, int nDay, int nHour, int nMinute)
	{
		GregorianCalendar oCal = newCalendar();
		oCal.set(nYear, nMonth - 1, nDay, nHour, nMinute, 0);
		return Math.floorDiv(oCal.getTimeInMillis(), 1000L);
	}


	/**
	 * Converts a UTC date and time to seconds since 2000-01-01T00:00:00Z
	 * @param nYear year
	 * @param nMonth month, 1 = January
	 * @param nDay day of the month
	 * @param nHour hour of the day
	 * @param nMinute minute of the hour
	 * @return seconds since 2000-01-01T00:00:00Z
	 */
	public static long toSeconds2000(int nYear, int nMonth, int nDay, int nHour, int nMinute)
	{
		return toEpochSeconds(nYear, nMonth, nDay, nHour, nMinute) - EPOCH_2000;
	}


	/**
	 * Parses a UTC time stamp with the given pattern and splits it into its
	 * calendar fields. Parsing is not lenient so out of range fields, such as
	 * month 13, are rejected. Characters after the pattern are ignored.
	 * @param sPattern SimpleDateFormat pattern, for example yyyyMMddHHmm
	 * @param sTime the time stamp
	 * @return year, month (1 = January), day, hour and minute
	 * @throws ParseException if the time stamp does not match the pattern
	 */
	public static int[] parseFields(String sPattern, String sTime)
	   throws ParseException
	{
		SimpleDateFormat oSdf = new SimpleDateFormat(sPattern);
		oSdf.setTimeZone(UTC);
		oSdf.setLenient(false);
		Date oDate = oSdf.parse(sTime);

		GregorianCalendar oCal = new GregorianCalendar(UTC);
		oCal.setTime(oDate);
		return new int[]
		{
			oCal.get(Calendar.YEAR), oCal.get(Calendar.MONTH) + 1, oCal.get(Calendar.DAY_OF_MONTH),
			oCal.get(Calendar.HOUR_OF_DAY), oCal.get(Calendar.MINUTE)
		};
	}
}
