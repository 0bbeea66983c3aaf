package geosat.system;

import java.text.ParseException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.TimeZone;
import junit.framework.TestCase;

public class TimeUtilTest extends TestCase
{
	public void testEpoch2000()
	{
		assertEquals(0L, TimeUtil.toSeconds2000(2000, 1, 1, 0, 0));
		assertEquals(127828800L, TimeUtil.toSeconds2000(2004, 1, 19, 12, 0));
		assertEquals(-60L, TimeUtil.toSeconds2000(1999, 12, 31, 23, 59));
	}


	public void testEpochSeconds()
	{
		assertEquals(0L, TimeUtil.toEpochSeconds(1970, 1, 1, 0, 0));
		LocalDateTime oTime = LocalDateTime.of(1899, 1, 1, 7, 45);
		LocalDateTime oEnd = LocalDateTime.of(2101, 1, 1, 0, 0);
		while (oTime.isBefore(oEnd))
		{
			assertEquals(oTime.toString(), oTime.toEpochSecond(ZoneOffset.UTC),
			   TimeUtil.toEpochSeconds(oTime.getYear(), oTime.getMonthValue(), oTime.getDayOfMonth(), oTime.getHour(), oTime.getMinute()));
			oTime = oTime.plusDays(13).plusMinutes(37);
		}
	}


	public void testDefaultTimeZoneIgnored()
	{
		TimeZone oDefault = TimeZone.getDefault();
		try
		{
			TimeZone.setDefault(TimeZone.getTimeZone("Australia/Adelaide"));
			assertEquals(127828800L, TimeUtil.toSeconds2000(2004, 1, 19, 12, 0));
		}
		finally
		{
			TimeZone.setDefault(oDefault);
		}
	}


	public void testCalendar()
	{
		assertTrue(TimeUtil.isLeapYear(2000));
		assertTrue(TimeUtil.isLeapYear(2004));
		assertFalse(TimeUtil.isLeapYear(1900));
		assertFalse(TimeUtil.isLeapYear(2003));
		assertEquals(29, TimeUtil.daysInMonth(2004, 2));
		assertEquals(28, TimeUtil.daysInMonth(2100, 2));
		assertEquals(30, TimeUtil.daysInMonth(2004, 11));
		assertEquals(31, TimeUtil.daysInMonth(2004, 12));
	}


	public void testParseFields()
	   throws ParseException
	{
		int[] nTime = TimeUtil.parseFields("yyyyMMddHHmm", "200402291230");
		assertEquals(2004, nTime[0]);
		assertEquals(2, nTime[1]);
		assertEquals(29, nTime[2]);
		assertEquals(12, nTime[3]);
		assertEquals(30, nTime[4]);
	}


	public void testParseFieldsIsStrict()
	{
		String[] sBad = new String[]{"200302291200", "200413011200", "200401012400", "2004O1191200"};
		for (String sTime : sBad)
		{
			try
			{
				TimeUtil.parseFields("yyyyMMddHHmm", sTime);
				fail(sTime + " accepted");
			}
			catch (ParseException oEx)
			{
				assertNotNull(oEx.getMessage());
			}
		}
	}
}
