/*
 * Copyright 2018 Synesis-Partners.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package geosat.store;

import geosat.proj.Geos;
import geosat.proj.InvalidGeometryException;
import geosat.proj.MapPoint;
import geosat.proj.ProjectedPoint;
import geosat.system.TimeUtil;
import java.text.ParseException;

/**
 * Metadata of one decoded geostationary image together with its samples.
 * Every field is set by the constructor, which validates them, so consumers
 * never see a partially built image. The {@link ImageData} is owned by the
 * image; the {@link Geos} projection can be shared by images taken from the
 * same spacecraft.
 * <p>
 * Pixel coordinates follow the CGMS convention: the view angle of column c
 * is {@code (c + x0 - columnOffset) / columnRes} degrees, and likewise for
 * lines, where x0 and y0 locate the first pixel of a cropped image inside the
 * full disk.
 * </p>
 * @author Federal Highway Administration
 */
public class Image
{
	/**
	 * Name of the product the image was read from
	 */
	public final String m_sName;


	/**
	 * Acquisition year
	 */
	public final int m_nYear;


	/**
	 * Acquisition month, 1 = January
	 */
	public final int m_nMonth;


	/**
	 * Acquisition day of the month
	 */
	public final int m_nDay;


	/**
	 * Acquisition hour
	 */
	public final int m_nHour;


	/**
	 * Acquisition minute
	 */
	public final int m_nMinute;


	/**
	 * WMO id of the spacecraft
	 */
	public final int m_nSpacecraftId;


	/**
	 * Spectral channel id
	 */
	public final int m_nChannelId;


	/**
	 * Projection of the full disk the image belongs to
	 */
	public final Geos m_oProj;


	/**
	 * Column resolution factor, CFAC * 2^-16, in pixels per degree of view
	 * angle
	 */
	public final double m_dColumnRes;


	/**
	 * Line resolution factor, LFAC * 2^-16, in pixels per degree of view angle
	 */
	public final double m_dLineRes;


	/**
	 * Column of the sub-satellite point in the full disk
	 */
	public final int m_nColumnOffset;


	/**
	 * Line of the sub-satellite point in the full disk
	 */
	public final int m_nLineOffset;


	/**
	 * Full disk column of the first column of this image
	 */
	public final int m_nX0;


	/**
	 * Full disk line of the first line of this image
	 */
	public final int m_nY0;


	/**
	 * Unit of the calibrated values
	 */
	public final String m_sUnit;


	/**
	 * Samples and calibration of the image
	 */
	public final ImageData m_oData;


	/**
	 * Constructs a new Image, validating every field.
	 * @param sName product name
	 * @param nYear acquisition year
	 * @param nMonth acquisition month, 1 = January
	 * @param nDay acquisition day of the month
	 * @param nHour acquisition hour
	 * @param nMinute acquisition minute
	 * @param nSpacecraftId WMO spacecraft id
	 * @param nChannelId spectral channel id
	 * @param oProj projection of the full disk
	 * @param dColumnRes column resolution factor in pixels per degree
	 * @param dLineRes line resolution factor in pixels per degree
	 * @param nColumnOffset column of the sub-satellite point
	 * @param nLineOffset line of the sub-satellite point
	 * @param nX0 full disk column of the first column of the image
	 * @param nY0 full disk line of the first line of the image
	 * @param oData samples of the image, ownership is transferred to the image
	 * @param sUnit unit of the calibrated values
	 * @throws ParseException if any field is out of its valid range
	 */
	public Image(String sName, int nYear, int nMonth, int nDay, int nHour, int nMinute,
	   int nSpacecraftId, int nChannelId, Geos oProj, double dColumnRes, double dLineRes,
	   int nColumnOffset, int nLineOffset, int nX0, int nY0, ImageData oData, String sUnit)
	   throws ParseException
	{
		if (nMonth < 1 || nMonth > 12)
			throw new ParseException(String.format("Invalid month %d", nMonth), 0);
		if (nDay < 1 || nDay > TimeUtil.daysInMonth(nYear, nMonth))
			throw new ParseException(String.format("Invalid day %04d-%02d-%02d", nYear, nMonth, nDay), 0);
		if (nHour < 0 || nHour > 23 || nMinute < 0 || nMinute > 59)
			throw new ParseException(String.format("Invalid time %02d:%02d", nHour, nMinute), 0);
		if (oProj == null)
			throw new ParseException("Missing projection", 0);
		if (oData == null)
			throw new ParseException("Missing image data", 0);
		if (!(dColumnRes > 0.0) || !(dLineRes > 0.0) || Double.isInfinite(dColumnRes) || Double.isInfinite(dLineRes))
			throw new ParseException(String.format("Invalid resolution factors %s x %s", dColumnRes, dLineRes), 0);

		m_sName = sName;
		m_nYear = nYear;
		m_nMonth = nMonth;
		m_nDay = nDay;
		m_nHour = nHour;
		m_nMinute = nMinute;
		m_nSpacecraftId = nSpacecraftId;
		m_nChannelId = nChannelId;
		m_oProj = oProj;
		m_dColumnRes = dColumnRes;
		m_dLineRes = dLineRes;
		m_nColumnOffset = nColumnOffset;
		m_nLineOffset = nLineOffset;
		m_nX0 = nX0;
		m_nY0 = nY0;
		m_oData = oData;
		m_sUnit = sUnit;

		ProjectedPoint oOrigin = pixelToProjected(0, 0);
		if (!(Math.abs(oOrigin.m_dX) < 90.0) || !(Math.abs(oOrigin.m_dY) < 90.0))
			throw new ParseException(String.format("Offsets place the first pixel at invalid view angle %s", oOrigin), 0);
	}


	/**
	 * Copies the metadata of the given image for a cropped version of its data
	 * @param oSrc image to copy
	 * @param oData cropped samples
	 * @param nX0 full disk column of the first column of the crop
	 * @param nY0 full disk line of the first line of the crop
	 */
	private Image(Image oSrc, ImageData oData, int nX0, int nY0)
	{
		m_sName = oSrc.m_sName;
		m_nYear = oSrc.m_nYear;
		m_nMonth = oSrc.m_nMonth;
		m_nDay = oSrc.m_nDay;
		m_nHour = oSrc.m_nHour;
		m_nMinute = oSrc.m_nMinute;
		m_nSpacecraftId = oSrc.m_nSpacecraftId;
		m_nChannelId = oSrc.m_nChannelId;
		m_oProj = oSrc.m_oProj;
		m_dColumnRes = oSrc.m_dColumnRes;
		m_dLineRes = oSrc.m_dLineRes;
		m_nColumnOffset = oSrc.m_nColumnOffset;
		m_nLineOffset = oSrc.m_nLineOffset;
		m_nX0 = nX0;
		m_nY0 = nY0;
		m_oData = oData;
		m_sUnit = oSrc.m_sUnit;
	}


	/**
	 * @return acquisition time formatted as YYYY-MM-DD HH:MM
	 */
	public String datetime()
	{
		return String.format("%04d-%02d-%02d %02d:%02d", m_nYear, m_nMonth, m_nDay, m_nHour, m_nMinute);
	}


	/**
	 * @return acquisition time in seconds since 2000-01-01T00:00:00Z
	 */
	public long seconds2000()
	{
		return TimeUtil.toSeconds2000(m_nYear, m_nMonth, m_nDay, m_nHour, m_nMinute);
	}


	/**
	 * Gets the view angles of the given pixel of this image
	 * @param nColumn column of the image
	 * @param nLine line of the image
	 * @return the projected point in degrees
	 */
	public ProjectedPoint pixelToProjected(int nColumn, int nLine)
	{
		return new ProjectedPoint((nColumn + m_nX0 - m_nColumnOffset) / m_dColumnRes,
		   (nLine + m_nY0 - m_nLineOffset) / m_dLineRes);
	}


	/**
	 * Gets the geographic coordinates of the given pixel
	 * @param nColumn column of the image
	 * @param nLine line of the image
	 * @return latitude and longitude of the pixel
	 * @throws InvalidGeometryException if the pixel is outside of the earth disk
	 */
	public MapPoint pixelToMap(int nColumn, int nLine)
	{
		return m_oProj.projectedToMap(pixelToProjected(nColumn, nLine));
	}


	/**
	 * Gets the pixel that contains the given geographic point. The returned
	 * pixel can be outside of the bounds of the image.
	 * @param oMap latitude and longitude
	 * @return [column, line] of the pixel
	 * @throws InvalidGeometryException if the point is not visible from the
	 * satellite
	 */
	public int[] mapToPixel(MapPoint oMap)
	{
		ProjectedPoint oProj = m_oProj.mapToProjected(oMap);
		return new int[]
		{
			(int)Math.round(oProj.m_dX * m_dColumnRes) + m_nColumnOffset - m_nX0,
			(int)Math.round(oProj.m_dY * m_dLineRes) + m_nLineOffset - m_nY0
		};
	}


	/**
	 * Creates a copy of the image restricted to the given rectangle. The
	 * projection is shared and the crop origin is moved so pixel coordinates
	 * keep mapping to the same locations.
	 * @param nX first column
	 * @param nY first line
	 * @param nWidth number of columns
	 * @param nHeight number of lines
	 * @return the cropped image
	 * @throws IndexOutOfBoundsException if the rectangle does not fit in the
	 * image
	 */
	public Image crop(int nX, int nY, int nWidth, int nHeight)
	{
		return new Image(this, m_oData.crop(nX, nY, nWidth, nHeight), m_nX0 + nX, m_nY0 + nY);
	}


	/**
	 * Wrapper for {@link PixelGeometry#pixelSize(Image)}
	 */
	public double pixelSize()
	{
		return PixelGeometry.pixelSize(this);
	}


	/**
	 * Wrapper for {@link PixelGeometry#seviriDX(Image)}
	 */
	public double seviriDX()
	{
		return PixelGeometry.seviriDX(this);
	}


	/**
	 * Wrapper for {@link PixelGeometry#seviriDY(Image)}
	 */
	public double seviriDY()
	{
		return PixelGeometry.seviriDY(this);
	}
}
