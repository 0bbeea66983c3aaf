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
package geosat.collect;

import geosat.proj.Geos;
import geosat.store.ByteImageData;
import geosat.store.Image;
import geosat.store.ImageConsumer;
import geosat.store.ImageData;
import geosat.store.IntImageData;
import geosat.store.ShortImageData;
import geosat.system.TimeUtil;
import java.io.IOException;
import java.text.ParseException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds {@link Image}s from Nowcasting SAF products. The product root group
 * carries the acquisition time and geometry, each image dataset carries its
 * size, calibration and samples.
 * @author aaron.cherney
 */
public class SafImporter
{
	private static final Logger LOGGER = LogManager.getLogger(SafImporter.class);


	/**
	 * Column and line of the sub-satellite point in a SEVIRI full disk
	 */
	public static final int FULL_DISK_CENTER = 1856;


	/**
	 * Unit of SAF values, which are classification codes or already scaled
	 * physical quantities
	 */
	public static final String UNIT = "NUMERIC";


	/**
	 * Value of the CLASS attribute of datasets holding images
	 */
	public static final String IMAGE_CLASS = "IMAGE";


	/**
	 * Missing value of 4 byte samples, the largest unsigned 32 bit value
	 */
	public static final int UINT32_MISSING = 0xffffffff;


	/**
	 * Usual calibration of the known products
	 */
	private final ChannelReferences m_oReferences;


	/**
	 * Area kept from every imported image as [x, y, width, height], null to
	 * keep whole images
	 */
	private final int[] m_nCrop;


	/**
	 * Constructs an importer that keeps whole images
	 * @param oReferences channel table used to assign channel ids and check
	 * calibrations
	 */
	public SafImporter(ChannelReferences oReferences)
	{
		m_oReferences = oReferences;
		m_nCrop = null;
	}


	/**
	 * Constructs an importer that crops every image read by
	 * {@link #read(ProductSource, String, ImageConsumer)} to the given area
	 * @param oReferences channel table used to assign channel ids and check
	 * calibrations
	 * @param nX first column of the area
	 * @param nY first line of the area
	 * @param nWidth number of columns
	 * @param nHeight number of lines
	 * @throws IllegalArgumentException if the area is empty or starts at a
	 * negative position
	 */
	public SafImporter(ChannelReferences oReferences, int nX, int nY, int nWidth, int nHeight)
	{
		if (nX < 0 || nY < 0 || nWidth <= 0 || nHeight <= 0)
			throw new IllegalArgumentException(String.format("Invalid crop area %d,%d %dx%d", nX, nY, nWidth, nHeight));
		m_oReferences = oReferences;
		m_nCrop = new int[]{nX, nY, nWidth, nHeight};
	}


	/**
	 * Imports images from the given product, crops them when a crop area is
	 * set, and passes them to the consumer.
	 * @param oProduct the product file
	 * @param sImageName name of the dataset to import, or null to import every
	 * dataset whose CLASS is IMAGE
	 * @param oConsumer receives the images
	 * @throws ParseException if the metadata is malformed or the named dataset
	 * is not an image
	 * @throws IOException if the product cannot be read
	 * @throws IndexOutOfBoundsException if the crop area does not fit in an
	 * image
	 */
	public void read(ProductSource oProduct, String sImageName, ImageConsumer oConsumer)
	   throws ParseException, IOException
	{
		if (sImageName == null)
		{
			List<String> oNames = oProduct.getDatasetNames();
			for (String sName : oNames)
			{
				SampleSource oDataset = oProduct.getDataset(sName);
				if (!IMAGE_CLASS.equals(oDataset.getString("CLASS")))
				{
					LOGGER.debug("Skipping dataset " + sName);
					continue;
				}
				oConsumer.processImage(cropIfNeeded(importImage(oProduct, oDataset, sName)));
			}
			return;
		}

		SampleSource oDataset = oProduct.getDataset(sImageName);
		if (!IMAGE_CLASS.equals(oDataset.getString("CLASS")))
			throw new ParseException(String.format("Dataset %s is not an image", sImageName), 0);
		oConsumer.processImage(cropIfNeeded(importImage(oProduct, oDataset, sImageName)));
	}


	/**
	 * @param oImage a whole imported image
	 * @return the image restricted to the crop area, or the image itself when
	 * no area is set
	 */
	private Image cropIfNeeded(Image oImage)
	{
		if (m_nCrop == null)
			return oImage;
		LOGGER.debug(String.format("Cropping %s to %d,%d %dx%d", oImage.m_sName, m_nCrop[0], m_nCrop[1], m_nCrop[2], m_nCrop[3]));
		return oImage.crop(m_nCrop[0], m_nCrop[1], m_nCrop[2], m_nCrop[3]);
	}


	/**
	 * Builds the image stored in one dataset of a product.
	 * @param oGroup attributes of the product root group
	 * @param oDataset the image dataset
	 * @param sName name of the dataset
	 * @return the imported image
	 * @throws ParseException if the metadata is malformed
	 * @throws IOException if the samples cannot be read
	 */
	public Image importImage(AttributeSource oGroup, SampleSource oDataset, String sName)
	   throws ParseException, IOException
	{
		int[] nTime = parseDatetime(oGroup.getString("IMAGE_ACQUISITION_TIME"));
		Geos oProj = new Geos(parseSubLon(oGroup.getString("PROJECTION_NAME")));

		ChannelReference oRef = m_oReferences.get(sName);
		int nChannel = oRef == null ? oGroup.getInt("SPECTRAL_CHANNEL_ID") : oRef.m_nChannel;
		int nSpacecraft = Spacecraft.fromHrit(oGroup.getInt("GP_SC_ID"));
		double dColumnRes = oGroup.getInt("CFAC") / 65536.0;
		double dLineRes = oGroup.getInt("LFAC") / 65536.0;
		// COFF and LOFF are the distance from the first pixel of the crop to
		// the sub-satellite point
		int nX0 = FULL_DISK_CENTER - oGroup.getInt("COFF") + 1;
		int nY0 = FULL_DISK_CENTER - oGroup.getInt("LOFF") + 1;

		ImageData oData = readData(oDataset, sName);
		if (oRef == null)
			LOGGER.warn("Unknown channel information for product " + sName);
		else
		{
			for (String sWarning : oRef.check(oData))
				LOGGER.warn(sName + ": " + sWarning);
		}

		Image oImage = new Image(sName, nTime[0], nTime[1], nTime[2], nTime[3], nTime[4], nSpacecraft, nChannel,
		   oProj, dColumnRes, dLineRes, FULL_DISK_CENTER, FULL_DISK_CENTER, nX0, nY0, oData, UNIT);
		LOGGER.debug(String.format("Imported %s %s %dx%d", sName, oImage.datetime(), oData.getColumns(), oData.getLines()));
		return oImage;
	}


	/**
	 * Gets the file name normally used when the image is exported:
	 * SAF_{REGION_NAME}_{dataset}_{yyyyMMdd_HHmm}. The region is "unknown" when
	 * the product does not name it.
	 * @param oGroup attributes of the product root group
	 * @param oImage the imported image
	 * @return the file name without extension
	 * @throws ParseException if REGION_NAME is present but not a string
	 */
	public static String defaultFilename(AttributeSource oGroup, Image oImage)
	   throws ParseException
	{
		String sRegion = oGroup.has("REGION_NAME") ? oGroup.getString("REGION_NAME").trim() : "unknown";
		return String.format("SAF_%s_%s_%04d%02d%02d_%02d%02d", sRegion, oImage.m_sName,
		   oImage.m_nYear, oImage.m_nMonth, oImage.m_nDay, oImage.m_nHour, oImage.m_nMinute);
	}


	/**
	 * Splits a yyyyMMddHHmm UTC time stamp. Characters after the minutes are
	 * ignored.
	 * @param sDatetime the time stamp
	 * @return year, month, day, hour and minute
	 * @throws ParseException if the time stamp is too short, not numeric or
	 * names an invalid date
	 */
	static int[] parseDatetime(String sDatetime)
	   throws ParseException
	{
		if (sDatetime == null || sDatetime.length() < 12)
			throw new ParseException(String.format("Unable to parse datetime %s", sDatetime), 0);
		return TimeUtil.parseFields("yyyyMMddHHmm", sDatetime);
	}


	/**
	 * Reads the sub-satellite longitude from a projection name such as
	 * GEOS(+000.0). The number starts at index 6, after the sign at index 5.
	 * @param sProj the projection name
	 * @return sub-satellite longitude in decimal degrees
	 * @throws ParseException if the name is too short or the longitude is not
	 * a number
	 */
	static double parseSubLon(String sProj)
	   throws ParseException
	{
		if (sProj == null || sProj.length() < 8)
			throw new ParseException(String.format("Projection name '%s' is too short to contain subsatellite longitude", sProj), 0);
		int nEnd = 6;
		while (nEnd < sProj.length() && (Character.isDigit(sProj.charAt(nEnd)) || sProj.charAt(nEnd) == '.'))
			++nEnd;
		if (nEnd == 6)
			throw new ParseException(String.format("Cannot read subsatellite longitude from projection name '%s'", sProj), 6);
		double dSubLon;
		try
		{
			dSubLon = Double.parseDouble(sProj.substring(6, nEnd));
		}
		catch (NumberFormatException oEx)
		{
			throw new ParseException(String.format("Cannot read subsatellite longitude from projection name '%s'", sProj), 6);
		}
		return sProj.charAt(5) == '-' ? -dSubLon : dSubLon;
	}


	/**
	 * Reads the samples and calibration of an image dataset into a buffer of
	 * the matching width.
	 * @param oDataset the dataset
	 * @param sName dataset name, for messages
	 * @return the image data
	 * @throws ParseException if the size or sample width is not supported
	 * @throws IOException if the samples cannot be read
	 */
	static ImageData readData(SampleSource oDataset, String sName)
	   throws ParseException, IOException
	{
		int nColumns = oDataset.getInt("N_COLS");
		int nLines = oDataset.getInt("N_LINES");
		if (nColumns <= 0 || nLines <= 0)
			throw new ParseException(String.format("Invalid image size %dx%d in %s", nColumns, nLines, sName), 0);
		long lDeclared = (long)nColumns * nLines;
		if (lDeclared != oDataset.getSampleCount())
			throw new ParseException(String.format("Image declares %d samples but has %d instead", lDeclared, oDataset.getSampleCount()), 0);
		// stored in single precision, the decimal string keeps 0.01 from becoming 0.009999999776
		double dSlope = Double.parseDouble(Float.toString(oDataset.getFloat("SCALING_FACTOR")));
		double dOffset = Double.parseDouble(Float.toString(oDataset.getFloat("OFFSET")));

		int nSampleSize = oDataset.getSampleSize();
		if (nSampleSize != 1 && nSampleSize != 2 && nSampleSize != 4)
			throw new ParseException(String.format("Unsupported sample data size %d in %s", nSampleSize, sName), 0);

		int[] nSamples = oDataset.readSamples();
		if (nSamples.length != lDeclared)
			throw new ParseException(String.format("Image declares %d samples but has %d instead", lDeclared, nSamples.length), 0);
		switch (nSampleSize)
		{
			case 1:
			{
				byte[] yPixels = new byte[nSamples.length];
				for (int nIndex = 0; nIndex < nSamples.length; nIndex++)
					yPixels[nIndex] = (byte)nSamples[nIndex];
				return new ByteImageData(nColumns, nLines, yPixels, dSlope, dOffset, ByteImageData.MISSING, true);
			}
			case 2:
			{
				short[] nPixels = new short[nSamples.length];
				for (int nIndex = 0; nIndex < nSamples.length; nIndex++)
					nPixels[nIndex] = (short)nSamples[nIndex];
				return new ShortImageData(nColumns, nLines, nPixels, dSlope, dOffset, ShortImageData.MISSING, true);
			}
			default:
			{
				// unsigned in the product, values from 2^31 only fit as the missing value
				for (int nIndex = 0; nIndex < nSamples.length; nIndex++)
				{
					if (nSamples[nIndex] < 0 && nSamples[nIndex] != UINT32_MISSING)
						throw new ParseException(String.format("Sample %d of %s is out of range: %d", nIndex, sName, Integer.toUnsignedLong(nSamples[nIndex])), 0);
				}
				return new IntImageData(nColumns, nLines, nSamples, dSlope, dOffset, UINT32_MISSING, true);
			}
		}
	}
}
