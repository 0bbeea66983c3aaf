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

import java.io.PrintStream;

/**
 * {@link ImageConsumer} that prints a human readable description of every
 * image it receives and, optionally, every pixel value.
 * @author Federal Highway Administration
 */
public class ImageDumper implements ImageConsumer
{
	private final PrintStream m_oOut;


	/**
	 * If true, the raw and calibrated value of each pixel is printed after the
	 * metadata
	 */
	private final boolean m_bWithContents;


	/**
	 * @param oOut stream to print to
	 * @param bWithContents true to also print the pixel values
	 */
	public ImageDumper(PrintStream oOut, boolean bWithContents)
	{
		m_oOut = oOut;
		m_bWithContents = bWithContents;
	}


	@Override
	public void processImage(Image oImage)
	{
		ImageData oData = oImage.m_oData;
		m_oOut.printf("Image %s %s%n", oImage.m_sName, oImage.datetime());
		m_oOut.printf(" proj: %s ch.id: %d sc.id: %d%n", oImage.m_oProj.format(), oImage.m_nChannelId, oImage.m_nSpacecraftId);
		m_oOut.printf(" size: %dx%d factor: %sx%s offset: %dx%d%n", oData.getColumns(), oData.getLines(),
		   oImage.m_dColumnRes, oImage.m_dLineRes, oImage.m_nColumnOffset, oImage.m_nLineOffset);
		m_oOut.printf(" bpp: %d slope: %s offset: %s decimal scale: %s%n", oData.getBpp(), oData.getSlope(), oData.getOffset(), formatDecimalScale(oData));
		m_oOut.printf(" pixel size: %.4f km DX: %.0f DY: %.0f%n", oImage.pixelSize(), oImage.seviriDX(), oImage.seviriDY());

		if (!m_bWithContents)
			return;

		m_oOut.println("Coord\tUnscaled\tScaled");
		for (int nY = 0; nY < oData.getLines(); nY++)
		{
			for (int nX = 0; nX < oData.getColumns(); nX++)
				m_oOut.printf("%d,%d\t%d\t%s%n", nX, nY, oData.unscaled(nX, nY), oData.scaled(nX, nY));
		}
	}


	private static String formatDecimalScale(ImageData oData)
	{
		try
		{
			return Integer.toString(oData.decimalScale());
		}
		catch (IllegalStateException oEx)
		{
			return "n/a"; // slope is not positive
		}
	}
}
