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

/**
 * An ImageData for images with samples that fit in an unsigned 16 bit value.
 * @author Federal Highway Administration
 */
public class ShortImageData extends ImageData
{
	/**
	 * Default raw value for missing data
	 */
	public static final int MISSING = 0xffff;


	/**
	 * Row-major grid of samples, read as unsigned
	 */
	private final short[] m_nPixels;


	/**
	 * Wrapper for {@link ShortImageData#ShortImageData(int, int, short[], double, double, int, boolean)}
	 * using {@link #MISSING} for missing data and continuous calibrated values
	 */
	public ShortImageData(int nColumns, int nLines, short[] nPixels, double dSlope, double dOffset)
	{
		this(nColumns, nLines, nPixels, dSlope, dOffset, MISSING, false);
	}


	/**
	 * Constructs a new ShortImageData that takes ownership of the given samples
	 * @param nColumns number of columns
	 * @param nLines number of lines
	 * @param nPixels row-major samples, the array is not copied
	 * @param dSlope calibration slope
	 * @param dOffset calibration offset
	 * @param nMissing raw value used for missing data
	 * @param bScalesToInt true if calibrated values are integer codes
	 */
	public ShortImageData(int nColumns, int nLines, short[] nPixels, double dSlope, double dOffset, int nMissing, boolean bScalesToInt)
	{
		super(nColumns, nLines, nPixels.length, dSlope, dOffset, nMissing, bScalesToInt);
		m_nPixels = nPixels;
		computeBpp();
	}


	@Override
	protected int sample(int nIndex)
	{
		return m_nPixels[nIndex] & 0xffff;
	}


	@Override
	protected ImageData newCrop(int nX, int nY, int nWidth, int nHeight)
	{
		short[] nCrop = new short[nWidth * nHeight];
		for (int nLine = 0; nLine < nHeight; nLine++)
			System.arraycopy(m_nPixels, (nY + nLine) * m_nColumns + nX, nCrop, nLine * nWidth, nWidth);
		return new ShortImageData(nWidth, nHeight, nCrop, m_dSlope, m_dOffset, m_nMissing, m_bScalesToInt);
	}
}
