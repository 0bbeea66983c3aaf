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

import java.math.BigDecimal;

/**
 * Base class for the raw samples of an image together with the linear
 * calibration that converts them to physical values
 * ({@code value = raw * slope + offset}). Child classes store the samples in
 * the narrowest primitive array that holds them. The sample array is handed
 * over by the producer at construction and is never exposed afterwards.
 * @author Federal Highway Administration
 */
abstract public class ImageData
{
	/**
	 * Number of columns (x values) in the grid
	 */
	protected final int m_nColumns;


	/**
	 * Number of lines (y values) in the grid
	 */
	protected final int m_nLines;


	/**
	 * Multiplier of the linear calibration
	 */
	protected final double m_dSlope;


	/**
	 * Additive term of the linear calibration
	 */
	protected final double m_dOffset;


	/**
	 * Raw value meaning that there is no data for the pixel
	 */
	protected final int m_nMissing;


	/**
	 * Flag indicating if the calibrated values are to be interpreted as
	 * integers (for example classification codes) instead of continuous values
	 */
	protected final boolean m_bScalesToInt;


	/**
	 * Number of bits needed to store the largest sample, set by
	 * {@link #computeBpp()}
	 */
	private int m_nBpp;


	/**
	 * Validates the dimensions against the number of samples and stores the
	 * calibration parameters.
	 * @param nColumns number of columns
	 * @param nLines number of lines
	 * @param nSamples length of the sample array
	 * @param dSlope calibration slope
	 * @param dOffset calibration offset
	 * @param nMissing raw value used for missing data
	 * @param bScalesToInt true if calibrated values are integer codes
	 */
	protected ImageData(int nColumns, int nLines, int nSamples, double dSlope, double dOffset, int nMissing, boolean bScalesToInt)
	{
		if (nColumns <= 0 || nLines <= 0)
			throw new IllegalArgumentException(String.format("Invalid image size %dx%d", nColumns, nLines));
		if ((long)nColumns * nLines != nSamples)
			throw new IllegalArgumentException(String.format("Image declares %d samples but has %d instead", (long)nColumns * nLines, nSamples));
		m_nColumns = nColumns;
		m_nLines = nLines;
		m_dSlope = dSlope;
		m_dOffset = dOffset;
		m_nMissing = nMissing;
		m_bScalesToInt = bScalesToInt;
	}


	/**
	 * Gets the raw sample stored at the given index of the row-major grid
	 * @param nIndex line * columns + column
	 * @return the raw sample
	 */
	protected abstract int sample(int nIndex);


	/**
	 * Creates a buffer of the same sample type holding the given
	 * sub-rectangle. Bounds are already checked by {@link #crop(int, int, int, int)}
	 * @param nX first column
	 * @param nY first line
	 * @param nWidth number of columns
	 * @param nHeight number of lines
	 * @return the new buffer
	 */
	protected abstract ImageData newCrop(int nX, int nY, int nWidth, int nHeight);


	/**
	 * Derives {@link #m_nBpp} from the largest sample, ceil(log2(max + 1)), so
	 * every stored sample fits in bpp bits. Child classes call this once their
	 * samples are stored.
	 */
	protected final void computeBpp()
	{
		int nMax = 0;
		int nCount = m_nColumns * m_nLines;
		for (int nIndex = 0; nIndex < nCount; nIndex++)
		{
			int nVal = sample(nIndex);
			if (nVal > nMax)
				nMax = nVal;
		}
		m_nBpp = 32 - Integer.numberOfLeadingZeros(nMax);
	}


	/**
	 * Gets the raw sample at the given column and line
	 * @param nX column
	 * @param nY line
	 * @return the raw sample
	 * @throws IndexOutOfBoundsException if the coordinates are outside of the
	 * grid
	 */
	public int unscaled(int nX, int nY)
	{
		if (nX < 0 || nX >= m_nColumns || nY < 0 || nY >= m_nLines)
			throw new IndexOutOfBoundsException(String.format("Pixel %d,%d is outside of the %dx%d image", nX, nY, m_nColumns, m_nLines));
		return sample(nY * m_nColumns + nX);
	}


	/**
	 * Gets the calibrated value at the given column and line
	 * @param nX column
	 * @param nY line
	 * @return raw * slope + offset, or {@code Float.NaN} if the pixel has no data
	 * @throws IndexOutOfBoundsException if the coordinates are outside of the
	 * grid
	 */
	public float scaled(int nX, int nY)
	{
		return scale(unscaled(nX, nY));
	}


	/**
	 * Applies the calibration to a raw value
	 * @param nRaw raw sample
	 * @return the calibrated value or {@code Float.NaN} for the missing value
	 */
	public float scale(int nRaw)
	{
		if (nRaw == m_nMissing)
			return Float.NaN;
		return (float)(nRaw * m_dSlope + m_dOffset);
	}


	/**
	 * @return a new row-major array with every raw sample
	 */
	public int[] allUnscaled()
	{
		int[] nRet = new int[m_nColumns * m_nLines];
		for (int nIndex = 0; nIndex < nRet.length; nIndex++)
			nRet[nIndex] = sample(nIndex);
		return nRet;
	}


	/**
	 * @return a new row-major array with every calibrated value
	 */
	public float[] allScaled()
	{
		float[] fRet = new float[m_nColumns * m_nLines];
		for (int nIndex = 0; nIndex < fRet.length; nIndex++)
			fRet[nIndex] = scale(sample(nIndex));
		return fRet;
	}


	/**
	 * Gets the number of decimal digits needed to represent calibrated values.
	 * With k = -floor(log10(slope)), returns k when the slope is a whole
	 * multiple of 10^-k (0.01 gives 2, 0.003 gives 3) and k + 1 otherwise
	 * (0.25 gives 2).
	 * @return number of decimal digits
	 * @throws IllegalStateException if the slope is not positive
	 */
	public int decimalScale()
	{
		if (!(m_dSlope > 0.0) || Double.isInfinite(m_dSlope))
			throw new IllegalStateException(String.format("Cannot compute decimal scale of slope %s", m_dSlope));
		BigDecimal oSlope = BigDecimal.valueOf(m_dSlope).stripTrailingZeros();
		int nK = oSlope.scale() - oSlope.precision() + 1; // -floor(log10(slope))
		if (oSlope.scale() <= nK)
			return nK;
		return nK + 1;
	}


	/**
	 * Copies the given sub-rectangle into a new buffer with the same
	 * calibration
	 * @param nX first column
	 * @param nY first line
	 * @param nWidth number of columns
	 * @param nHeight number of lines
	 * @return the cropped buffer
	 * @throws IndexOutOfBoundsException if the rectangle does not fit in the
	 * grid
	 */
	public ImageData crop(int nX, int nY, int nWidth, int nHeight)
	{
		if (nX < 0 || nY < 0 || nWidth <= 0 || nHeight <= 0 || nX + nWidth > m_nColumns || nY + nHeight > m_nLines)
			throw new IndexOutOfBoundsException(String.format("Crop area %d,%d %dx%d is outside of the %dx%d image", nX, nY, nWidth, nHeight, m_nColumns, m_nLines));
		return newCrop(nX, nY, nWidth, nHeight);
	}


	public int getColumns()
	{
		return m_nColumns;
	}


	public int getLines()
	{
		return m_nLines;
	}


	public double getSlope()
	{
		return m_dSlope;
	}


	public double getOffset()
	{
		return m_dOffset;
	}


	public int getMissing()
	{
		return m_nMissing;
	}


	public int getBpp()
	{
		return m_nBpp;
	}


	public boolean scalesToInt()
	{
		return m_bScalesToInt;
	}
}
