package geosat.collect;

import java.io.IOException;

/**
 * A dataset of a product file: its attributes plus the raw samples.
 * @author aaron.cherney
 */
public interface SampleSource extends AttributeSource
{
	/**
	 * @return size in bytes of one stored sample
	 */
	public int getSampleSize();


	/**
	 * @return total number of samples stored in the dataset
	 */
	public long getSampleCount();


	/**
	 * Reads every sample in row-major order. Samples of 1 and 2 bytes are
	 * returned unsigned, samples of 4 bytes keep their 32 bit pattern.
	 * @return the raw samples
	 * @throws IOException if the samples cannot be read
	 */
	public int[] readSamples() throws IOException;
}
