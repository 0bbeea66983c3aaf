package geosat.collect;

import java.io.IOException;
import java.text.ParseException;
import java.util.HashMap;

/**
 * In-memory dataset for importer tests.
 */
class MemoryDataset implements SampleSource
{
	final HashMap<String, Object> m_oAttrs = new HashMap<>();

	int m_nSampleSize = 1;

	int[] m_nSamples = new int[0];


	MemoryDataset set(String sName, Object oValue)
	{
		m_oAttrs.put(sName, oValue);
		return this;
	}


	MemoryDataset samples(int nSampleSize, int... nSamples)
	{
		m_nSampleSize = nSampleSize;
		m_nSamples = nSamples;
		return this;
	}


	@Override
	public boolean has(String sName)
	{
		return m_oAttrs.containsKey(sName);
	}


	@Override
	public String getString(String sName) throws ParseException
	{
		Object oVal = get(sName);
		if (!(oVal instanceof String))
			throw new ParseException(sName + " is not a string", 0);
		return (String)oVal;
	}


	@Override
	public int getInt(String sName) throws ParseException
	{
		Object oVal = get(sName);
		if (!(oVal instanceof Integer))
			throw new ParseException(sName + " is not an integer", 0);
		return (Integer)oVal;
	}


	@Override
	public float getFloat(String sName) throws ParseException
	{
		Object oVal = get(sName);
		if (!(oVal instanceof Number))
			throw new ParseException(sName + " is not numeric", 0);
		return ((Number)oVal).floatValue();
	}


	private Object get(String sName) throws ParseException
	{
		Object oVal = m_oAttrs.get(sName);
		if (oVal == null)
			throw new ParseException("Missing attribute " + sName, 0);
		return oVal;
	}


	@Override
	public int getSampleSize()
	{
		return m_nSampleSize;
	}


	@Override
	public long getSampleCount()
	{
		return m_nSamples.length;
	}


	@Override
	public int[] readSamples() throws IOException
	{
		return m_nSamples.clone();
	}
}
