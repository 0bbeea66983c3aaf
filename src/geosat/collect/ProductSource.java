package geosat.collect;

import java.io.IOException;
import java.util.List;

/**
 * A product file: the attributes of its root group and the datasets it
 * contains.
 * @author aaron.cherney
 */
public interface ProductSource extends AttributeSource
{
	/**
	 * @return names of the datasets in storage order
	 */
	public List<String> getDatasetNames();


	/**
	 * @param sName dataset name
	 * @return the dataset
	 * @throws IOException if the dataset does not exist or cannot be opened
	 */
	public SampleSource getDataset(String sName) throws IOException;
}
