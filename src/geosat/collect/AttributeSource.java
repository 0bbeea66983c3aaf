package geosat.collect;

import java.text.ParseException;

/**
 * Read-only view of the named attributes attached to a node of a product
 * file, such as the root group or one dataset of an HDF5 file.
 * @author aaron.cherney
 */
public interface AttributeSource
{
	/**
	 * @param sName attribute name
	 * @return true if the attribute exists
	 */
	public boolean has(String sName);


	/**
	 * @param sName attribute name
	 * @return the attribute value as a string
	 * @throws ParseException if the attribute is missing or is not a string
	 */
	public String getString(String sName) throws ParseException;


	/**
	 * @param sName attribute name
	 * @return the attribute value as an integer
	 * @throws ParseException if the attribute is missing or is not an integer
	 */
	public int getInt(String sName) throws ParseException;


	/**
	 * @param sName attribute name
	 * @return the attribute value as a float
	 * @throws ParseException if the attribute is missing or is not numeric
	 */
	public float getFloat(String sName) throws ParseException;
}
