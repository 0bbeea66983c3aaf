/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package geosat.collect;

import geosat.store.ImageData;
import java.util.ArrayList;
import java.util.List;
import org.json.JSONObject;

/**
 * Usual calibration and bit depth of one SAF product, used to detect images
 * whose conversion may not be reversible.
 * @author aaron.cherney
 */
public class ChannelReference
{
	/**
	 * Product (dataset) name, for example CTTH_HEIGHT
	 */
	public final String m_sName;


	/**
	 * Channel id assigned to the product
	 */
	public final int m_nChannel;


	public final double m_dSlope;


	public final double m_dOffset;


	/**
	 * Largest number of bits per pixel the product normally uses
	 */
	public final int m_nBpp;


	/**
	 * Constructs a ChannelReference with the given values
	 * @param sName product name
	 * @param nChannel channel id
	 * @param dSlope usual calibration slope
	 * @param dOffset usual calibration offset
	 * @param nBpp usual bits per pixel
	 */
	public ChannelReference(String sName, int nChannel, double dSlope, double dOffset, int nBpp)
	{
		m_sName = sName;
		m_nChannel = nChannel;
		m_dSlope = dSlope;
		m_dOffset = dOffset;
		m_nBpp = nBpp;
	}


	/**
	 * Constructs a ChannelReference from an entry of the channel table
	 * @param oEntry JSON object with keys name, channel, slope, offset and bpp
	 * @throws org.json.JSONException if a key is missing or has the wrong type
	 */
	public ChannelReference(JSONObject oEntry)
	{
		this(oEntry.getString("name"), oEntry.getInt("channel"), oEntry.getDouble("slope"),
		   oEntry.getDouble("offset"), oEntry.getInt("bpp"));
	}


	/**
	 * Compares the calibration and bit depth of the given image data with the
	 * usual ones. Slope and offset are compared in single precision since that
	 * is how SAF products store them.
	 * @param oData the image data to check
	 * @return one message per difference, empty if the data is consistent
	 */
	public List<String> check(ImageData oData)
	{
		ArrayList<String> oWarnings = new ArrayList<>(3);
		if ((float)oData.getSlope() != (float)m_dSlope)
			oWarnings.add(String.format("slope for image (%s) is different from the usual one (%s)", oData.getSlope(), m_dSlope));
		if ((float)oData.getOffset() != (float)m_dOffset)
			oWarnings.add(String.format("offset for image (%s) is different from the usual one (%s)", oData.getOffset(), m_dOffset));
		if (oData.getBpp() > m_nBpp)
			oWarnings.add(String.format("bpp for image (%d) is more than the usual one (%d)", oData.getBpp(), m_nBpp));
		return oWarnings;
	}


	@Override
	public String toString()
	{
		return String.format("%s channel %d slope %s offset %s bpp %d", m_sName, m_nChannel, m_dSlope, m_dOffset, m_nBpp);
	}
}
