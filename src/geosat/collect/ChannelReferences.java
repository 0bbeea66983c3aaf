/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package geosat.collect;

import geosat.system.JSONUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Read-only table of {@link ChannelReference}s keyed by product name. The
 * table is loaded from a JSON object of the form
 * <pre>
 * {"channels": [{"name": "CTTH_HEIGHT", "channel": 1007, "slope": 200, "offset": -2000, "bpp": 7, "aliases": ["CTTH_HEIGHT_"]}]}
 * </pre>
 * where aliases are optional extra names for the same entry.
 * @author aaron.cherney
 */
public class ChannelReferences
{
	private static final Logger LOGGER = LogManager.getLogger(ChannelReferences.class);


	/**
	 * Classpath location of the table shipped with the library
	 */
	public static final String DEFAULT_RESOURCE = "/geosat/collect/channels.json";


	private final Map<String, ChannelReference> m_oChannels;


	/**
	 * Builds the table from the given configuration object
	 * @param oConfig JSON object holding the "channels" array
	 * @throws org.json.JSONException if an entry is malformed
	 */
	public ChannelReferences(JSONObject oConfig)
	{
		HashMap<String, ChannelReference> oChannels = new HashMap<>();
		JSONArray oEntries = JSONUtil.optJSONArray(oConfig, "channels");
		for (int nIndex = 0; nIndex < oEntries.length(); nIndex++)
		{
			JSONObject oEntry = oEntries.getJSONObject(nIndex);
			ChannelReference oRef = new ChannelReference(oEntry);
			if (oChannels.put(oRef.m_sName, oRef) != null)
				LOGGER.warn("Duplicate channel reference " + oRef.m_sName);
			for (String sAlias : JSONUtil.getStringArray(oEntry, "aliases"))
				oChannels.put(sAlias, oRef);
		}
		m_oChannels = Collections.unmodifiableMap(oChannels);
		LOGGER.info(String.format("Loaded %d channel references", oEntries.length()));
	}


	/**
	 * Loads the table from a file
	 * @param oFile path of the JSON file
	 * @return the loaded table
	 * @throws IOException if the file cannot be read
	 */
	public static ChannelReferences load(Path oFile)
	   throws IOException
	{
		LOGGER.debug("Loading channel references from " + oFile);
		return new ChannelReferences(JSONUtil.readObject(oFile));
	}


	/**
	 * Loads the table shipped with the library
	 * @return the loaded table
	 * @throws IOException if the resource cannot be read
	 */
	public static ChannelReferences loadDefault()
	   throws IOException
	{
		return new ChannelReferences(JSONUtil.readResource(DEFAULT_RESOURCE));
	}


	/**
	 * @param sName product name
	 * @return the reference for the product, or null if it is unknown
	 */
	public ChannelReference get(String sName)
	{
		return m_oChannels.get(sName);
	}


	/**
	 * @return number of names, aliases included, in the table
	 */
	public int size()
	{
		return m_oChannels.size();
	}
}
