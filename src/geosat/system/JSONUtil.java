/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package geosat.system;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Helper methods for reading JSON configuration.
 * @author aaron.cherney
 */
public abstract class JSONUtil
{
	public static JSONArray optJSONArray(JSONObject oObj, String sKey)
	{
		JSONArray oRet = oObj.optJSONArray(sKey);
		if (oRet == null)
		{
			oRet = new JSONArray();
		}
		return oRet;
	}


	public static String[] getStringArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		String[] sRet = new String[oArr.length()];
		for (int nIndex = 0; nIndex < sRet.length; nIndex++)
			sRet[nIndex] = oArr.getString(nIndex);

		return sRet;
	}


	/**
	 * Parses the JSON object stored in the given file
	 * @param oFile path of the configuration file
	 * @return the parsed object
	 * @throws IOException if the file cannot be read
	 */
	public static JSONObject readObject(Path oFile)
	   throws IOException
	{
		try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
		{
			return new JSONObject(new JSONTokener(oIn));
		}
	}


	/**
	 * Parses the JSON object stored in the given classpath resource
	 * @param sResource absolute resource name, for example /geosat/collect/channels.json
	 * @return the parsed object
	 * @throws IOException if the resource does not exist or cannot be read
	 */
	public static JSONObject readResource(String sResource)
	   throws IOException
	{
		InputStream oStream = JSONUtil.class.getResourceAsStream(sResource);
		if (oStream == null)
			throw new IOException("Missing configuration resource " + sResource);
		try (BufferedReader oIn = new BufferedReader(new InputStreamReader(oStream, StandardCharsets.UTF_8)))
		{
			return new JSONObject(new JSONTokener(oIn));
		}
	}
}
