package geosat.system;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.json.JSONObject;
import junit.framework.TestCase;

public class JSONUtilTest extends TestCase
{
	public void testOptionalArrays()
	{
		JSONObject oObj = new JSONObject("{\"names\": [\"a\", \"b\"]}");
		String[] sNames = JSONUtil.getStringArray(oObj, "names");
		assertEquals(2, sNames.length);
		assertEquals("b", sNames[1]);
		assertEquals(0, JSONUtil.getStringArray(oObj, "missing").length);
		assertEquals(0, JSONUtil.optJSONArray(oObj, "missing").length());
	}


	public void testReadObject()
	   throws IOException
	{
		Path oFile = Files.createTempFile("geosat", ".json");
		try
		{
			Files.write(oFile, "{\"value\": 3}".getBytes(StandardCharsets.UTF_8));
			assertEquals(3, JSONUtil.readObject(oFile).getInt("value"));
		}
		finally
		{
			Files.delete(oFile);
		}
	}


	public void testMissingResource()
	{
		try
		{
			JSONUtil.readResource("/geosat/does-not-exist.json");
			fail("missing resource loaded");
		}
		catch (IOException oEx)
		{
			assertTrue(oEx.getMessage().contains("does-not-exist"));
		}
	}
}
