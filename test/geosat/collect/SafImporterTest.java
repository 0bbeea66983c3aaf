package geosat.collect;

import geosat.store.ByteImageData;
import geosat.store.Image;
import geosat.store.IntImageData;
import geosat.store.ShortImageData;
import java.io.IOException;
import java.text.ParseException;
import java.util.ArrayList;
import junit.framework.TestCase;

public class SafImporterTest extends TestCase
{
	private SafImporter m_oImporter;


	@Override
	protected void setUp()
	   throws Exception
	{
		m_oImporter = new SafImporter(ChannelReferences.loadDefault());
	}


	public void testImportImage()
	   throws ParseException, IOException
	{
		MemoryProduct oProduct = MemoryProduct.seviri();
		Image oImage = m_oImporter.importImage(oProduct, MemoryProduct.image(200.0f, -2000.0f), "CTTH_HEIGHT");

		assertEquals("CTTH_HEIGHT", oImage.m_sName);
		assertEquals("2004-01-19 12:00", oImage.datetime());
		assertEquals(127828800L, oImage.seconds2000());
		assertEquals(1009, oImage.m_nChannelId);
		assertEquals(Spacecraft.MSG1, oImage.m_nSpacecraftId);
		assertEquals(0.0, oImage.m_oProj.getSubLon(), 0.0);
		assertEquals(208.16554260253906, oImage.m_dColumnRes, 1e-9);
		assertEquals(208.16554260253906, oImage.m_dLineRes, 1e-9);
		assertEquals(1856, oImage.m_nColumnOffset);
		assertEquals(1856, oImage.m_nLineOffset);
		assertEquals(1850, oImage.m_nX0);
		assertEquals(1850, oImage.m_nY0);
		assertEquals(SafImporter.UNIT, oImage.m_sUnit);

		assertTrue(oImage.m_oData instanceof ByteImageData);
		assertTrue(oImage.m_oData.scalesToInt());
		assertEquals(4, oImage.m_oData.getColumns());
		assertEquals(3, oImage.m_oData.getLines());
		assertEquals(4, oImage.m_oData.getBpp());
		assertEquals(6, oImage.m_oData.unscaled(2, 1));
		assertEquals(-800.0f, oImage.m_oData.scaled(2, 1), 0.0f);
	}


	public void testSinglePrecisionCalibration()
	   throws ParseException, IOException
	{
		Image oImage = m_oImporter.importImage(MemoryProduct.seviri(), MemoryProduct.image(0.01f, 0.0f), "CT");
		assertEquals(0.01, oImage.m_oData.getSlope(), 0.0);
		assertEquals(2, oImage.m_oData.decimalScale());
	}


	public void testUnknownChannelKeepsSpectralChannel()
	   throws ParseException, IOException
	{
		MemoryProduct oProduct = MemoryProduct.seviri();
		oProduct.set("SPECTRAL_CHANNEL_ID", 42).set("GP_SC_ID", 999);
		Image oImage = m_oImporter.importImage(oProduct, MemoryProduct.image(1.0f, 0.0f), "MYSTERY");
		assertEquals(42, oImage.m_nChannelId);
		assertEquals(999, oImage.m_nSpacecraftId);
	}


	public void testSampleSizes()
	   throws ParseException, IOException
	{
		MemoryDataset oDataset = MemoryProduct.image(1.0f, 0.0f).samples(2, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 40000);
		Image oImage = m_oImporter.importImage(MemoryProduct.seviri(), oDataset, "CT");
		assertTrue(oImage.m_oData instanceof ShortImageData);
		assertEquals(40000, oImage.m_oData.unscaled(3, 2));
		assertEquals(16, oImage.m_oData.getBpp());

		oDataset.samples(4, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 70000);
		oImage = m_oImporter.importImage(MemoryProduct.seviri(), oDataset, "CT");
		assertTrue(oImage.m_oData instanceof IntImageData);
		assertEquals(70000, oImage.m_oData.unscaled(3, 2));

		oDataset.samples(4, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 0xffffffff);
		oImage = m_oImporter.importImage(MemoryProduct.seviri(), oDataset, "CT");
		assertEquals(SafImporter.UINT32_MISSING, oImage.m_oData.getMissing());
		assertTrue(Float.isNaN(oImage.m_oData.scaled(3, 2)));
		assertEquals(4, oImage.m_oData.getBpp());

		oDataset.samples(4, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 0x80000000);
		assertMalformed(MemoryProduct.seviri(), oDataset);

		oDataset.samples(3, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
		assertMalformed(MemoryProduct.seviri(), oDataset);
	}


	public void testSampleCountMismatch()
	{
		assertMalformed(MemoryProduct.seviri(), MemoryProduct.image(1.0f, 0.0f).samples(1, 0, 1, 2));
		assertMalformed(MemoryProduct.seviri(), MemoryProduct.image(1.0f, 0.0f).set("N_COLS", 0));
	}


	public void testMalformedGroup()
	{
		MemoryProduct oProduct = MemoryProduct.seviri();
		oProduct.set("IMAGE_ACQUISITION_TIME", "2004011912");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));

		oProduct = MemoryProduct.seviri();
		oProduct.set("IMAGE_ACQUISITION_TIME", "2004O1191200");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));

		oProduct = MemoryProduct.seviri();
		oProduct.set("IMAGE_ACQUISITION_TIME", "200413191200");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));

		oProduct = MemoryProduct.seviri();
		oProduct.set("IMAGE_ACQUISITION_TIME", "200302291200");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));

		oProduct = MemoryProduct.seviri();
		oProduct.set("IMAGE_ACQUISITION_TIME", "200401192400");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));

		oProduct = MemoryProduct.seviri();
		oProduct.set("PROJECTION_NAME", "GEOS");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));

		oProduct = MemoryProduct.seviri();
		oProduct.m_oAttrs.remove("CFAC");
		assertMalformed(oProduct, MemoryProduct.image(1.0f, 0.0f));
	}


	public void testParseDatetime()
	   throws ParseException
	{
		int[] nTime = SafImporter.parseDatetime("200401191230Z");
		assertEquals(2004, nTime[0]);
		assertEquals(1, nTime[1]);
		assertEquals(19, nTime[2]);
		assertEquals(12, nTime[3]);
		assertEquals(30, nTime[4]);
	}


	public void testParseSubLon()
	   throws ParseException
	{
		assertEquals(0.0, SafImporter.parseSubLon("GEOS(+000.0)"), 0.0);
		assertEquals(9.5, SafImporter.parseSubLon("GEOS(+009.5)"), 0.0);
		assertEquals(-9.5, SafImporter.parseSubLon("GEOS(-009.5)"), 0.0);
		assertEquals(145.0, SafImporter.parseSubLon("GEOS<+145.0>"), 0.0);
		try
		{
			SafImporter.parseSubLon("GEOS(+abc)");
			fail("non numeric longitude accepted");
		}
		catch (ParseException oEx)
		{
			assertEquals(6, oEx.getErrorOffset());
		}
	}


	public void testReadAllImages()
	   throws ParseException, IOException
	{
		MemoryProduct oProduct = MemoryProduct.seviri();
		oProduct.add("CT", MemoryProduct.image(1.0f, 0.0f))
		   .add("01-PALETTE", new MemoryDataset().set("CLASS", "PALETTE"))
		   .add("CTTH_HEIGHT", MemoryProduct.image(200.0f, -2000.0f));

		ArrayList<Image> oImages = new ArrayList<>();
		m_oImporter.read(oProduct, null, oImages::add);
		assertEquals(2, oImages.size());
		assertEquals("CT", oImages.get(0).m_sName);
		assertEquals("CTTH_HEIGHT", oImages.get(1).m_sName);

		oImages.clear();
		m_oImporter.read(oProduct, "CTTH_HEIGHT", oImages::add);
		assertEquals(1, oImages.size());
		assertEquals(1009, oImages.get(0).m_nChannelId);

		try
		{
			m_oImporter.read(oProduct, "01-PALETTE", oImages::add);
			fail("palette imported as an image");
		}
		catch (ParseException oEx)
		{
			assertTrue(oEx.getMessage().contains("01-PALETTE"));
		}
	}


	public void testReadCropsImages()
	   throws ParseException, IOException
	{
		MemoryProduct oProduct = MemoryProduct.seviri();
		oProduct.add("CT", MemoryProduct.image(1.0f, 0.0f))
		   .add("CTTH_HEIGHT", MemoryProduct.image(200.0f, -2000.0f));

		SafImporter oImporter = new SafImporter(ChannelReferences.loadDefault(), 1, 1, 2, 2);
		ArrayList<Image> oImages = new ArrayList<>();
		oImporter.read(oProduct, null, oImages::add);
		assertEquals(2, oImages.size());
		for (Image oImage : oImages)
		{
			assertEquals(2, oImage.m_oData.getColumns());
			assertEquals(2, oImage.m_oData.getLines());
			assertEquals(1851, oImage.m_nX0);
			assertEquals(1851, oImage.m_nY0);
			// sample 5 is at column 1, line 1 of the 4x3 dataset
			assertEquals(5, oImage.m_oData.unscaled(0, 0));
			assertEquals(10, oImage.m_oData.unscaled(1, 1));
		}

		Image oWhole = m_oImporter.importImage(oProduct, MemoryProduct.image(1.0f, 0.0f), "CT");
		assertEquals(oWhole.pixelToMap(1, 1).m_dLon, oImages.get(0).pixelToMap(0, 0).m_dLon, 1e-12);

		oImporter = new SafImporter(ChannelReferences.loadDefault(), 3, 0, 2, 1);
		try
		{
			oImporter.read(oProduct, "CT", oImages::add);
			fail("crop area outside of the image accepted");
		}
		catch (IndexOutOfBoundsException oEx)
		{
			assertNotNull(oEx.getMessage());
		}
	}


	public void testInvalidCropArea()
	   throws IOException
	{
		try
		{
			new SafImporter(ChannelReferences.loadDefault(), 0, 0, 0, 5);
			fail("empty crop area accepted");
		}
		catch (IllegalArgumentException oEx)
		{
			assertNotNull(oEx.getMessage());
		}
	}


	public void testDefaultFilename()
	   throws ParseException, IOException
	{
		MemoryProduct oProduct = MemoryProduct.seviri();
		Image oImage = m_oImporter.importImage(oProduct, MemoryProduct.image(1.0f, 0.0f), "CT");
		assertEquals("SAF_MSG-N_CT_20040119_1200", SafImporter.defaultFilename(oProduct, oImage));
		oProduct.m_oAttrs.remove("REGION_NAME");
		assertEquals("SAF_unknown_CT_20040119_1200", SafImporter.defaultFilename(oProduct, oImage));
	}


	private void assertMalformed(MemoryProduct oProduct, MemoryDataset oDataset)
	{
		try
		{
			m_oImporter.importImage(oProduct, oDataset, "CT");
			fail("malformed product imported");
		}
		catch (ParseException oEx)
		{
			assertNotNull(oEx.getMessage());
		}
		catch (IOException oEx)
		{
			fail(oEx.getMessage());
		}
	}
}
