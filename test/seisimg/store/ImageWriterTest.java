package seisimg.store;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import seisimg.store.modes.QuantityKind;

import static org.junit.jupiter.api.Assertions.*;

public class ImageWriterTest
{
	@TempDir
	Path m_oDir;


	@Test
	public void demoImageHasDocumentedShape()
		throws ImageFormatException
	{
		Image oImage = DemoImage.create(QuantityKind.VELOCITY, 42L);

		assertEquals(1, oImage.getNumberOfPatches());
		assertEquals(Image.SINGLE, oImage.getPrecision());
		assertEquals(Image.PLANE_Y, oImage.m_nPlane);
		assertEquals("Z velocity", oImage.getQuantityName());
		Patch oPatch = oImage.getPatch(0);
		assertEquals(DemoImage.NI, oPatch.m_nNi);
		assertEquals(DemoImage.NJ, oPatch.m_nNj);
		assertEquals(DemoImage.H, oPatch.m_dH);
		assertArrayEquals(new double[]{-50.0, 9950.0, -50.0, 19950.0}, oPatch.getExtent(), 1e-9);
		assertTrue(oPatch.m_dMin >= -1.0);
		assertTrue(oPatch.m_dMax < 1.0);
		assertNotEquals(Long.MIN_VALUE, oImage.m_lCreationTime);
	}


	@Test
	public void demoImageIsReproducibleForSeed()
	{
		Patch oFirst = DemoImage.create(QuantityKind.DISPLACEMENT, 7L).getPatch(0);
		Patch oSecond = DemoImage.create(QuantityKind.DISPLACEMENT, 7L).getPatch(0);

		assertArrayEquals(oFirst.getData(), oSecond.getData());
	}


	@Test
	public void writtenImagesDecodeToSameContent()
		throws IOException
	{
		double[][] dStored = ImageBytes.grid(3, 4);
		Image oMap = new ImageReader(16, 1 << 20, ByteOrder.BIG_ENDIAN, ".sw4img").read(
			new ImageBytes().order(ByteOrder.BIG_ENDIAN).precision(Image.DOUBLE).plane(Image.PLANE_Z)
				.patch(20.0, -500.0, dStored).toStream(), null, QuantityKind.DISPLACEMENT, null);

		ByteArrayOutputStream oOut = new ByteArrayOutputStream();
		new ImageWriter(ByteOrder.BIG_ENDIAN).write(oMap, oOut);
		assertEquals(Image.HEADER_SIZE + Patch.HEADER_SIZE + 12 * Image.DOUBLE, oOut.size());

		Image oCopy = new ImageReader(16, 1 << 20, ByteOrder.BIG_ENDIAN, ".sw4img").read(
			new ByteArrayInputStream(oOut.toByteArray()), null, QuantityKind.DISPLACEMENT, null);
		assertEquals(oMap.m_nPlane, oCopy.m_nPlane);
		assertEquals(oMap.m_dTime, oCopy.m_dTime);
		assertEquals(oMap.m_sCreationTime, oCopy.m_sCreationTime);
		assertEquals(-500.0, oCopy.getPatch(0).m_dZmin);
		assertArrayEquals(oMap.getPatch(0).getData(), oCopy.getPatch(0).getData());
	}


	@Test
	public void demoFileCanBeReadBack()
		throws IOException
	{
		Path oFile = m_oDir.resolve("demo.sw4img");
		Image oDemo = DemoImage.create(QuantityKind.DISPLACEMENT, 1L);
		new ImageWriter().write(oDemo, oFile);

		Image oRead = new ImageReader(16, 1 << 20, ByteOrder.LITTLE_ENDIAN, ".sw4img").read(oFile, QuantityKind.DISPLACEMENT, null);
		assertEquals(oFile.toString(), oRead.m_sFilename);
		assertEquals(oDemo.getPatch(0).m_dRms, oRead.getPatch(0).m_dRms);
	}


	@Test
	public void creationTimeTextMatchesSimulatorFormat()
	{
		assertEquals("Mon Jun 15 10:22:33 2015", ImageWriter.formatCreationTime(1434363753000L));
	}
}
