package seisimg.store;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.SimpleDateFormat;
import java.util.Locale;
import java.util.SimpleTimeZone;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes images in the simulation image file format. Used to create demo
 * files and to store images built in memory.
 */
public class ImageWriter
{
	private static final Logger LOGGER = LogManager.getLogger(ImageWriter.class);


	private final ByteOrder m_oOrder;


	public ImageWriter(ByteOrder oOrder)
	{
		m_oOrder = oOrder;
	}


	public ImageWriter()
	{
		this(ByteOrder.LITTLE_ENDIAN);
	}


	/**
	 * Writes the image to a file, replacing it if it exists
	 * @param oImage image to write
	 * @param oFile destination
	 * @throws IOException
	 */
	public void write(Image oImage, Path oFile)
		throws IOException
	{
		try (OutputStream oOut = new BufferedOutputStream(Files.newOutputStream(oFile)))
		{
			write(oImage, oOut);
		}
		LOGGER.debug(String.format("Wrote %s", oFile));
	}


	/**
	 * Writes the header, patch headers and sample blocks of the image. Patches
	 * are written in their stored orientation, so maps are transposed back.
	 *
	 * @param oImage image to write
	 * @param oOut destination, not closed
	 * @throws IOException
	 */
	public void write(Image oImage, OutputStream oOut)
		throws IOException
	{
		writeHeader(oOut, oImage.m_nPrecision, oImage.getNumberOfPatches(), oImage.m_dTime, oImage.m_nPlane,
			oImage.m_dCoordinate, oImage.m_nMode, oImage.m_nGridInfo, oImage.m_sCreationTime);
		for (Patch oPatch : oImage.getPatches())
			writePatchHeader(oOut, oPatch.m_dH, oPatch.m_dZmin, oPatch.m_nIb, oPatch.m_nNi, oPatch.m_nJb, oPatch.m_nNj);

		for (Patch oPatch : oImage.getPatches())
		{
			double[][] dStored = new double[oPatch.m_nNj][oPatch.m_nNi];
			for (int nJ = 0; nJ < oPatch.m_nNj; nJ++)
			{
				for (int nI = 0; nI < oPatch.m_nNi; nI++)
					dStored[nJ][nI] = oImage.isCrossSection() ? oPatch.getValue(nJ, nI) : oPatch.getValue(nI, nJ);
			}
			writeSamples(oOut, oImage.m_nPrecision, dStored);
		}
	}


	/**
	 * Writes an image header record
	 * @param oOut destination
	 * @param nPrecision precision code
	 * @param nPatchCount number of patches
	 * @param dTime simulation time
	 * @param nPlane plane code
	 * @param dCoordinate constant coordinate
	 * @param nMode mode code
	 * @param nGridInfo grid information flag
	 * @param sCreationTime creation time text, truncated or NUL padded to 25
	 * characters
	 * @throws IOException
	 */
	public void writeHeader(OutputStream oOut, int nPrecision, int nPatchCount, double dTime, int nPlane,
		double dCoordinate, int nMode, int nGridInfo, String sCreationTime)
		throws IOException
	{
		ByteBuffer oBuf = ByteBuffer.allocate(Image.HEADER_SIZE).order(m_oOrder);
		oBuf.putInt(nPrecision).putInt(nPatchCount).putDouble(dTime).putInt(nPlane)
			.putDouble(dCoordinate).putInt(nMode).putInt(nGridInfo);
		byte[] yText = sCreationTime.getBytes(StandardCharsets.US_ASCII);
		oBuf.put(yText, 0, Math.min(yText.length, Image.CREATION_TIME_LENGTH));
		oOut.write(oBuf.array());
	}


	/**
	 * Writes a patch header record
	 * @throws IOException
	 */
	public void writePatchHeader(OutputStream oOut, double dH, double dZmin, int nIb, int nNi, int nJb, int nNj)
		throws IOException
	{
		ByteBuffer oBuf = ByteBuffer.allocate(Patch.HEADER_SIZE).order(m_oOrder);
		oBuf.putDouble(dH).putDouble(dZmin).putInt(nIb).putInt(nNi).putInt(nJb).putInt(nNj);
		oOut.write(oBuf.array());
	}


	/**
	 * Writes a sample block row by row
	 * @param oOut destination
	 * @param nPrecision 4 to write floats, 8 to write doubles
	 * @param dStored rows of samples
	 * @throws IOException
	 */
	public void writeSamples(OutputStream oOut, int nPrecision, double[][] dStored)
		throws IOException
	{
		for (double[] dRow : dStored)
		{
			ByteBuffer oBuf = ByteBuffer.allocate(dRow.length * nPrecision).order(m_oOrder);
			for (double dVal : dRow)
			{
				if (nPrecision == Image.SINGLE)
					oBuf.putFloat((float)dVal);
				else
					oBuf.putDouble(dVal);
			}
			oOut.write(oBuf.array());
		}
	}


	/**
	 * Formats a time the way the simulator writes creation times, for example
	 * {@code Mon Jun 15 10:22:33 2015}
	 * @param lTime milliseconds since Epoch
	 * @return formatted UTC time
	 */
	public static String formatCreationTime(long lTime)
	{
		SimpleDateFormat oFormat = new SimpleDateFormat("EEE MMM dd HH:mm:ss yyyy", Locale.US);
		oFormat.setTimeZone(new SimpleTimeZone(0, ""));
		return oFormat.format(lTime);
	}
}
