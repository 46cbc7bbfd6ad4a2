package seisimg.store;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import seisimg.config.ImageConfig;
import seisimg.store.modes.QuantityKind;
import seisimg.system.ByteOrderInStream;
import seisimg.system.Config;
import seisimg.system.JSONUtil;

/**
 * Decodes simulation image files. A file is read strictly in order: the image
 * header, every patch header, then the sample block of each patch. The
 * precision and dimensions found in the headers decide how many bytes each
 * sample block holds.
 * <p>
 * A reader keeps no state between calls and can be shared by threads that
 * decode different files.
 * </p>
 */
public class ImageReader
{
	/**
	 * Compressed file suffixes that are decompressed before decoding
	 */
	private static final String[] COMPRESSED = new String[]{".gz", ".bz2", ".xz"};


	/**
	 * Initial capacity of a row being read, and of the row list of a patch
	 */
	private static final int ROW_CHUNK = 65536;


	private static final Logger LOGGER = LogManager.getLogger(ImageReader.class);


	/**
	 * Largest patch count accepted, guards against corrupt headers
	 */
	private final int m_nMaxPatches;


	/**
	 * Largest number of samples accepted in one patch
	 */
	private final long m_lMaxSamples;


	/**
	 * Byte order of the files
	 */
	private final ByteOrder m_oOrder;


	/**
	 * Expected file name suffix
	 */
	private final String m_sExtension;


	/**
	 * Creates a reader configured by the {@code ImageReader} configuration:
	 * {@code maxpatches}, {@code maxsamples}, {@code byteorder} and
	 * {@code extension}.
	 */
	public ImageReader()
	{
		this(Config.getInstance().getConfig(ImageReader.class.getName(), "ImageReader"));
	}


	public ImageReader(JSONObject oConfig)
	{
		this(oConfig.optInt("maxpatches", 4096), oConfig.optLong("maxsamples", 268435456L),
			JSONUtil.optEnum(oConfig, "byteorder", Endian.LITTLE_ENDIAN).m_oOrder,
			oConfig.optString("extension", ".sw4img"));
	}


	public ImageReader(int nMaxPatches, long lMaxSamples, ByteOrder oOrder, String sExtension)
	{
		m_nMaxPatches = nMaxPatches;
		m_lMaxSamples = Math.min(lMaxSamples, Integer.MAX_VALUE - 8);
		m_oOrder = oOrder;
		m_sExtension = sExtension;
	}


	public ByteOrder getByteOrder()
	{
		return m_oOrder;
	}


	/**
	 * Reads an image file. Files ending in .gz, .bz2 or .xz are decompressed
	 * first. The file is closed before this method returns, whether decoding
	 * succeeded or not.
	 *
	 * @param oFile path of the image file
	 * @param oKind quantity kind requested by the caller, may be null
	 * @param oConfig simulation settings, may be null. A quantity kind declared
	 * here takes precedence over {@code oKind}
	 * @return the decoded image
	 * @throws ImageFormatException if the quantity kind cannot be resolved or
	 * the file does not follow the image format
	 * @throws IOException if the file cannot be read
	 */
	public Image read(Path oFile, QuantityKind oKind, ImageConfig oConfig)
		throws IOException
	{
		QuantityKind oResolved = Image.resolveQuantityKind(oKind, oConfig);
		String sFilename = oFile.toString();
		String sName = oFile.getFileName().toString();
		boolean bCompressed = false;
		for (String sSuffix : COMPRESSED)
		{
			if (sName.endsWith(sSuffix))
			{
				sName = sName.substring(0, sName.length() - sSuffix.length());
				bCompressed = true;
			}
		}
		if (!sName.endsWith(m_sExtension))
			LOGGER.warn(String.format("Reading image file with uncommon file extension: '%s'.", sFilename));

		LOGGER.debug(String.format("Reading %s", sFilename));
		try (InputStream oIn = open(oFile, bCompressed))
		{
			return decode(oIn, sFilename, oResolved, oConfig);
		}
	}


	/**
	 * Decodes an image from a stream. The stream is not closed. Since reads are
	 * buffered it may be consumed past the end of the last sample block.
	 *
	 * @param oIn stream positioned at the image header
	 * @param sFilename name recorded in the image, may be null
	 * @param oKind quantity kind requested by the caller, may be null
	 * @param oConfig simulation settings, may be null
	 * @return the decoded image
	 * @throws ImageFormatException if the quantity kind cannot be resolved or
	 * the stream does not follow the image format
	 * @throws IOException if the stream fails
	 */
	public Image read(InputStream oIn, String sFilename, QuantityKind oKind, ImageConfig oConfig)
		throws IOException
	{
		return decode(oIn, sFilename, Image.resolveQuantityKind(oKind, oConfig), oConfig);
	}


	private static InputStream open(Path oFile, boolean bCompressed)
		throws IOException
	{
		InputStream oIn = new BufferedInputStream(Files.newInputStream(oFile));
		if (!bCompressed)
			return oIn;

		try
		{
			return new CompressorStreamFactory().createCompressorInputStream(oIn);
		}
		catch (CompressorException oEx)
		{
			oIn.close();
			throw new IOException(String.format("Cannot decompress %s", oFile), oEx);
		}
	}


	private Image decode(InputStream oStream, String sFilename, QuantityKind oKind, ImageConfig oConfig)
		throws IOException
	{
		ByteOrderInStream oIn = new ByteOrderInStream(oStream, m_oOrder);
		try
		{
			// image header
			int nPrecision = oIn.readInt();
			int nPatchCount = oIn.readInt();
			double dTime = oIn.readDouble();
			int nPlane = oIn.readInt();
			double dCoordinate = oIn.readDouble();
			int nMode = oIn.readInt();
			int nGridInfo = oIn.readInt();
			String sCreationTime = oIn.readAscii(Image.CREATION_TIME_LENGTH);

			Image.checkPrecision(nPrecision);
			if (nPatchCount < 0 || nPatchCount > m_nMaxPatches)
				throw new ImageFormatException(ImageFormatException.Reason.INVALID_DIMENSIONS,
					String.format("Patch count %d is outside 0 to %d", nPatchCount, m_nMaxPatches));

			Image oImage = new Image(sFilename, nPrecision, nPatchCount, dTime, nPlane, dCoordinate,
				nMode, nGridInfo, sCreationTime, oKind, oConfig);

			// all patch headers come before the first sample block
			double[] dH = new double[nPatchCount];
			double[] dZmin = new double[nPatchCount];
			int[] nIb = new int[nPatchCount];
			int[] nNi = new int[nPatchCount];
			int[] nJb = new int[nPatchCount];
			int[] nNj = new int[nPatchCount];
			for (int nIndex = 0; nIndex < nPatchCount; nIndex++)
			{
				dH[nIndex] = oIn.readDouble();
				dZmin[nIndex] = oIn.readDouble();
				nIb[nIndex] = oIn.readInt();
				nNi[nIndex] = oIn.readInt();
				nJb[nIndex] = oIn.readInt();
				nNj[nIndex] = oIn.readInt();
			}
			for (int nIndex = 0; nIndex < nPatchCount; nIndex++)
			{
				if (nNi[nIndex] <= 0 || nNj[nIndex] <= 0)
					throw new ImageFormatException(ImageFormatException.Reason.INVALID_DIMENSIONS,
						String.format("Patch %d has dimensions ni=%d nj=%d", nIndex, nNi[nIndex], nNj[nIndex]));
				if ((long)nNi[nIndex] * nNj[nIndex] > m_lMaxSamples)
					throw new ImageFormatException(ImageFormatException.Reason.INVALID_DIMENSIONS,
						String.format("Patch %d has %d samples, more than %d", nIndex, (long)nNi[nIndex] * nNj[nIndex], m_lMaxSamples));
			}

			for (int nIndex = 0; nIndex < nPatchCount; nIndex++)
			{
				double[][] dStored = new double[Math.min(nNj[nIndex], ROW_CHUNK)][];
				for (int nRow = 0; nRow < nNj[nIndex]; nRow++)
				{
					if (nRow == dStored.length)
						dStored = Arrays.copyOf(dStored, (int)Math.min(nNj[nIndex], 2L * dStored.length));
					dStored[nRow] = readRow(oIn, nNi[nIndex], nPrecision);
				}

				oImage.addPatch(new Patch(oImage, nIndex, dH[nIndex], dZmin[nIndex], nIb[nIndex], nNi[nIndex], nJb[nIndex], nNj[nIndex], dStored));
			}
			LOGGER.debug(String.format("Decoded %s from %d bytes", oImage, oIn.getBytesRead()));
			return oImage;
		}
		catch (EOFException oEx)
		{
			throw new ImageFormatException(ImageFormatException.Reason.TRUNCATED,
				String.format("%s ended after %d bytes", sFilename == null ? "Image stream" : sFilename, oIn.getBytesRead()), oEx);
		}
	}


	/**
	 * Reads one row of samples. The row array grows with the values actually
	 * read, so a header declaring more samples than the stream holds fails
	 * with EOF before the full row is allocated.
	 *
	 * @param oIn stream positioned at the row
	 * @param nCount number of values in the row
	 * @param nWidth width in bytes of each value
	 * @return the row
	 * @throws IOException if the stream ends or fails
	 */
	private static double[] readRow(ByteOrderInStream oIn, int nCount, int nWidth)
		throws IOException
	{
		double[] dRow = new double[Math.min(nCount, ROW_CHUNK)];
		int nRead = 0;
		while (nRead < nCount)
		{
			if (nRead == dRow.length)
				dRow = Arrays.copyOf(dRow, (int)Math.min(nCount, 2L * dRow.length));
			int nValues = dRow.length - nRead;
			oIn.readReals(dRow, nRead, nValues, nWidth);
			nRead += nValues;
		}
		return dRow;
	}


	/**
	 * Byte order names accepted by the {@code byteorder} configuration key
	 */
	public enum Endian
	{
		LITTLE_ENDIAN(ByteOrder.LITTLE_ENDIAN),
		BIG_ENDIAN(ByteOrder.BIG_ENDIAN);


		private final ByteOrder m_oOrder;


		private Endian(ByteOrder oOrder)
		{
			m_oOrder = oOrder;
		}
	}
}
