package seisimg.store;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import seisimg.config.ImageConfig;
import seisimg.store.modes.QuantityKind;
import seisimg.system.Scheduling;

/**
 * A time ordered sequence of image files, such as the frames of a movie.
 * Determines the value range shared by one patch across every file so all
 * frames can be displayed with the same color scale. Files are decoded in
 * parallel, each one independently.
 */
public class ImageSeries
{
	private static final Logger LOGGER = LogManager.getLogger(ImageSeries.class);


	private final List<Path> m_oFiles;


	private final ImageReader m_oReader;


	/**
	 * Quantity kind requested by the caller, may be null
	 */
	private final QuantityKind m_oKind;


	/**
	 * Simulation settings, may be null
	 */
	private final ImageConfig m_oConfig;


	public ImageSeries(List<Path> oFiles, ImageReader oReader, QuantityKind oKind, ImageConfig oConfig)
	{
		m_oFiles = Collections.unmodifiableList(new ArrayList(oFiles));
		m_oReader = oReader;
		m_oKind = oKind;
		m_oConfig = oConfig;
	}


	/**
	 * Lists the files matching a wildcard pattern in sorted order. Wildcards
	 * are only allowed in the file name part, for example
	 * {@code /data/run1/image.cycle=*.y=1000.ux.sw4img}.
	 *
	 * @param sPattern path whose file name may contain glob wildcards
	 * @return matching files sorted by name
	 * @throws IOException if the directory cannot be listed
	 */
	public static List<Path> listFiles(String sPattern)
		throws IOException
	{
		Path oPattern = Paths.get(sPattern);
		Path oDir = oPattern.getParent();
		if (oDir == null)
			oDir = Paths.get(".");
		ArrayList<Path> oFiles = new ArrayList();
		try (DirectoryStream<Path> oStream = Files.newDirectoryStream(oDir, oPattern.getFileName().toString()))
		{
			for (Path oFile : oStream)
				oFiles.add(oFile);
		}
		Collections.sort(oFiles);
		return oFiles;
	}


	public List<Path> getFiles()
	{
		return m_oFiles;
	}


	/**
	 * Decodes every file and combines the extrema of one patch. For divergent
	 * quantities the limits are centered on zero using the larger magnitude,
	 * otherwise they are the global minimum and maximum.
	 *
	 * @param nPatch patch number to use from each image
	 * @return [lower limit, upper limit]
	 * @throws IOException if any file cannot be decoded, the first failure in
	 * file order is thrown
	 * @throws IllegalArgumentException if there are no files or an image does
	 * not have the requested patch
	 */
	public double[] getColorLimits(int nPatch)
		throws IOException
	{
		if (m_oFiles.isEmpty())
			throw new IllegalArgumentException("No image files in series");

		ArrayList<Callable<double[]>> oWork = new ArrayList(m_oFiles.size());
		for (Path oFile : m_oFiles)
		{
			oWork.add(() ->
			{
				Image oImage = m_oReader.read(oFile, m_oKind, m_oConfig);
				if (nPatch < 0 || nPatch >= oImage.getNumberOfPatches())
					throw new IllegalArgumentException(String.format("%s does not have patch %d", oFile, nPatch));
				Patch oPatch = oImage.getPatch(nPatch);
				return new double[]{oPatch.m_dMin, oPatch.m_dMax, oImage.isDivergent() ? 1 : 0};
			});
		}

		List<double[]> oResults;
		try
		{
			oResults = Scheduling.getInstance().processCallables(oWork);
		}
		catch (ExecutionException oEx)
		{
			Throwable oCause = oEx.getCause();
			if (oCause instanceof IOException)
				throw (IOException)oCause;
			if (oCause instanceof RuntimeException)
				throw (RuntimeException)oCause;
			throw new IOException(oCause);
		}
		catch (InterruptedException oEx)
		{
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while decoding image series");
		}

		double dMin = Double.POSITIVE_INFINITY;
		double dMax = Double.NEGATIVE_INFINITY;
		for (double[] dResult : oResults)
		{
			dMin = Math.min(dMin, dResult[0]);
			dMax = Math.max(dMax, dResult[1]);
		}
		boolean bDivergent = oResults.get(oResults.size() - 1)[2] != 0; // quantity of the last frame
		LOGGER.info(String.format("%d files, patch %d, min=%g max=%g", oResults.size(), nPatch, dMin, dMax));
		if (bDivergent)
		{
			double dAbsMax = Math.max(Math.abs(dMin), Math.abs(dMax));
			return new double[]{-dAbsMax, dAbsMax};
		}
		return new double[]{dMin, dMax};
	}
}
