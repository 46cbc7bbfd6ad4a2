package seisimg;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import seisimg.config.ImageConfig;
import seisimg.config.JsonImageConfig;
import seisimg.store.DemoImage;
import seisimg.store.Image;
import seisimg.store.ImageFormatException;
import seisimg.store.ImageReader;
import seisimg.store.ImageWriter;
import seisimg.store.Patch;
import seisimg.store.modes.Quantity;
import seisimg.store.modes.QuantityKind;

/**
 * Command line tool that decodes image files and logs their header, quantity
 * and per patch statistics.
 * <pre>
 * ImageInfo [-kind displacement|velocity] [-config settings.json] file...
 * ImageInfo [-kind displacement|velocity] -demo out.sw4img
 * </pre>
 * Exits with status 1 if any file fails to decode.
 */
public class ImageInfo
{
	private static final Logger LOGGER = LogManager.getLogger(ImageInfo.class);


	public static void main(String[] sArgs)
	{
		QuantityKind oKind = null;
		ImageConfig oConfig = null;
		String sDemo = null;
		ArrayList<Path> oFiles = new ArrayList();
		try
		{
			for (int nIndex = 0; nIndex < sArgs.length; nIndex++)
			{
				String sArg = sArgs[nIndex];
				if (sArg.equals("-kind"))
				{
					String sKind = optionValue(sArgs, nIndex++);
					oKind = QuantityKind.fromName(sKind);
					if (oKind == null)
						throw new IllegalArgumentException("Unknown quantity kind: " + sKind);
				}
				else if (sArg.equals("-config"))
					oConfig = JsonImageConfig.read(Paths.get(optionValue(sArgs, nIndex++)));
				else if (sArg.equals("-demo"))
					sDemo = optionValue(sArgs, nIndex++);
				else
					oFiles.add(Paths.get(sArg));
			}

			if (sDemo != null)
			{
				new ImageWriter().write(DemoImage.create(oKind == null ? QuantityKind.DISPLACEMENT : oKind, System.nanoTime()), Paths.get(sDemo));
				LOGGER.info(String.format("Wrote demo image %s", sDemo));
				return;
			}
		}
		catch (Exception oEx)
		{
			LOGGER.error(oEx, oEx);
			System.exit(1);
		}

		ImageReader oReader = new ImageReader();
		int nFailures = 0;
		for (Path oFile : oFiles)
		{
			try
			{
				describe(oReader.read(oFile, oKind, oConfig));
			}
			catch (Exception oEx)
			{
				LOGGER.error(String.format("Failed to read %s", oFile));
				LOGGER.error(oEx, oEx);
				++nFailures;
			}
		}
		if (nFailures > 0)
			System.exit(1);
	}


	/**
	 * Gets the value following an option
	 * @param sArgs command line arguments
	 * @param nIndex index of the option
	 * @return the next argument
	 * @throws IllegalArgumentException if the option is the last argument
	 */
	static String optionValue(String[] sArgs, int nIndex)
	{
		if (nIndex + 1 >= sArgs.length)
			throw new IllegalArgumentException(String.format("Missing value for %s", sArgs[nIndex]));
		return sArgs[nIndex + 1];
	}


	/**
	 * Logs a summary of the image
	 * @param oImage decoded image
	 */
	static void describe(Image oImage)
	{
		LOGGER.info(oImage.m_sFilename);
		LOGGER.info(String.format("  %s, %s=%s, t=%.2f s, created %s", oImage.getType(), oImage.getPlane(),
			Double.toString(oImage.m_dCoordinate), oImage.m_dTime, oImage.m_sCreationTime));
		try
		{
			Quantity oQuantity = oImage.getQuantity();
			LOGGER.info(String.format("  %s (%s) [%s], %s", oQuantity.m_sName, oQuantity.m_sSymbol,
				oQuantity.m_sUnit, oQuantity.m_oColormap.getTag()));
		}
		catch (ImageFormatException oEx)
		{
			LOGGER.warn("  " + oEx.getMessage());
		}
		for (Patch oPatch : oImage.getPatches())
		{
			double[] dExtent = oPatch.getExtent();
			LOGGER.info(String.format("  %s extent=[%g, %g, %g, %g]", oPatch,
				dExtent[Patch.LEFT], dExtent[Patch.RIGHT], dExtent[Patch.BOTTOM], dExtent[Patch.TOP]));
		}
	}
}
