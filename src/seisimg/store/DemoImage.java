package seisimg.store;

import java.util.Random;
import seisimg.store.modes.QuantityKind;

/**
 * Builds synthetic images filled with random samples, for trying renderers
 * and tools without simulation output.
 */
public abstract class DemoImage
{
	/**
	 * Columns of the demo patch
	 */
	public static final int NI = 100;


	/**
	 * Rows of the demo patch
	 */
	public static final int NJ = 200;


	/**
	 * Grid spacing of the demo patch
	 */
	public static final double H = 100.0;


	/**
	 * Vertical Z component, defined for both quantity kinds
	 */
	public static final int MODE = 3;


	private DemoImage()
	{
	}


	/**
	 * Creates a single patch cross section at time 0 whose samples are uniformly
	 * distributed in [-1, 1).
	 *
	 * @param oKind quantity kind of the image
	 * @param lSeed random seed
	 * @return the image
	 */
	public static Image create(QuantityKind oKind, long lSeed)
	{
		Random oRng = new Random(lSeed);
		double[][] dStored = new double[NJ][NI];
		for (double[] dRow : dStored)
		{
			for (int nIndex = 0; nIndex < dRow.length; nIndex++)
				dRow[nIndex] = 2.0 * (oRng.nextFloat() - 0.5);
		}

		try
		{
			Image oImage = new Image(null, Image.SINGLE, 1, 0.0, Image.PLANE_Y, 0.0, MODE, 0,
				ImageWriter.formatCreationTime(System.currentTimeMillis()), oKind, null);
			oImage.addPatch(new Patch(oImage, 0, H, 0.0, 1, NI, 1, NJ, dStored));
			return oImage;
		}
		catch (ImageFormatException oEx)
		{
			throw new IllegalStateException("Demo image constants are invalid", oEx);
		}
	}
}
