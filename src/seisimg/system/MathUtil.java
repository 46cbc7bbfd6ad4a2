package seisimg.system;

/**
 * This class contains static utility methods for other classes to use
 */
public class MathUtil
{
	/**
	 * Index of the minimum in the array returned by {@link #statistics(double[][])}
	 */
	public static final int MIN = 0;


	/**
	 * Index of the maximum
	 */
	public static final int MAX = 1;


	/**
	 * Index of the mean
	 */
	public static final int MEAN = 2;


	/**
	 * Index of the population standard deviation
	 */
	public static final int STD = 3;


	/**
	 * Index of the root mean square
	 */
	public static final int RMS = 4;


	private MathUtil()
	{
	}


	/**
	 * Computes the minimum, maximum, mean, population standard deviation and
	 * root mean square of every value in the grid in two passes.
	 *
	 * @param dGrid grid of values, rows may differ in length
	 * @return array indexed by {@link #MIN}, {@link #MAX}, {@link #MEAN},
	 * {@link #STD} and {@link #RMS}. All NaN if the grid is empty or holds a
	 * NaN value
	 */
	public static double[] statistics(double[][] dGrid)
	{
		double[] dStats = new double[]{Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN};
		long lCount = 0;
		double dMin = Double.POSITIVE_INFINITY;
		double dMax = Double.NEGATIVE_INFINITY;
		double dSum = 0.0;
		double dSumSq = 0.0;
		for (double[] dRow : dGrid)
		{
			for (double dVal : dRow)
			{
				dMin = Math.min(dMin, dVal); // NaN sticks
				dMax = Math.max(dMax, dVal);
				dSum += dVal;
				dSumSq += dVal * dVal;
				++lCount;
			}
		}
		if (lCount == 0)
			return dStats;

		double dMean = dSum / lCount;
		double dSummation = 0.0;
		for (double[] dRow : dGrid) // deviations from the final mean
		{
			for (double dVal : dRow)
				dSummation += (dVal - dMean) * (dVal - dMean);
		}

		dStats[MIN] = dMin;
		dStats[MAX] = dMax;
		dStats[MEAN] = dMean;
		dStats[STD] = Math.sqrt(dSummation / lCount);
		dStats[RMS] = Math.sqrt(dSumSq / lCount);
		return dStats;
	}


	/**
	 * Transposes a rectangular grid
	 * @param dGrid grid with {@code n} rows of {@code m} columns
	 * @return new grid with {@code m} rows of {@code n} columns
	 */
	public static double[][] transpose(double[][] dGrid)
	{
		int nRows = dGrid.length;
		int nCols = nRows == 0 ? 0 : dGrid[0].length;
		double[][] dRet = new double[nCols][nRows];
		for (int nRow = 0; nRow < nRows; nRow++)
		{
			double[] dRow = dGrid[nRow];
			for (int nCol = 0; nCol < nCols; nCol++)
				dRet[nCol][nRow] = dRow[nCol];
		}
		return dRet;
	}
}
