package seisimg.store;

import seisimg.system.MathUtil;

/**
 * One rectangular grid of samples of an {@link Image}, with its own cell size
 * and vertical origin. The extent and statistics are computed when the patch
 * is constructed and never change.
 * <p>
 * Samples are stored in the file as {@code nj} rows of {@code ni} columns.
 * Cross sections keep that orientation. Maps are transposed so rows follow
 * the first horizontal axis, giving {@code ni} rows of {@code nj} columns.
 * </p>
 */
public class Patch
{
	/**
	 * Index of the left edge in the extent array
	 */
	public static final int LEFT = 0;


	/**
	 * Index of the right edge in the extent array
	 */
	public static final int RIGHT = 1;


	/**
	 * Index of the bottom edge in the extent array
	 */
	public static final int BOTTOM = 2;


	/**
	 * Index of the top edge in the extent array
	 */
	public static final int TOP = 3;


	/**
	 * Size in bytes of a patch header record
	 */
	public static final int HEADER_SIZE = 32;


	/**
	 * Image this patch belongs to. The image owns the patch.
	 */
	private final Image m_oImage;


	/**
	 * 0 based position of the patch in the image
	 */
	public final int m_nNumber;


	/**
	 * Grid spacing, the same along both axes
	 */
	public final double m_dH;


	/**
	 * Origin of the vertical axis
	 */
	public final double m_dZmin;


	/**
	 * Grid index of the first column, informational
	 */
	public final int m_nIb;


	/**
	 * Number of samples along the in-plane axis
	 */
	public final int m_nNi;


	/**
	 * Grid index of the first row, informational
	 */
	public final int m_nJb;


	/**
	 * Number of samples along the second axis
	 */
	public final int m_nNj;


	public final double m_dMin;


	public final double m_dMax;


	/**
	 * Population standard deviation of the samples
	 */
	public final double m_dStd;


	/**
	 * Root mean square of the samples
	 */
	public final double m_dRms;


	/**
	 * [left, right, bottom, top] of the area covered by the samples
	 */
	private final double[] m_dExtent;


	/**
	 * Samples in display orientation, [row][column]
	 */
	private final double[][] m_dData;


	/**
	 * Builds a patch from its header values and its samples as stored in the
	 * file.
	 *
	 * @param oImage owning image, supplies the plane used for orientation
	 * @param nNumber position of the patch in the image
	 * @param dH grid spacing
	 * @param dZmin vertical origin
	 * @param nIb first column index
	 * @param nNi number of columns in the stored grid
	 * @param nJb first row index
	 * @param nNj number of rows in the stored grid
	 * @param dStored {@code nNj} rows of {@code nNi} samples. The patch takes
	 * ownership of the array
	 */
	Patch(Image oImage, int nNumber, double dH, double dZmin, int nIb, int nNi, int nJb, int nNj, double[][] dStored)
	{
		if (dStored.length != nNj || (nNj > 0 && dStored[0].length != nNi))
			throw new IllegalArgumentException(String.format("Sample grid does not match %d x %d patch", nNj, nNi));

		m_oImage = oImage;
		m_nNumber = nNumber;
		m_dH = dH;
		m_dZmin = dZmin;
		m_nIb = nIb;
		m_nNi = nNi;
		m_nJb = nJb;
		m_nNj = nNj;

		double dHalf = dH / 2.0;
		if (oImage.isCrossSection())
		{
			m_dData = dStored;
			m_dExtent = new double[]
			{
				0 - dHalf,
				(nNi - 1) * dH + dHalf,
				dZmin - dHalf,
				dZmin + (nNj - 1) * dH + dHalf
			};
		}
		else
		{
			m_dData = MathUtil.transpose(dStored);
			m_dExtent = new double[]
			{
				0 - dHalf,
				(nNj - 1) * dH + dHalf,
				0 - dHalf,
				(nNi - 1) * dH + dHalf
			};
		}

		double[] dStats = MathUtil.statistics(dStored);
		m_dMin = dStats[MathUtil.MIN];
		m_dMax = dStats[MathUtil.MAX];
		m_dStd = dStats[MathUtil.STD];
		m_dRms = dStats[MathUtil.RMS];
	}


	public Image getImage()
	{
		return m_oImage;
	}


	/**
	 * @return copy of [left, right, bottom, top]
	 */
	public double[] getExtent()
	{
		return m_dExtent.clone();
	}


	public double getExtent(int nEdge)
	{
		return m_dExtent[nEdge];
	}


	/**
	 * @return number of rows in display orientation
	 */
	public int getRows()
	{
		return m_dData.length;
	}


	/**
	 * @return number of columns in display orientation
	 */
	public int getCols()
	{
		return m_dData.length == 0 ? 0 : m_dData[0].length;
	}


	public double getValue(int nRow, int nCol)
	{
		return m_dData[nRow][nCol];
	}


	/**
	 * @param nRow row index in display orientation
	 * @return copy of the row
	 */
	public double[] getRow(int nRow)
	{
		return m_dData[nRow].clone();
	}


	/**
	 * @return deep copy of the samples in display orientation
	 */
	public double[][] getData()
	{
		double[][] dCopy = new double[m_dData.length][];
		for (int nRow = 0; nRow < m_dData.length; nRow++)
			dCopy[nRow] = m_dData[nRow].clone();
		return dCopy;
	}


	/**
	 * Gets the value range to display. Divergent quantities without given
	 * limits are centered on zero using the larger magnitude of the minimum and
	 * maximum. Otherwise limits that are NaN fall back to the patch extrema.
	 *
	 * @param dVmin requested lower limit or NaN
	 * @param dVmax requested upper limit or NaN
	 * @return [lower, upper]
	 * @throws ImageFormatException if the image's mode code is unknown
	 */
	public double[] getColorLimits(double dVmin, double dVmax)
		throws ImageFormatException
	{
		if (Double.isNaN(dVmin) && Double.isNaN(dVmax) && m_oImage.isDivergent())
		{
			double dAbsMax = Math.max(Math.abs(m_dMin), Math.abs(m_dMax));
			return new double[]{-dAbsMax, dAbsMax};
		}
		return new double[]
		{
			Double.isNaN(dVmin) ? m_dMin : dVmin,
			Double.isNaN(dVmax) ? m_dMax : dVmax
		};
	}


	/**
	 * Tells which ends of a color bar need to show that samples fall outside
	 * the display range.
	 *
	 * @param dVmin lower limit or NaN for none
	 * @param dVmax upper limit or NaN for none
	 * @return "both", "min", "max" or "neither"
	 */
	public String getExtend(double dVmin, double dVmax)
	{
		boolean bBelow = !Double.isNaN(dVmin) && m_dMin < dVmin;
		boolean bAbove = !Double.isNaN(dVmax) && m_dMax > dVmax;
		if (bBelow && bAbove)
			return "both";
		if (bBelow)
			return "min";
		if (bAbove)
			return "max";
		return "neither";
	}


	@Override
	public String toString()
	{
		return String.format("patch %d h=%s zmin=%s ni=%d nj=%d min=%g max=%g std=%g rms=%g",
			m_nNumber, Double.toString(m_dH), Double.toString(m_dZmin), m_nNi, m_nNj, m_dMin, m_dMax, m_dStd, m_dRms);
	}
}
