package seisimg.system;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathUtilTest
{
	@Test
	public void statisticsCoverEveryRow()
	{
		double[] dStats = MathUtil.statistics(new double[][]{{-1, 1}, {3, -3}});

		assertEquals(-3.0, dStats[MathUtil.MIN]);
		assertEquals(3.0, dStats[MathUtil.MAX]);
		assertEquals(0.0, dStats[MathUtil.MEAN]);
		assertEquals(Math.sqrt(5.0), dStats[MathUtil.STD], 1e-12);
		assertEquals(Math.sqrt(5.0), dStats[MathUtil.RMS], 1e-12);
	}


	@Test
	public void statisticsOfEmptyGridAreNaN()
	{
		for (double dStat : MathUtil.statistics(new double[0][0]))
			assertTrue(Double.isNaN(dStat));
		for (double dStat : MathUtil.statistics(new double[3][0]))
			assertTrue(Double.isNaN(dStat));
	}


	@Test
	public void nanSampleMakesEveryStatisticNaN()
	{
		for (double dStat : MathUtil.statistics(new double[][]{{1, Double.NaN, 2}}))
			assertTrue(Double.isNaN(dStat));
		for (double dStat : MathUtil.statistics(new double[][]{{Double.NaN}, {-5, 5}}))
			assertTrue(Double.isNaN(dStat));
	}


	@Test
	public void transposeSwapsRowsAndColumns()
	{
		double[][] dGrid = new double[][]{{1, 2, 3}, {4, 5, 6}};

		assertArrayEquals(new double[][]{{1, 4}, {2, 5}, {3, 6}}, MathUtil.transpose(dGrid));
		assertEquals(0, MathUtil.transpose(new double[0][0]).length);
	}
}
