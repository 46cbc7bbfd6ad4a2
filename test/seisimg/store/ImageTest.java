package seisimg.store;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import seisimg.config.JsonImageConfig;
import seisimg.store.modes.Colormap;
import seisimg.store.modes.QuantityKind;

import static org.junit.jupiter.api.Assertions.*;

public class ImageTest
{
	private static final String SETTINGS = "{\"quantitykind\": \"velocity\","
		+ " \"source\": [{\"x\": 1000, \"y\": 2000, \"z\": 300, \"type\": \"Gaussian\"},"
		+ " {\"x\": 4000, \"y\": 5000, \"z\": 600}]}";


	private static Image image(int nPlane, int nMode, QuantityKind oKind, JsonImageConfig oConfig)
		throws ImageFormatException
	{
		return new Image("a.sw4img", Image.DOUBLE, 0, 2.0, nPlane, 10.0, nMode, 1,
			"Mon Jun 15 10:22:33 2015", oKind, oConfig);
	}


	@Test
	public void explicitKindIsUsedWithoutConfiguration()
		throws ImageFormatException
	{
		assertEquals(QuantityKind.VELOCITY, Image.resolveQuantityKind(QuantityKind.VELOCITY, null));
		assertEquals(QuantityKind.DISPLACEMENT,
			Image.resolveQuantityKind(QuantityKind.DISPLACEMENT, new JsonImageConfig(new JSONObject())));
	}


	@Test
	public void configuredKindOverridesExplicitKind()
		throws ImageFormatException
	{
		JsonImageConfig oConfig = new JsonImageConfig(new JSONObject(SETTINGS));

		assertEquals(QuantityKind.VELOCITY, Image.resolveQuantityKind(QuantityKind.DISPLACEMENT, oConfig));
		assertEquals(QuantityKind.VELOCITY, Image.resolveQuantityKind(null, oConfig));
	}


	@Test
	public void missingKindIsAnError()
	{
		ImageFormatException oEx = assertThrows(ImageFormatException.class,
			() -> Image.resolveQuantityKind(null, new JsonImageConfig(new JSONObject("{\"source\": []}"))));

		assertEquals(ImageFormatException.Reason.UNKNOWN_QUANTITY_KIND, oEx.getReason());
		assertThrows(ImageFormatException.class, () -> Image.resolveQuantityKind(null, null));
	}


	@Test
	public void invalidHeaderCodesAreRejected()
	{
		ImageFormatException oEx = assertThrows(ImageFormatException.class,
			() -> new Image(null, 2, 0, 0.0, Image.PLANE_X, 0.0, 1, 0, "", QuantityKind.DISPLACEMENT, null));
		assertEquals(ImageFormatException.Reason.INVALID_PRECISION, oEx.getReason());

		oEx = assertThrows(ImageFormatException.class, () -> image(-1, 1, QuantityKind.DISPLACEMENT, null));
		assertEquals(ImageFormatException.Reason.INVALID_PLANE, oEx.getReason());
	}


	@Test
	public void planeDecidesTypeAndAxes()
		throws ImageFormatException
	{
		Image oX = image(Image.PLANE_X, 1, QuantityKind.DISPLACEMENT, null);
		Image oY = image(Image.PLANE_Y, 1, QuantityKind.DISPLACEMENT, null);
		Image oZ = image(Image.PLANE_Z, 1, QuantityKind.DISPLACEMENT, null);

		assertEquals("cross-section", oX.getType());
		assertEquals("cross-section", oY.getType());
		assertEquals("map", oZ.getType());
		assertEquals("X", oX.getPlane());
		assertEquals("Z", oZ.getPlane());
		assertArrayEquals(new String[]{"Y", "Z"}, oX.getAxisLabels());
		assertArrayEquals(new String[]{"X", "Z"}, oY.getAxisLabels());
		assertArrayEquals(new String[]{"Y", "X"}, oZ.getAxisLabels());
	}


	@Test
	public void quantityComesFromKindTable()
		throws ImageFormatException
	{
		Image oDisplacement = image(Image.PLANE_Y, 2, QuantityKind.DISPLACEMENT, null);
		Image oVelocity = image(Image.PLANE_Y, 2, QuantityKind.VELOCITY, null);

		assertEquals("Y displacement", oDisplacement.getQuantityName());
		assertEquals("uy", oDisplacement.getQuantitySymbol());
		assertEquals("m", oDisplacement.getQuantityUnit());
		assertEquals("Y velocity", oVelocity.getQuantityName());
		assertEquals("m/s", oVelocity.getQuantityUnit());
		assertTrue(oVelocity.isDivergent());
		assertEquals(Colormap.SEQUENTIAL_R, image(Image.PLANE_Z, 7, QuantityKind.VELOCITY, null).getColormap());
		assertFalse(image(Image.PLANE_Z, 7, QuantityKind.VELOCITY, null).isDivergent());
	}


	@Test
	public void depthIncreasingCrossSectionsInvertColorbar()
		throws ImageFormatException
	{
		assertTrue(image(Image.PLANE_X, 4, QuantityKind.DISPLACEMENT, null).isColorbarInverted());
		assertTrue(image(Image.PLANE_Y, 7, QuantityKind.DISPLACEMENT, null).isColorbarInverted());
		assertTrue(image(Image.PLANE_Y, 8, QuantityKind.VELOCITY, null).isColorbarInverted());
		assertFalse(image(Image.PLANE_Z, 7, QuantityKind.DISPLACEMENT, null).isColorbarInverted());
		assertFalse(image(Image.PLANE_Y, 5, QuantityKind.DISPLACEMENT, null).isColorbarInverted());
	}


	@Test
	public void sourcesAreProjectedOntoPlotAxes()
		throws ImageFormatException
	{
		JsonImageConfig oConfig = new JsonImageConfig(new JSONObject(SETTINGS));

		assertArrayEquals(new double[][]{{2000, 5000}, {300, 600}},
			image(Image.PLANE_X, 1, QuantityKind.VELOCITY, oConfig).getSourceCoordinates());
		assertArrayEquals(new double[][]{{1000, 4000}, {300, 600}},
			image(Image.PLANE_Y, 1, QuantityKind.VELOCITY, oConfig).getSourceCoordinates());
		assertArrayEquals(new double[][]{{2000, 5000}, {1000, 4000}},
			image(Image.PLANE_Z, 1, QuantityKind.VELOCITY, oConfig).getPlotCoordinates("source"));
	}


	@Test
	public void plotCoordinatesNeedConfiguredPositions()
		throws ImageFormatException
	{
		JsonImageConfig oConfig = new JsonImageConfig(new JSONObject(SETTINGS));

		assertNull(image(Image.PLANE_X, 1, QuantityKind.VELOCITY, null).getSourceCoordinates());
		assertNull(image(Image.PLANE_X, 1, QuantityKind.VELOCITY, oConfig).getPlotCoordinates("rec"));
	}


	@Test
	public void creationTimeIsParsedWhenPossible()
		throws ImageFormatException
	{
		Image oImage = image(Image.PLANE_X, 1, QuantityKind.DISPLACEMENT, null);
		assertEquals(1434363753000L, oImage.m_lCreationTime);

		Image oPadded = new Image(null, Image.SINGLE, 0, 0.0, Image.PLANE_X, 0.0, 1, 0,
			"Tue Jun  2 08:00:00 2015", QuantityKind.DISPLACEMENT, null);
		assertEquals(1433232000000L, oPadded.m_lCreationTime);

		Image oGarbled = new Image(null, Image.SINGLE, 0, 0.0, Image.PLANE_X, 0.0, 1, 0,
			"not a date", QuantityKind.DISPLACEMENT, null);
		assertEquals("not a date", oGarbled.m_sCreationTime);
		assertEquals(Long.MIN_VALUE, oGarbled.m_lCreationTime);
	}
}
