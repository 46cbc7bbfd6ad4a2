package seisimg.store.modes;

import org.junit.jupiter.api.Test;
import seisimg.store.ImageFormatException;

import static org.junit.jupiter.api.Assertions.*;

public class QuantityKindTest
{
	@Test
	public void everyKindDefinesModesOneThroughThirtyNine()
	{
		for (QuantityKind oKind : QuantityKind.values())
		{
			assertEquals(39, oKind.getModes().size());
			for (int nMode = 1; nMode <= 39; nMode++)
				assertTrue(oKind.hasMode(nMode), oKind.getName() + " " + nMode);
			assertFalse(oKind.hasMode(0));
			assertFalse(oKind.hasMode(40));
		}
	}


	@Test
	public void componentsDifferByKind()
		throws ImageFormatException
	{
		Quantity oUx = QuantityKind.DISPLACEMENT.getQuantity(1);
		Quantity oVx = QuantityKind.VELOCITY.getQuantity(1);

		assertEquals("X displacement", oUx.m_sName);
		assertEquals("ux", oUx.m_sSymbol);
		assertEquals("X displacement [m]", oUx.getLabel());
		assertEquals("X velocity", oVx.m_sName);
		assertEquals("vx", oVx.m_sSymbol);
		assertEquals("m/s", oVx.m_sUnit);
		assertEquals(1, oVx.m_nMode);
	}


	@Test
	public void materialPropertiesAreSharedAndSequential()
		throws ImageFormatException
	{
		for (int nMode = 4; nMode <= 8; nMode++)
		{
			Quantity oDisplacement = QuantityKind.DISPLACEMENT.getQuantity(nMode);
			Quantity oVelocity = QuantityKind.VELOCITY.getQuantity(nMode);
			assertEquals(oDisplacement.m_sName, oVelocity.m_sName);
			assertEquals(Colormap.SEQUENTIAL_R, oDisplacement.m_oColormap);
			assertFalse(oVelocity.isDivergent());
		}
		assertEquals("Vp", QuantityKind.VELOCITY.getQuantity(7).m_sSymbol);
	}


	@Test
	public void gradientsAreDivergentAndMagnitudesAreNot()
		throws ImageFormatException
	{
		for (int nMode = 33; nMode <= 37; nMode++)
			assertTrue(QuantityKind.DISPLACEMENT.getQuantity(nMode).isDivergent());
		for (int nMode = 25; nMode <= 32; nMode++)
			assertEquals(Colormap.SEQUENTIAL, QuantityKind.VELOCITY.getQuantity(nMode).m_oColormap);
	}


	@Test
	public void unknownModeNamesTheKind()
	{
		ImageFormatException oEx = assertThrows(ImageFormatException.class, () -> QuantityKind.VELOCITY.getQuantity(99));

		assertEquals(ImageFormatException.Reason.UNKNOWN_MODE, oEx.getReason());
		assertTrue(oEx.getMessage().contains("99"));
		assertTrue(oEx.getMessage().contains("velocity"));
	}


	@Test
	public void kindsAreFoundByName()
	{
		assertEquals(QuantityKind.DISPLACEMENT, QuantityKind.fromName("displacement"));
		assertEquals(QuantityKind.VELOCITY, QuantityKind.fromName("VELOCITY"));
		assertNull(QuantityKind.fromName("acceleration"));
		assertNull(QuantityKind.fromName(null));
	}


	@Test
	public void colormapTagsRoundTrip()
	{
		for (Colormap oMap : Colormap.values())
			assertEquals(oMap, Colormap.fromTag(oMap.getTag()));
		assertTrue(Colormap.DIVERGENT_R.isDivergent());
		assertTrue(Colormap.DIVERGENT_R.isReversed());
		assertFalse(Colormap.SEQUENTIAL.isReversed());
		assertThrows(IllegalArgumentException.class, () -> Colormap.fromTag("rainbow"));
	}
}
