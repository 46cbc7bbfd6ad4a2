package seisimg.store.modes;

/**
 * Describes the physical quantity stored in an image for one mode code.
 * Instances are created only by {@link QuantityKind} and never change.
 */
public class Quantity
{
	/**
	 * Image mode code
	 */
	public final int m_nMode;


	/**
	 * Descriptive name, used for color bar labels
	 */
	public final String m_sName;


	/**
	 * Short symbol
	 */
	public final String m_sSymbol;


	/**
	 * SI unit, empty for dimensionless quantities
	 */
	public final String m_sUnit;


	/**
	 * Color map family the quantity is displayed with
	 */
	public final Colormap m_oColormap;


	Quantity(int nMode, String sName, String sSymbol, String sUnit, Colormap oColormap)
	{
		m_nMode = nMode;
		m_sName = sName;
		m_sSymbol = sSymbol;
		m_sUnit = sUnit;
		m_oColormap = oColormap;
	}


	public boolean isDivergent()
	{
		return m_oColormap.isDivergent();
	}


	/**
	 * @return name and unit in the form {@code name [unit]}
	 */
	public String getLabel()
	{
		return String.format("%s [%s]", m_sName, m_sUnit);
	}


	@Override
	public String toString()
	{
		return String.format("%d %s (%s) %s %s", m_nMode, m_sName, m_sSymbol, m_sUnit, m_oColormap.getTag());
	}
}
