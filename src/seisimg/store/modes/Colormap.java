package seisimg.store.modes;

/**
 * Color map families a quantity can be displayed with. Divergent families are
 * centered on zero, sequential families run from the minimum to the maximum.
 */
public enum Colormap
{
	DIVERGENT("divergent"),
	DIVERGENT_R("divergent_r"),
	SEQUENTIAL("sequential"),
	SEQUENTIAL_R("sequential_r");


	/**
	 * Name used in the mode tables and by renderers
	 */
	private final String m_sTag;


	private Colormap(String sTag)
	{
		m_sTag = sTag;
	}


	public String getTag()
	{
		return m_sTag;
	}


	public boolean isDivergent()
	{
		return this == DIVERGENT || this == DIVERGENT_R;
	}


	public boolean isReversed()
	{
		return this == DIVERGENT_R || this == SEQUENTIAL_R;
	}


	/**
	 * Gets the color map family with the given tag
	 * @param sTag one of divergent, divergent_r, sequential, sequential_r
	 * @return the matching family
	 * @throws IllegalArgumentException if the tag is unknown
	 */
	public static Colormap fromTag(String sTag)
	{
		for (Colormap oMap : values())
		{
			if (oMap.m_sTag.equals(sTag))
				return oMap;
		}
		throw new IllegalArgumentException("Unknown color map type: " + sTag);
	}
}
