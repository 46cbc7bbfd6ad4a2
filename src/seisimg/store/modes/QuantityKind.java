package seisimg.store.modes;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import seisimg.store.ImageFormatException;

/**
 * The kind of quantity a simulation produced, decided by its source time
 * function. Each kind carries its own table mapping image mode codes to the
 * quantity the samples represent. A displacement simulation stores
 * displacement in its solution components, a velocity simulation stores
 * velocity, so the same mode code names a different quantity in each table.
 */
public enum QuantityKind
{
	DISPLACEMENT(new String[][]
	{
		{"1", "X displacement", "ux", "m", "divergent"},
		{"2", "Y displacement", "uy", "m", "divergent"},
		{"3", "Z displacement", "uz", "m", "divergent"},
		{"4", "Density", "rho", "kg/m^3", "sequential_r"},
		{"5", "Lambda", "lambda", "Pa", "sequential_r"},
		{"6", "Mu", "mu", "Pa", "sequential_r"},
		{"7", "P wave velocity", "Vp", "m/s", "sequential_r"},
		{"8", "S wave velocity", "Vs", "m/s", "sequential_r"},
		{"9", "Exact X displacement", "ux_exact", "m", "divergent"},
		{"10", "Exact Y displacement", "uy_exact", "m", "divergent"},
		{"11", "Exact Z displacement", "uz_exact", "m", "divergent"},
		{"12", "Divergence of displacement", "div(u)", "", "divergent"},
		{"13", "Curl of displacement magnitude", "|curl(u)|", "", "sequential"},
		{"14", "Divergence of velocity", "div(du/dt)", "1/s", "divergent"},
		{"15", "Curl of velocity magnitude", "|curl(du/dt)|", "1/s", "sequential"},
		{"16", "Latitude", "lat", "deg", "sequential"},
		{"17", "Longitude", "lon", "deg", "sequential"},
		{"18", "Topography", "topo", "m", "sequential"},
		{"19", "X", "x", "m", "sequential"},
		{"20", "Y", "y", "m", "sequential"},
		{"21", "Z", "z", "m", "sequential"},
		{"22", "X displacement error", "ux_err", "m", "divergent"},
		{"23", "Y displacement error", "uy_err", "m", "divergent"},
		{"24", "Z displacement error", "uz_err", "m", "divergent"},
		{"25", "Velocity magnitude", "|du/dt|", "m/s", "sequential"},
		{"26", "Horizontal velocity magnitude", "|du/dt|_h", "m/s", "sequential"},
		{"27", "Peak horizontal velocity", "PGV_h", "m/s", "sequential"},
		{"28", "Peak vertical velocity", "PGV_v", "m/s", "sequential"},
		{"29", "Displacement magnitude", "|u|", "m", "sequential"},
		{"30", "Horizontal displacement magnitude", "|u|_h", "m", "sequential"},
		{"31", "Peak horizontal displacement", "PGD_h", "m", "sequential"},
		{"32", "Peak vertical displacement", "PGD_v", "m", "sequential"},
		{"33", "Density gradient", "grad(rho)", "kg/m^4", "divergent"},
		{"34", "Mu gradient", "grad(mu)", "Pa/m", "divergent"},
		{"35", "Lambda gradient", "grad(lambda)", "Pa/m", "divergent"},
		{"36", "P wave velocity gradient", "grad(Vp)", "1/s", "divergent"},
		{"37", "S wave velocity gradient", "grad(Vs)", "1/s", "divergent"},
		{"38", "P wave quality factor", "Qp", "", "sequential"},
		{"39", "S wave quality factor", "Qs", "", "sequential"}
	}),

	VELOCITY(new String[][]
	{
		{"1", "X velocity", "vx", "m/s", "divergent"},
		{"2", "Y velocity", "vy", "m/s", "divergent"},
		{"3", "Z velocity", "vz", "m/s", "divergent"},
		{"4", "Density", "rho", "kg/m^3", "sequential_r"},
		{"5", "Lambda", "lambda", "Pa", "sequential_r"},
		{"6", "Mu", "mu", "Pa", "sequential_r"},
		{"7", "P wave velocity", "Vp", "m/s", "sequential_r"},
		{"8", "S wave velocity", "Vs", "m/s", "sequential_r"},
		{"9", "Exact X velocity", "vx_exact", "m/s", "divergent"},
		{"10", "Exact Y velocity", "vy_exact", "m/s", "divergent"},
		{"11", "Exact Z velocity", "vz_exact", "m/s", "divergent"},
		{"12", "Divergence of velocity", "div(v)", "1/s", "divergent"},
		{"13", "Curl of velocity magnitude", "|curl(v)|", "1/s", "sequential"},
		{"14", "Divergence of acceleration", "div(dv/dt)", "1/s^2", "divergent"},
		{"15", "Curl of acceleration magnitude", "|curl(dv/dt)|", "1/s^2", "sequential"},
		{"16", "Latitude", "lat", "deg", "sequential"},
		{"17", "Longitude", "lon", "deg", "sequential"},
		{"18", "Topography", "topo", "m", "sequential"},
		{"19", "X", "x", "m", "sequential"},
		{"20", "Y", "y", "m", "sequential"},
		{"21", "Z", "z", "m", "sequential"},
		{"22", "X velocity error", "vx_err", "m/s", "divergent"},
		{"23", "Y velocity error", "vy_err", "m/s", "divergent"},
		{"24", "Z velocity error", "vz_err", "m/s", "divergent"},
		{"25", "Acceleration magnitude", "|dv/dt|", "m/s^2", "sequential"},
		{"26", "Horizontal acceleration magnitude", "|dv/dt|_h", "m/s^2", "sequential"},
		{"27", "Peak horizontal acceleration", "PGA_h", "m/s^2", "sequential"},
		{"28", "Peak vertical acceleration", "PGA_v", "m/s^2", "sequential"},
		{"29", "Velocity magnitude", "|v|", "m/s", "sequential"},
		{"30", "Horizontal velocity magnitude", "|v|_h", "m/s", "sequential"},
		{"31", "Peak horizontal velocity", "PGV_h", "m/s", "sequential"},
		{"32", "Peak vertical velocity", "PGV_v", "m/s", "sequential"},
		{"33", "Density gradient", "grad(rho)", "kg/m^4", "divergent"},
		{"34", "Mu gradient", "grad(mu)", "Pa/m", "divergent"},
		{"35", "Lambda gradient", "grad(lambda)", "Pa/m", "divergent"},
		{"36", "P wave velocity gradient", "grad(Vp)", "1/s", "divergent"},
		{"37", "S wave velocity gradient", "grad(Vs)", "1/s", "divergent"},
		{"38", "P wave quality factor", "Qp", "", "sequential"},
		{"39", "S wave quality factor", "Qs", "", "sequential"}
	});


	/**
	 * Mode code to quantity lookup, unmodifiable
	 */
	private final Map<Integer, Quantity> m_oModes;


	/**
	 * Builds the lookup table. Each row is [mode code, name, symbol, unit,
	 * color map tag].
	 */
	private QuantityKind(String[][] sTable)
	{
		TreeMap<Integer, Quantity> oModes = new TreeMap();
		for (String[] sRow : sTable)
		{
			int nMode = Integer.parseInt(sRow[0]);
			oModes.put(nMode, new Quantity(nMode, sRow[1], sRow[2], sRow[3], Colormap.fromTag(sRow[4])));
		}
		m_oModes = Collections.unmodifiableMap(oModes);
	}


	/**
	 * Looks up the quantity for a mode code in this kind's table.
	 *
	 * @param nMode image mode code
	 * @return the quantity
	 * @throws ImageFormatException with reason {@code UNKNOWN_MODE} if the code
	 * is not in the table
	 */
	public Quantity getQuantity(int nMode)
		throws ImageFormatException
	{
		Quantity oQuantity = m_oModes.get(nMode);
		if (oQuantity == null)
			throw new ImageFormatException(ImageFormatException.Reason.UNKNOWN_MODE,
				String.format("Mode %d is not defined for %s images", nMode, getName()));

		return oQuantity;
	}


	public boolean hasMode(int nMode)
	{
		return m_oModes.containsKey(nMode);
	}


	/**
	 * @return every quantity of this kind ordered by mode code
	 */
	public Map<Integer, Quantity> getModes()
	{
		return m_oModes;
	}


	/**
	 * @return lower case name, as used in configuration files
	 */
	public String getName()
	{
		return name().toLowerCase();
	}


	/**
	 * Gets the quantity kind with the given name, ignoring case
	 * @param sName displacement or velocity
	 * @return the matching kind or null if the name is null or unknown
	 */
	public static QuantityKind fromName(String sName)
	{
		if (sName == null)
			return null;

		for (QuantityKind oKind : values())
		{
			if (oKind.name().equalsIgnoreCase(sName.trim()))
				return oKind;
		}
		return null;
	}
}
