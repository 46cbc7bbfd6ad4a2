package seisimg.store;

import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.SimpleTimeZone;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import seisimg.config.ImageConfig;
import seisimg.store.modes.Colormap;
import seisimg.store.modes.Quantity;
import seisimg.store.modes.QuantityKind;

/**
 * A decoded simulation image: a map view (plane of constant Z) or a cross
 * section (plane of constant X or Y) through the 3-D solution at one time
 * step. The image owns its {@link Patch}es, one per grid resolution, kept in
 * file order.
 * <p>
 * Images are built by {@link ImageReader} and are not modified after they are
 * returned, so they can be read by many threads at once.
 * </p>
 */
public class Image
{
	/**
	 * Plane code of images with constant X
	 */
	public static final int PLANE_X = 0;


	/**
	 * Plane code of images with constant Y
	 */
	public static final int PLANE_Y = 1;


	/**
	 * Plane code of images with constant Z
	 */
	public static final int PLANE_Z = 2;


	/**
	 * Labels of the axis held constant, indexed by plane code
	 */
	public static final String[] PLANES = new String[]{"X", "Y", "Z"};


	/**
	 * [horizontal, vertical] plot axis labels, indexed by plane code
	 */
	private static final String[][] AXIS_LABELS = new String[][]
	{
		{"Y", "Z"}, {"X", "Z"}, {"Y", "X"}
	};


	/**
	 * Precision code of images stored with 4 byte floats
	 */
	public static final int SINGLE = 4;


	/**
	 * Precision code of images stored with 8 byte floats
	 */
	public static final int DOUBLE = 8;


	/**
	 * Mode codes of quantities that usually increase with depth
	 */
	private static final int[] DEPTH_INCREASING_MODES = new int[]{4, 7, 8};


	/**
	 * Size in bytes of the image header record
	 */
	public static final int HEADER_SIZE = 61;


	/**
	 * Width in bytes of the creation time text at the end of the header
	 */
	public static final int CREATION_TIME_LENGTH = 25;


	/**
	 * Format of the creation time text after repeated spaces are collapsed
	 */
	private static final String CREATION_TIME_FORMAT = "EEE MMM d HH:mm:ss yyyy";


	private static final Logger LOGGER = LogManager.getLogger(Image.class);


	/**
	 * Path the image was read from, null for images not read from a file
	 */
	public final String m_sFilename;


	/**
	 * Width in bytes of each sample, {@link #SINGLE} or {@link #DOUBLE}
	 */
	public final int m_nPrecision;


	/**
	 * Simulation time of the image in seconds
	 */
	public final double m_dTime;


	/**
	 * Plane code, {@link #PLANE_X}, {@link #PLANE_Y} or {@link #PLANE_Z}
	 */
	public final int m_nPlane;


	/**
	 * Value of the constant coordinate of the plane
	 */
	public final double m_dCoordinate;


	/**
	 * Mode code, meaningful only together with {@link #m_oQuantityKind}
	 */
	public final int m_nMode;


	/**
	 * Grid information flag written by the simulator
	 */
	public final int m_nGridInfo;


	/**
	 * Creation time text as stored in the file
	 */
	public final String m_sCreationTime;


	/**
	 * Creation time in milliseconds since Epoch, {@code Long.MIN_VALUE} if the
	 * creation time text could not be parsed
	 */
	public final long m_lCreationTime;


	/**
	 * Table used to look up the quantity of {@link #m_nMode}
	 */
	public final QuantityKind m_oQuantityKind;


	/**
	 * Simulation settings used for overlay positions, may be null
	 */
	private final ImageConfig m_oConfig;


	/**
	 * Patches in file order
	 */
	private final ArrayList<Patch> m_oPatches;


	/**
	 * Constructs an image without patches. Patches are added by
	 * {@link #addPatch(Patch)} while the image is decoded.
	 *
	 * @param sFilename source path, may be null
	 * @param nPrecision sample width, 4 or 8
	 * @param nPatchCount number of patches the image will hold
	 * @param dTime simulation time
	 * @param nPlane plane code
	 * @param dCoordinate constant coordinate of the plane
	 * @param nMode mode code
	 * @param nGridInfo grid information flag
	 * @param sCreationTime creation time text
	 * @param oKind quantity kind
	 * @param oConfig simulation settings, may be null
	 * @throws ImageFormatException if the precision or plane code is invalid
	 */
	Image(String sFilename, int nPrecision, int nPatchCount, double dTime, int nPlane,
		double dCoordinate, int nMode, int nGridInfo, String sCreationTime, QuantityKind oKind, ImageConfig oConfig)
		throws ImageFormatException
	{
		checkPrecision(nPrecision);
		checkPlane(nPlane);
		m_sFilename = sFilename;
		m_nPrecision = nPrecision;
		m_dTime = dTime;
		m_nPlane = nPlane;
		m_dCoordinate = dCoordinate;
		m_nMode = nMode;
		m_nGridInfo = nGridInfo;
		m_sCreationTime = sCreationTime == null ? "" : sCreationTime;
		m_lCreationTime = parseCreationTime(m_sCreationTime);
		m_oQuantityKind = oKind;
		m_oConfig = oConfig;
		m_oPatches = new ArrayList(Math.max(nPatchCount, 0));
	}


	/**
	 * @throws ImageFormatException with reason {@code INVALID_PRECISION} if the
	 * precision code is not 4 or 8
	 */
	static void checkPrecision(int nPrecision)
		throws ImageFormatException
	{
		if (nPrecision != SINGLE && nPrecision != DOUBLE)
			throw new ImageFormatException(ImageFormatException.Reason.INVALID_PRECISION,
				String.format("Precision code %d is not %d or %d", nPrecision, SINGLE, DOUBLE));
	}


	/**
	 * @throws ImageFormatException with reason {@code INVALID_PLANE} if the
	 * plane code is not 0, 1 or 2
	 */
	static void checkPlane(int nPlane)
		throws ImageFormatException
	{
		if (nPlane < PLANE_X || nPlane > PLANE_Z)
			throw new ImageFormatException(ImageFormatException.Reason.INVALID_PLANE,
				String.format("Plane code %d is not %d, %d or %d", nPlane, PLANE_X, PLANE_Y, PLANE_Z));
	}


	/**
	 * Decides which quantity table applies. When both an explicit kind and
	 * the kind declared by the configuration are available and they differ,
	 * the configuration wins and a warning is logged.
	 *
	 * @param oExplicit kind requested by the caller, may be null
	 * @param oConfig simulation settings, may be null
	 * @return the kind to use
	 * @throws ImageFormatException with reason {@code UNKNOWN_QUANTITY_KIND}
	 * if neither source gives a kind
	 */
	public static QuantityKind resolveQuantityKind(QuantityKind oExplicit, ImageConfig oConfig)
		throws ImageFormatException
	{
		QuantityKind oKind = oExplicit;
		if (oConfig != null)
		{
			QuantityKind oConfigured = oConfig.getQuantityKind();
			if (oConfigured != null)
			{
				if (oExplicit != null && oExplicit != oConfigured)
					LOGGER.warn(String.format("Overriding user specified source time function type (%s) with the one found in configuration (%s).",
						oExplicit.getName(), oConfigured.getName()));
				oKind = oConfigured;
			}
		}
		if (oKind == null)
			throw new ImageFormatException(ImageFormatException.Reason.UNKNOWN_QUANTITY_KIND,
				"Source time function type was not given and could not be found in the configuration");

		return oKind;
	}


	private static long parseCreationTime(String sCreationTime)
	{
		if (sCreationTime.isEmpty())
			return Long.MIN_VALUE;

		SimpleDateFormat oFormat = new SimpleDateFormat(CREATION_TIME_FORMAT, Locale.US);
		oFormat.setTimeZone(new SimpleTimeZone(0, ""));
		try
		{
			return oFormat.parse(sCreationTime.replaceAll("\\s+", " ")).getTime();
		}
		catch (ParseException oEx)
		{
			LOGGER.debug(String.format("Unparseable creation time: %s", sCreationTime));
			return Long.MIN_VALUE;
		}
	}


	/**
	 * Appends a patch. Only called while the image is being built.
	 */
	void addPatch(Patch oPatch)
	{
		m_oPatches.add(oPatch);
	}


	/**
	 * @return unmodifiable view of the patches in file order
	 */
	public List<Patch> getPatches()
	{
		return Collections.unmodifiableList(m_oPatches);
	}


	public Patch getPatch(int nNumber)
	{
		return m_oPatches.get(nNumber);
	}


	public int getNumberOfPatches()
	{
		return m_oPatches.size();
	}


	/**
	 * @return true for planes of constant X or Y, false for maps
	 */
	public boolean isCrossSection()
	{
		return m_nPlane == PLANE_X || m_nPlane == PLANE_Y;
	}


	/**
	 * @return "cross-section" or "map"
	 */
	public String getType()
	{
		return isCrossSection() ? "cross-section" : "map";
	}


	/**
	 * @return sample width in bytes
	 */
	public int getPrecision()
	{
		return m_nPrecision;
	}


	/**
	 * @return label of the axis held constant, "X", "Y" or "Z"
	 */
	public String getPlane()
	{
		return PLANES[m_nPlane];
	}


	/**
	 * @return [horizontal, vertical] labels of the plot axes
	 */
	public String[] getAxisLabels()
	{
		return AXIS_LABELS[m_nPlane].clone();
	}


	/**
	 * Looks up the quantity stored in the image.
	 *
	 * @return the quantity for the image's mode code
	 * @throws ImageFormatException with reason {@code UNKNOWN_MODE} if the mode
	 * code is not defined for the image's quantity kind
	 */
	public Quantity getQuantity()
		throws ImageFormatException
	{
		return m_oQuantityKind.getQuantity(m_nMode);
	}


	public String getQuantityName()
		throws ImageFormatException
	{
		return getQuantity().m_sName;
	}


	public String getQuantitySymbol()
		throws ImageFormatException
	{
		return getQuantity().m_sSymbol;
	}


	public String getQuantityUnit()
		throws ImageFormatException
	{
		return getQuantity().m_sUnit;
	}


	public Colormap getColormap()
		throws ImageFormatException
	{
		return getQuantity().m_oColormap;
	}


	/**
	 * @return true if the quantity is displayed with a color map centered on
	 * zero
	 * @throws ImageFormatException if the mode code is unknown
	 */
	public boolean isDivergent()
		throws ImageFormatException
	{
		return getColormap().isDivergent();
	}


	/**
	 * Cross sections of density and wave velocities are displayed with the
	 * color bar inverted, since those quantities increase with depth.
	 *
	 * @return true if the color bar should be inverted
	 */
	public boolean isColorbarInverted()
	{
		if (!isCrossSection())
			return false;
		for (int nMode : DEPTH_INCREASING_MODES)
		{
			if (nMode == m_nMode)
				return true;
		}
		return false;
	}


	/**
	 * Projects the configured positions for a key onto the plot axes of this
	 * image: planes of constant X use (y, z), constant Y use (x, z) and
	 * constant Z use (y, x).
	 *
	 * @param sKey configuration key, for example {@code source} or {@code rec}
	 * @return [horizontal values, vertical values], or null if there is no
	 * configuration or no position for the key
	 */
	public double[][] getPlotCoordinates(String sKey)
	{
		if (m_oConfig == null)
			return null;
		List<double[]> oItems = m_oConfig.getLocations(sKey);
		if (oItems == null || oItems.isEmpty())
			return null;

		int nHorizontal;
		int nVertical;
		switch (m_nPlane)
		{
			case PLANE_X:
				nHorizontal = ImageConfig.Y;
				nVertical = ImageConfig.Z;
				break;
			case PLANE_Y:
				nHorizontal = ImageConfig.X;
				nVertical = ImageConfig.Z;
				break;
			default:
				nHorizontal = ImageConfig.Y;
				nVertical = ImageConfig.X;
		}

		double[][] dCoords = new double[2][oItems.size()];
		int nIndex = 0;
		for (double[] dXyz : oItems)
		{
			dCoords[0][nIndex] = dXyz[nHorizontal];
			dCoords[1][nIndex++] = dXyz[nVertical];
		}
		return dCoords;
	}


	public double[][] getSourceCoordinates()
	{
		return getPlotCoordinates("source");
	}


	@Override
	public String toString()
	{
		return String.format("%s %s=%s t=%.2f precision=%d patches=%d mode=%d (%s)",
			getType(), getPlane(), Double.toString(m_dCoordinate), m_dTime, m_nPrecision,
			m_oPatches.size(), m_nMode, m_oQuantityKind.getName());
	}
}
