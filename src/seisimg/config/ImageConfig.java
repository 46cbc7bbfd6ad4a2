package seisimg.config;

import java.util.List;
import seisimg.store.modes.QuantityKind;

/**
 * Source of simulation settings an image needs but does not store itself:
 * the positions of sources, receivers and other located objects, and the kind
 * of quantity the simulation produced. Implementations know nothing about
 * image planes; projecting the positions onto an image is done by
 * {@link seisimg.store.Image}.
 */
public interface ImageConfig
{
	/**
	 * Index of x in the arrays returned by {@link #getLocations(String)}
	 */
	public static final int X = 0;


	/**
	 * Index of y
	 */
	public static final int Y = 1;


	/**
	 * Index of z
	 */
	public static final int Z = 2;


	/**
	 * Gets the positions of every object with the given key, for example
	 * {@code source} or {@code rec}.
	 *
	 * @param sKey object key
	 * @return list of [x, y, z] arrays in simulation coordinates, empty if there
	 * are no objects for the key
	 */
	public List<double[]> getLocations(String sKey);


	/**
	 * @return the quantity kind declared by the simulation settings, or null
	 * if it cannot be determined
	 */
	public QuantityKind getQuantityKind();
}
