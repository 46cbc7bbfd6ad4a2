package seisimg.store.modes;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps the source time function names used in simulation input files to the
 * kind of quantity the simulation outputs. Integrated pulses (step like
 * functions) make the solution a displacement, their derivatives make it a
 * velocity.
 */
public abstract class SourceTimeFunction
{
	/**
	 * [time function name, 0 = displacement 1 = velocity]
	 */
	private static final String[][] FUNCTIONS = new String[][]
	{
		{"GaussianInt", "0"},
		{"Gaussian", "1"},
		{"RickerInt", "0"},
		{"Ricker", "1"},
		{"Ramp", "0"},
		{"Triangle", "1"},
		{"Sawtooth", "1"},
		{"SmoothWave", "1"},
		{"Erf", "0"},
		{"VerySmoothBump", "1"},
		{"Brune", "0"},
		{"BruneSmoothed", "0"},
		{"DBrune", "1"},
		{"GaussianWindow", "1"},
		{"Liu", "0"},
		{"NullFunc", "0"},
		{"Dirac", "1"},
		{"C6SmoothBump", "1"}
	};


	private static final Map<String, QuantityKind> KINDS;
	static
	{
		TreeMap<String, QuantityKind> oKinds = new TreeMap(String.CASE_INSENSITIVE_ORDER);
		for (String[] sFunc : FUNCTIONS)
			oKinds.put(sFunc[0], Integer.parseInt(sFunc[1]) == 0 ? QuantityKind.DISPLACEMENT : QuantityKind.VELOCITY);
		KINDS = Collections.unmodifiableMap(oKinds);
	}


	private SourceTimeFunction()
	{
	}


	/**
	 * Gets the quantity kind produced by the named source time function.
	 *
	 * @param sName time function name, case insensitive
	 * @return the kind or null if the name is null or not a known function
	 */
	public static QuantityKind getQuantityKind(String sName)
	{
		if (sName == null)
			return null;
		return KINDS.get(sName.trim());
	}
}
