package seisimg.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import seisimg.store.modes.QuantityKind;
import seisimg.store.modes.SourceTimeFunction;
import seisimg.system.JSONUtil;

/**
 * {@link ImageConfig} backed by a JSON document of the form
 * <pre>
 * {
 *   "quantitykind": "velocity",
 *   "source": [{"x": 1000, "y": 2000, "z": 500, "type": "Gaussian"}],
 *   "rec": [{"x": 0, "y": 0, "z": 0}, ...]
 * }
 * </pre>
 * Any member holding an array of objects with x, y and z can be queried with
 * {@link #getLocations(String)}. The declared quantity kind is
 * {@code quantitykind} when present and recognized, otherwise the kind
 * produced by the time function {@code type} of the first source.
 */
public class JsonImageConfig implements ImageConfig
{
	private static final Logger LOGGER = LogManager.getLogger(JsonImageConfig.class);


	/**
	 * The settings document
	 */
	private final JSONObject m_oConfig;


	public JsonImageConfig(JSONObject oConfig)
	{
		m_oConfig = oConfig;
	}


	/**
	 * Reads the settings document from a file
	 *
	 * @param oFile JSON file
	 * @return the configuration
	 * @throws IOException if the file cannot be read or is not a JSON object
	 */
	public static JsonImageConfig read(Path oFile)
		throws IOException
	{
		try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
		{
			return new JsonImageConfig(new JSONObject(new JSONTokener(oIn)));
		}
		catch (JSONException oEx)
		{
			throw new IOException(String.format("Invalid configuration file %s", oFile), oEx);
		}
	}


	@Override
	public List<double[]> getLocations(String sKey)
	{
		JSONArray oItems = JSONUtil.optJSONArray(m_oConfig, sKey);
		if (oItems.isEmpty())
			return Collections.emptyList();

		ArrayList<double[]> oLocations = new ArrayList(oItems.length());
		for (int nIndex = 0; nIndex < oItems.length(); nIndex++)
		{
			JSONObject oItem = oItems.optJSONObject(nIndex);
			if (oItem == null)
			{
				LOGGER.warn(String.format("Skipping %s entry %d, it is not an object", sKey, nIndex));
				continue;
			}
			double[] dXyz = JSONUtil.getDoubles(oItem, "x", "y", "z");
			if (Double.isNaN(dXyz[X]) || Double.isNaN(dXyz[Y]) || Double.isNaN(dXyz[Z]))
			{
				LOGGER.warn(String.format("Skipping %s entry %d, it does not have x, y and z", sKey, nIndex));
				continue;
			}
			oLocations.add(dXyz);
		}
		return oLocations;
	}


	@Override
	public QuantityKind getQuantityKind()
	{
		String sKind = m_oConfig.optString("quantitykind", null);
		if (sKind != null)
		{
			QuantityKind oKind = QuantityKind.fromName(sKind);
			if (oKind != null)
				return oKind;
			LOGGER.warn(String.format("Unrecognized quantitykind: %s, using the source time function", sKind));
		}

		JSONArray oSources = JSONUtil.optJSONArray(m_oConfig, "source");
		if (oSources.isEmpty())
			return null;
		JSONObject oSource = oSources.optJSONObject(0);
		if (oSource == null)
			return null;
		return SourceTimeFunction.getQuantityKind(oSource.optString("type", null));
	}
}
