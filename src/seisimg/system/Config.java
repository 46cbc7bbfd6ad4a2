package seisimg.system;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Singleton that loads the JSON configuration documents used by the system
 * components. Each component asks for its configuration by one or more names,
 * usually its fully qualified class name followed by a short instance name.
 * A name maps to the file {@code <config dir>/<name with '.' replaced by '_'>.json}.
 * Documents are merged in the order the names are given so later documents
 * overwrite keys of earlier ones.
 * <p>
 * The configuration directory is taken from the {@code seisimg.config.dir}
 * system property. When it is not set, or a named document does not exist in
 * it, the classpath resource {@code /seisimg.json} is consulted. That resource
 * holds one JSON object per configuration name.
 * </p>
 */
public class Config
{
	/**
	 * System property that names the configuration directory
	 */
	public static final String CONFIG_DIR_PROPERTY = "seisimg.config.dir";


	/**
	 * Classpath resource holding the default configuration
	 */
	public static final String DEFAULT_RESOURCE = "/seisimg.json";


	/**
	 * Singleton instance
	 */
	private static final Config g_oConfig = new Config();


	/**
	 * Defaults read from {@link #DEFAULT_RESOURCE}, keyed by configuration name
	 */
	private final JSONObject m_oDefaults;


	private final Logger m_oLogger = LogManager.getLogger(Config.class);


	/**
	 * Loads the default configuration resource if it exists
	 */
	private Config()
	{
		JSONObject oDefaults = new JSONObject();
		try (InputStream oIn = Config.class.getResourceAsStream(DEFAULT_RESOURCE))
		{
			if (oIn != null)
				oDefaults = new JSONObject(new JSONTokener(new InputStreamReader(oIn, StandardCharsets.UTF_8)));
		}
		catch (IOException oEx)
		{
			m_oLogger.error(oEx, oEx);
		}
		m_oDefaults = oDefaults;
	}


	/**
	 * Gets the singleton Config instance
	 * @return singleton Config instance
	 */
	public static Config getInstance()
	{
		return g_oConfig;
	}


	/**
	 * Builds a new JSONObject containing the merged configuration of the given
	 * names.
	 *
	 * @param sConfigNames configuration names, in increasing precedence
	 * @return the merged configuration, empty if nothing was found
	 */
	public JSONObject getConfig(String... sConfigNames)
	{
		JSONObject oConfig = new JSONObject();
		getConfig(oConfig, sConfigNames);
		return oConfig;
	}


	/**
	 * Merges the configuration of the given names into {@code oConfigObj}. If
	 * the merged configuration contains an {@code extraconfigs} array those
	 * names are merged afterwards, unless one of them is already being loaded.
	 *
	 * @param oConfigObj object the configuration is merged into
	 * @param sConfigNames configuration names, in increasing precedence
	 */
	public void getConfig(JSONObject oConfigObj, String... sConfigNames)
	{
		String sDir = System.getProperty(CONFIG_DIR_PROPERTY);
		if (sDir != null && sDir.endsWith("/"))
			sDir = sDir.substring(0, sDir.length() - 1);

		for (String sConfig : sConfigNames)
		{
			JSONObject oDefault = m_oDefaults.optJSONObject(sConfig);
			if (oDefault != null)
				merge(oConfigObj, oDefault);

			if (sDir == null)
				continue;
			Path oFile = Paths.get(String.format("%s/%s.json", sDir, sConfig.replace('.', '_')));
			if (!Files.exists(oFile))
				continue;
			try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
			{
				merge(oConfigObj, new JSONObject(new JSONTokener(oIn)));
			}
			catch (IOException oEx)
			{
				m_oLogger.error(String.format("Failed to load configuration for %s", sConfig));
				m_oLogger.error(oEx, oEx);
			}
		}

		String[] sExtraConfigs = JSONUtil.getStringArray(oConfigObj, "extraconfigs");
		if (sExtraConfigs.length == 0)
			return;
		for (String sExtra : sExtraConfigs)
		{
			for (String sConfig : sConfigNames)
			{
				if (sExtra.compareTo(sConfig) == 0)
					return;
			}
		}
		oConfigObj.remove("extraconfigs");
		getConfig(oConfigObj, sExtraConfigs);
	}


	private static void merge(JSONObject oConfigObj, JSONObject oOverWrite)
	{
		for (String sKey : oOverWrite.keySet())
			oConfigObj.put(sKey, oOverWrite.get(sKey));
	}
}
