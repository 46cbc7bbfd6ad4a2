package seisimg.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import seisimg.store.modes.QuantityKind;

import static org.junit.jupiter.api.Assertions.*;

public class JsonImageConfigTest
{
	@TempDir
	Path m_oDir;


	@Test
	public void locationsSkipIncompleteEntries()
	{
		JsonImageConfig oConfig = new JsonImageConfig(new JSONObject("{\"rec\": ["
			+ "{\"x\": 1, \"y\": 2, \"z\": 3}, 5, {\"x\": 1, \"y\": 2}, {\"x\": -4, \"y\": 0.5, \"z\": 0}]}"));

		List<double[]> oLocations = oConfig.getLocations("rec");
		assertEquals(2, oLocations.size());
		assertArrayEquals(new double[]{1, 2, 3}, oLocations.get(0));
		assertArrayEquals(new double[]{-4, 0.5, 0}, oLocations.get(1));
		assertTrue(oConfig.getLocations("source").isEmpty());
	}


	@Test
	public void declaredKindWins()
	{
		JsonImageConfig oConfig = new JsonImageConfig(new JSONObject(
			"{\"quantitykind\": \"Displacement\", \"source\": [{\"x\": 0, \"y\": 0, \"z\": 0, \"type\": \"Ricker\"}]}"));

		assertEquals(QuantityKind.DISPLACEMENT, oConfig.getQuantityKind());
		assertNull(new JsonImageConfig(new JSONObject("{\"quantitykind\": \"strain\"}")).getQuantityKind());
	}


	@Test
	public void unrecognizedDeclaredKindFallsBackToSource()
	{
		JsonImageConfig oConfig = new JsonImageConfig(new JSONObject(
			"{\"quantitykind\": \"strain\", \"source\": [{\"x\": 0, \"y\": 0, \"z\": 0, \"type\": \"Brune\"}]}"));

		assertEquals(QuantityKind.DISPLACEMENT, oConfig.getQuantityKind());
	}


	@Test
	public void kindFollowsFirstSourceTimeFunction()
	{
		assertEquals(QuantityKind.VELOCITY, new JsonImageConfig(new JSONObject(
			"{\"source\": [{\"type\": \"Ricker\"}, {\"type\": \"RickerInt\"}]}")).getQuantityKind());
		assertEquals(QuantityKind.DISPLACEMENT, new JsonImageConfig(new JSONObject(
			"{\"source\": [{\"type\": \"GaussianInt\"}]}")).getQuantityKind());
		assertNull(new JsonImageConfig(new JSONObject("{\"source\": [{\"x\": 0}]}")).getQuantityKind());
		assertNull(new JsonImageConfig(new JSONObject("{}")).getQuantityKind());
	}


	@Test
	public void readsFiles()
		throws IOException
	{
		Path oFile = m_oDir.resolve("run.json");
		Files.write(oFile, "{\"source\": [{\"x\": 10, \"y\": 20, \"z\": 30, \"type\": \"Liu\"}]}".getBytes(StandardCharsets.UTF_8));

		JsonImageConfig oConfig = JsonImageConfig.read(oFile);
		assertEquals(QuantityKind.DISPLACEMENT, oConfig.getQuantityKind());
		assertArrayEquals(new double[]{10, 20, 30}, oConfig.getLocations("source").get(0));
	}


	@Test
	public void malformedFilesFail()
		throws IOException
	{
		Path oFile = m_oDir.resolve("bad.json");
		Files.write(oFile, "[1, 2".getBytes(StandardCharsets.UTF_8));

		assertThrows(IOException.class, () -> JsonImageConfig.read(oFile));
		assertThrows(IOException.class, () -> JsonImageConfig.read(m_oDir.resolve("missing.json")));
	}
}
