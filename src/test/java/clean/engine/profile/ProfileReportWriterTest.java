package clean.engine.profile;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import clean.engine.stream.DataStream;

public class ProfileReportWriterTest {

    @Test
    void writesJsonReport() throws IOException {
        @SuppressWarnings("unchecked")
        List<ColumnProfile> profiles = (List<ColumnProfile>) new DataStream(ProfileOperatorTest.data())
            .append(new ProfileOperator())
            .run();
        Path dir = Path.of("target", "profile-reports-" + System.nanoTime());
        Path file = new ProfileReportWriter(dir, 1).writeJson("cities", profiles);
        assertTrue(Files.exists(file));
        assertTrue(file.getFileName().toString().startsWith("profile_cities_"));

        JsonObject root = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
        assertEquals("cities", root.get("dataset").getAsString());
        JsonObject city = root.getAsJsonObject("columns").getAsJsonObject("city");
        assertEquals(5, city.get("total").getAsInt());
        assertEquals(1, city.getAsJsonObject("top_values").size());
        assertEquals(2, city.getAsJsonObject("top_values").get("nyc").getAsInt());
        assertFalse(city.has("numeric"));
        JsonObject pop = root.getAsJsonObject("columns").getAsJsonObject("pop");
        assertEquals(8.0, pop.getAsJsonObject("numeric").get("max").getAsDouble());
    }
}
