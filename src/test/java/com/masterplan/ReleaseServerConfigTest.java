package com.masterplan;

import com.masterplan.geometry.ImportOptions;
import com.masterplan.tiles.TileFormat;
import com.masterplan.tiles.TileOptions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReleaseServerConfigTest {

    private static Properties completeProperties () {
        Properties properties = new Properties();
        properties.setProperty("local-storage-dir", "storage");
        properties.setProperty("jobs-dir", "jobs");
        properties.setProperty("server-port", "7070");
        properties.setProperty("allow-origin", "http://localhost:3000");
        properties.setProperty("light-threads", "4");
        properties.setProperty("heavy-threads", "2");
        properties.setProperty("tile-threads", "3");
        properties.setProperty("tile-size", "256");
        properties.setProperty("tile-overlap", "1");
        properties.setProperty("tile-format", "jpg");
        properties.setProperty("tile-quality", "85");
        properties.setProperty("max-source-pixels", "400000000");
        properties.setProperty("curve-tolerance", "0.25");
        properties.setProperty("label-precision", "1.0");
        return properties;
    }

    @Test
    void readsEveryKey () {
        ReleaseServerConfig config = new ReleaseServerConfig(completeProperties());
        assertEquals("storage", config.localStorageDirectory());
        assertEquals("jobs", config.jobsDirectory());
        assertEquals(7070, config.serverPort());
        assertEquals(2, config.heavyThreads());
        assertEquals(3, config.tileThreads());
        assertEquals(400_000_000L, config.maxSourcePixels());
        assertEquals(0.25, config.curveTolerance());

        TileOptions tileOptions = TileOptions.fromConfig(config);
        assertEquals(256, tileOptions.tileSize);
        assertEquals(TileFormat.JPEG, tileOptions.format);
        assertEquals(85, tileOptions.quality);

        ImportOptions importOptions = ImportOptions.fromConfig(config, "zone", null, "ar");
        assertEquals(1.0, importOptions.labelPrecision);
        assertEquals("zone", importOptions.overlayType);
    }

    @Test
    void reportsAllMissingAndMalformedKeysTogether () {
        Properties properties = completeProperties();
        properties.remove("tile-size");
        properties.remove("jobs-dir");
        properties.setProperty("heavy-threads", "two");
        IllegalArgumentException e =
            assertThrows(IllegalArgumentException.class, () -> new ReleaseServerConfig(properties));
        assertTrue(e.getMessage().contains("heavy-threads, jobs-dir, tile-size"), e.getMessage());
    }

    @Test
    void systemPropertiesOverrideFileValues () {
        System.setProperty("masterplan.tile.quality", "70");
        try {
            ReleaseServerConfig config = new ReleaseServerConfig(completeProperties());
            assertEquals(70, config.tileQuality());
        } finally {
            System.clearProperty("masterplan.tile.quality");
        }
    }

    @Test
    void exampleConfigFileIsComplete () {
        // Tests run in the project root, where the example file is shipped.
        ReleaseServerConfig config = ReleaseServerConfig.fromFile(ReleaseServerConfig.CONFIG_FILE);
        assertEquals(TileFormat.PNG, TileOptions.fromConfig(config).format);
        assertEquals(2, config.heavyThreads());
    }

}
