package com.masterplan;

import com.masterplan.components.HttpApi;
import com.masterplan.components.TaskScheduler;
import com.masterplan.file.LocalFileStorage;
import com.masterplan.jobs.JobStore;
import com.masterplan.jobs.PublishPipeline;

import java.util.Properties;

/** Loads config information for the release server and exposes it to the Components. */
public class ReleaseServerConfig extends ConfigBase implements
        TaskScheduler.Config,
        LocalFileStorage.Config,
        JobStore.Config,
        PublishPipeline.Config,
        HttpApi.Config
{

    public static final String CONFIG_FILE = "release-server.properties";

    private final String localStorageDirectory;
    private final String jobsDirectory;
    private final int serverPort;
    private final String allowOrigin;
    private final int lightThreads;
    private final int heavyThreads;
    private final int tileThreads;
    private final int tileSize;
    private final int tileOverlap;
    private final String tileFormat;
    private final int tileQuality;
    private final long maxSourcePixels;
    private final double curveTolerance;
    private final double labelPrecision;

    private ReleaseServerConfig (String filename) {
        this(propsFromFile(filename));
    }

    protected ReleaseServerConfig (Properties properties) {
        super(properties);
        // We intentionally don't supply any defaults here.
        // Any 'defaults' should be shipped in an example config file.
        localStorageDirectory = strProp("local-storage-dir");
        jobsDirectory = strProp("jobs-dir");
        serverPort = intProp("server-port");
        allowOrigin = strProp("allow-origin");
        lightThreads = intProp("light-threads");
        heavyThreads = intProp("heavy-threads");
        tileThreads = intProp("tile-threads");
        tileSize = intProp("tile-size");
        tileOverlap = intProp("tile-overlap");
        tileFormat = strProp("tile-format");
        tileQuality = intProp("tile-quality");
        maxSourcePixels = longProp("max-source-pixels");
        curveTolerance = doubleProp("curve-tolerance");
        labelPrecision = doubleProp("label-precision");
        checkForErrors();
    }

    // Methods implementing Component Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public String localStorageDirectory () { return localStorageDirectory; }
    @Override public String jobsDirectory ()         { return jobsDirectory; }
    @Override public int    serverPort ()            { return serverPort; }
    @Override public String allowOrigin ()           { return allowOrigin; }
    @Override public int    lightThreads ()          { return lightThreads; }
    @Override public int    heavyThreads ()          { return heavyThreads; }
    @Override public int    tileThreads ()           { return tileThreads; }
    @Override public int    tileSize ()              { return tileSize; }
    @Override public int    tileOverlap ()           { return tileOverlap; }
    @Override public String tileFormat ()            { return tileFormat; }
    @Override public int    tileQuality ()           { return tileQuality; }
    @Override public long   maxSourcePixels ()       { return maxSourcePixels; }
    @Override public double curveTolerance ()        { return curveTolerance; }
    @Override public double labelPrecision ()        { return labelPrecision; }

    public static ReleaseServerConfig fromDefaultFile () {
        return new ReleaseServerConfig(CONFIG_FILE);
    }

    public static ReleaseServerConfig fromFile (String filename) {
        return new ReleaseServerConfig(filename);
    }

}
