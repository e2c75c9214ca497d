package com.masterplan;

import com.masterplan.components.LocalReleaseServerComponents;
import com.masterplan.components.ReleaseServerComponents;
import com.masterplan.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for a release server keeping its files on the local filesystem.
 * An optional single argument names the configuration file, which defaults to release-server.properties.
 */
public abstract class ReleaseServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseServerMain.class);

    public static void main (String... args) {
        // We have several non-daemon background thread pools which will keep the JVM alive if the main thread crashes.
        // If initialization fails, we need to catch the exception or error and force JVM shutdown.
        try {
            ReleaseServerConfig config = args.length > 0
                    ? ReleaseServerConfig.fromFile(args[0])
                    : ReleaseServerConfig.fromDefaultFile();
            ReleaseServerComponents components = new LocalReleaseServerComponents(config);
            components.httpApi.awaitInitialization();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                components.httpApi.shutDown();
                components.taskScheduler.shutdown();
            }));
            LOG.info("Release server is ready.");
        } catch (Throwable throwable) {
            LOG.error("Exception while starting up release server, shutting down JVM.\n{}",
                    ExceptionUtils.stackTraceString(throwable));
            System.exit(1);
        }
    }

}
