package ch.so.agi.rasterarea.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

/**
 * Central access point for logging. The environment lazily initialises a
 * {@link LogFactory} that supplies {@link AreaLogger} instances backed by
 * {@code java.util.logging}.
 */
public class LogEnvironment {

    private static final String LOGGING_PROPERTIES = "/logging.properties";

    private static LogFactory currentLogFactory = null;

    /**
     * Replaces the global factory. Mostly intended for tests.
     *
     * @param factory the {@link LogFactory} to use from now on
     */
    public static void setLogFactory(LogFactory factory) {
        currentLogFactory = factory;
    }

    /**
     * Initialises the environment for command line use: the console handler
     * configuration is read from {@code logging.properties} on the classpath so
     * lifecycle and info messages are printed, then the factory is set to the
     * given level.
     *
     * @param logLevel desired minimum log level
     * @throws IOException if the bundled logging configuration cannot be read
     */
    public static void initCommandLine(Level logLevel) throws IOException {
        try (InputStream in = LogEnvironment.class.getResourceAsStream(LOGGING_PROPERTIES)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
        setLogFactory(new CoreJavaLogFactory(logLevel));
    }

    /**
     * Returns a logger for the given class, lazily selecting the
     * {@code java.util.logging} factory at {@link Level#DEBUG} when none has
     * been configured yet.
     *
     * @param logSource the class requesting logging
     * @return a configured {@link AreaLogger}
     * @throws IllegalArgumentException if {@code logSource} is {@code null}
     */
    public static AreaLogger getLogger(Class<?> logSource) {
        if (currentLogFactory == null) {
            setLogFactory(new CoreJavaLogFactory(Level.DEBUG));
        }
        if (logSource == null)
            throw new IllegalArgumentException("The logSource must not be null");

        return currentLogFactory.getLogger(logSource);
    }
}
