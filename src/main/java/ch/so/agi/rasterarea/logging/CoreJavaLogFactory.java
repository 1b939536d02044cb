package ch.so.agi.rasterarea.logging;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link CoreJavaLogAdaptor} per class, all at the level chosen
 * for the run. Aggregation workers may ask for loggers concurrently.
 */
public class CoreJavaLogFactory implements LogFactory {

    private final Level globalLogLevel;
    private final Map<String, AreaLogger> loggers = new ConcurrentHashMap<>();

    CoreJavaLogFactory(Level globalLogLevel) {
        this.globalLogLevel = globalLogLevel;
    }

    @Override
    public AreaLogger getLogger(Class<?> logSource) {
        return loggers.computeIfAbsent(logSource.getName(), name -> new CoreJavaLogAdaptor(logSource, globalLogLevel));
    }

    Level getLevel() {
        return globalLogLevel;
    }
}
