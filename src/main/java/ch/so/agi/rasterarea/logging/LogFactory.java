package ch.so.agi.rasterarea.logging;

/**
 * Source of loggers for {@link LogEnvironment}. Tests install their own
 * factory through {@link LogEnvironment#setLogFactory(LogFactory)}.
 */
public interface LogFactory {

    /**
     * @param logSource class that emits the messages, used as logger name
     * @return logger for {@code logSource}
     */
    public AreaLogger getLogger(Class<?> logSource);
}
