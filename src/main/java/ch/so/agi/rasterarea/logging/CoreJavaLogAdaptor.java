package ch.so.agi.rasterarea.logging;

import java.util.logging.Logger;

/**
 * Writes {@link AreaLogger} messages to the JUL logger named after the
 * emitting class. Lifecycle maps to {@code CONFIG}, info to {@code FINE} and
 * debug to {@code FINER}, so the console shows them only once
 * {@code --log-level} lowers the threshold.
 */
public class CoreJavaLogAdaptor implements AreaLogger {

    private final Logger logger;

    CoreJavaLogAdaptor(Class<?> logSource, Level logLevel) {
        this.logger = Logger.getLogger(logSource.getName());
        this.logger.setLevel(logLevel.getInnerLevel());
    }

    @Override
    public void info(String msg) {
        logger.fine(msg);
    }

    @Override
    public void debug(String msg) {
        logger.finer(msg);
    }

    @Override
    public void error(String msg, Throwable thrown) {
        logger.log(java.util.logging.Level.SEVERE, msg, thrown);
    }

    @Override
    public void lifecycle(String msg) {
        logger.config(msg);
    }

    @Override
    public boolean isDebugEnabled() {
        return logger.isLoggable(java.util.logging.Level.FINER);
    }

    Logger getInnerLogger() {
        return logger;
    }
}
