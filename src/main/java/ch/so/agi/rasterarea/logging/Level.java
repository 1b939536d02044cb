package ch.so.agi.rasterarea.logging;

import java.util.Locale;

/**
 * Adapts the semantic log levels of {@link AreaLogger} to
 * {@link java.util.logging.Level} values. The mapping preserves the intention
 * of each level even though the underlying names differ (e.g. {@code INFO}
 * corresponds to {@link java.util.logging.Level#FINE}).
 */
public class Level {

    public static final Level ERROR = new Level(java.util.logging.Level.SEVERE);
    public static final Level LIFECYCLE = new Level(java.util.logging.Level.CONFIG);
    public static final Level INFO = new Level(java.util.logging.Level.FINE);
    public static final Level DEBUG = new Level(java.util.logging.Level.FINER);

    private final java.util.logging.Level innerLevel;

    private Level(java.util.logging.Level innerLevel) {
        if (innerLevel == null)
            throw new IllegalArgumentException("innerLevel must not be null");

        this.innerLevel = innerLevel;
    }

    /**
     * Resolves a level by its semantic name ({@code error}, {@code lifecycle},
     * {@code info}, {@code debug}), case insensitive.
     *
     * @param name level name, e.g. from the command line
     * @return the matching level
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Level forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("level name must not be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "error":
                return ERROR;
            case "lifecycle":
                return LIFECYCLE;
            case "info":
                return INFO;
            case "debug":
                return DEBUG;
            default:
                throw new IllegalArgumentException("Unknown log level: " + name);
        }
    }

    /**
     * Exposes the wrapped {@link java.util.logging.Level} so adaptors can pass
     * it to the underlying logger implementation.
     *
     * @return the mapped {@code java.util.logging.Level}
     */
    java.util.logging.Level getInnerLevel() {
        return innerLevel;
    }
}
