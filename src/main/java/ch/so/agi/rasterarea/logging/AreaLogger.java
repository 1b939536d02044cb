package ch.so.agi.rasterarea.logging;

/**
 * Logger used by the aggregation steps, the dataset task and the command line.
 * <p>
 * A dataset run reports on four levels:
 * <ul>
 *   <li>{@link #lifecycle(String)} &ndash; {@code Start} and {@code Finished}
 *       of a step, one pair per dataset.</li>
 *   <li>{@link #info(String)} &ndash; one {@code Processing} or
 *       {@code Skipping empty} line per region.</li>
 *   <li>{@link #debug(String)} &ndash; skipped mask blocks, unresolved names,
 *       scratch files.</li>
 *   <li>{@link #error(String, Throwable)} &ndash; the dataset that failed and
 *       its cause.</li>
 * </ul>
 * The threshold is chosen with {@code --log-level} on the command line.
 */
public interface AreaLogger {

    public void info(String msg);

    public void debug(String msg);

    public void error(String msg, Throwable thrown);

    public void lifecycle(String msg);

    /**
     * @return whether {@link #debug(String)} output is shown
     */
    public boolean isDebugEnabled();
}
