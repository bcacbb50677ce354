package util;

/**
 * Console logger for the driver and the IR builders. Messages go to standard error and are filtered by an output
 * level.
 * <p>
 * The data-flow solver and the lattices never log.
 */
public class Logger {

    /**
     * Nothing but errors
     */
    public static final int QUIET = 0;
    /**
     * Warnings about inputs the analysis had to skip
     */
    public static final int WARN = 1;
    /**
     * Progress information
     */
    public static final int INFO = 2;
    /**
     * Everything, including per-block information
     */
    public static final int DEBUG = 3;

    /**
     * Messages with a level above this one are dropped
     */
    private final int outputLevel;

    public Logger(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    /**
     * Logger that only reports errors
     *
     * @return new quiet logger
     */
    public static Logger quiet() {
        return new Logger(QUIET);
    }

    private boolean shouldLog(int level) {
        return level <= outputLevel;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public void error(String s) {
        System.err.println("ERROR: " + s);
    }

    public void warn(String s) {
        if (shouldLog(WARN)) {
            System.err.println("WARNING: " + s);
        }
    }

    public void info(String s) {
        if (shouldLog(INFO)) {
            System.err.println(s);
        }
    }

    public void debug(String s) {
        if (shouldLog(DEBUG)) {
            System.err.println("[" + Thread.currentThread().getId() + "]" + s);
        }
    }
}
