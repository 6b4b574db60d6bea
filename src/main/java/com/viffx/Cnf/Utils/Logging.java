package com.viffx.Cnf.Utils;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Logging {
    private static final Logger ROOT = Logger.getLogger("com.viffx.Cnf");

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    /**
     * Routes records of {@code level} and above under the {@code com.viffx.Cnf} logger to stderr.
     */
    public static void setLevel(Level level) {
        Logger logger = ROOT;
        logger.setLevel(level);
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
        Handler handler = new ConsoleHandler();
        handler.setLevel(level);
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
    }

}
