package com.cmdlang.cli;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * 配置 cmdl 各包的 java.util.logging 日志级别
 */
final class LoggingSetup {

    private static final String[] LOGGER_NAMES = {"cmdl", "com.cmdlang"};

    // 持有引用，防止 Logger 被回收后配置丢失
    private static final Logger[] LOGGERS = new Logger[LOGGER_NAMES.length];

    private LoggingSetup() {}

    /**
     * verbose 时输出 FINE 及以上到 stderr；否则只输出 SEVERE，
     * 未知命令等诊断已经由终端显示。
     */
    static void configure(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.SEVERE;
        for (int i = 0; i < LOGGER_NAMES.length; i++) {
            Logger logger = Logger.getLogger(LOGGER_NAMES[i]);
            LOGGERS[i] = logger;
            logger.setLevel(level);
            for (Handler h : logger.getHandlers()) {
                logger.removeHandler(h);
            }
            if (verbose) {
                ConsoleHandler handler = new ConsoleHandler();
                handler.setLevel(Level.FINE);
                handler.setFormatter(new SimpleFormatter());
                logger.addHandler(handler);
                logger.setUseParentHandlers(false);
            } else {
                logger.setUseParentHandlers(true);
            }
        }
    }
}
