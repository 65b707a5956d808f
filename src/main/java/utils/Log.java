package utils;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.util.HashMap;
import java.util.Map;

import init.Config;

public class Log {

    // one logger per calling class, resolved from the stack
    private static final Map<String, Logger> loggers = new HashMap<>();

    public static void info(String message) {
        getLogger().info(message);
    }

    public static void debug(String message) {
        getLogger().debug(message);
    }

    public static void warn(String message) {
        getLogger().warn(message);
    }

    public static void error(String message) {
        getLogger().error(message);
    }

    public static void errorStack(String message, Throwable e) {
        getLogger().error(message, e);
    }

    private static synchronized Logger getLogger() {
        String callingClassName = new Throwable().getStackTrace()[2].getClassName();
        return loggers.computeIfAbsent(callingClassName, LogManager::getLogger);
    }

    public static void setLogLevel(String level) {
        Configurator.setRootLevel(Level.toLevel(level, Level.INFO));
    }

    public static void initLogLevel(Config config) {
        setLogLevel(config.getLogLevel());
    }
}
