package common;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 日志初始化：从 classpath 读取 logging.properties，缺失时沿用 JDK 默认配置。
 */
public final class LoggingConfig {
    public static final String CONFIG_RESOURCE = "/logging.properties";

    private LoggingConfig() {}

    public static void setup() {
        setup(CONFIG_RESOURCE);
    }

    static void setup(String resource) {
        Logger log = Logger.getLogger(LoggingConfig.class.getName());
        try (InputStream in = LoggingConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                log.warning("Logging configuration " + resource + " not found, using JDK defaults");
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to read " + resource + ", using JDK defaults", e);
        }
    }
}
