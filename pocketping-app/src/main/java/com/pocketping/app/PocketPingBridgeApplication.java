package com.pocketping.app;

import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.config.ConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

import java.nio.file.Path;
import java.util.Map;

/**
 * PocketPing bridge server entry point.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "com.pocketping")
public class PocketPingBridgeApplication {

    static final String CONFIG_PATH_PROPERTY = "pocketping.config.path";
    static final String DEFAULT_CONFIG_PATH = "~/.pocketping/bridge.json";

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(PocketPingBridgeApplication.class);
        // an explicit server.port still wins over this default
        application.setDefaultProperties(Map.of("server.port", resolvePort()));
        application.run(args);
    }

    private static int resolvePort() {
        String path = System.getProperty(CONFIG_PATH_PROPERTY,
                System.getenv().getOrDefault("POCKETPING_CONFIG_PATH", DEFAULT_CONFIG_PATH));
        BridgeConfig config = new ConfigService(Path.of(path)).loadConfig();
        log.info("PocketPing bridge listening on port {}", config.getPort());
        return config.getPort();
    }
}
