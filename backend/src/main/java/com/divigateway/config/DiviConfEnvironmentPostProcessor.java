package com.divigateway.config;

import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exposes divi.conf values as {@code divi.conf.<key>} properties. application.yml resolves
 * divi.rpc.* from them first and from RPC_USER / RPC_PASS / RPC_PORT second.
 * Runs after config data so {@code divi.conf.path} may come from any property source.
 */
public class DiviConfEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    public static final String PROPERTY_SOURCE_NAME = "diviConf";
    public static final String PATH_PROPERTY = "divi.conf.path";
    private static final String PREFIX = "divi.conf.";

    private final Log log;

    public DiviConfEnvironmentPostProcessor(DeferredLogFactory logFactory) {
        this.log = logFactory.getLog(DiviConfEnvironmentPostProcessor.class);
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Path path = resolvePath(environment);
        if (!Files.isRegularFile(path)) {
            log.info("No divi.conf at " + path + "; RPC credentials must come from the environment");
            return;
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        try {
            DiviConfFile.read(path).forEach((key, value) -> properties.put(PREFIX + key, value));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + path, e);
        }
        log.info("Loaded " + properties.keySet() + " from " + path);
        environment.getPropertySources().addLast(new MapPropertySource(PROPERTY_SOURCE_NAME, properties));
    }

    private static Path resolvePath(ConfigurableEnvironment environment) {
        String configured = environment.getProperty(PATH_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        return DiviConfFile.defaultPath(
                System.getProperty("os.name"),
                System.getProperty("user.home"),
                System.getenv("APPDATA"));
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
