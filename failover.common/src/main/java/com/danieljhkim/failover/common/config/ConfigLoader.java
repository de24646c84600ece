package com.danieljhkim.failover.common.config;

import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

@Slf4j
public class ConfigLoader {

    static final String DEFAULT_CONFIG_PATH = "failover-config.yml";

    /**
     * Gets the config file path from FAILOVER_CONFIG_PATH environment variable,
     * defaulting to "failover-config.yml" if not set.
     */
    public static String getConfigFilePath() {
        String configPath = System.getenv("FAILOVER_CONFIG_PATH");
        if (configPath == null || configPath.isEmpty()) {
            configPath = DEFAULT_CONFIG_PATH;
        }
        return configPath;
    }

    public static FailoverConfig load() throws IOException {
        return load(getConfigFilePath());
    }

    /**
     * Loads the failover configuration from the specified classpath resource.
     */
    public static FailoverConfig load(String yamlResourcePath) throws IOException {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(FailoverConfig.class, loaderOptions);
        Yaml yaml = new Yaml(constructor);

        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(yamlResourcePath)) {
            if (in == null) {
                throw new IOException("Config file not found on classpath: " + yamlResourcePath);
            }
            FailoverConfig config = yaml.load(in);
            validate(config, yamlResourcePath);
            log.info("Loaded failover configuration from {}: {}", yamlResourcePath, config);
            return config;
        }
    }

    private static void validate(FailoverConfig config, String source) throws IOException {
        if (config == null) {
            throw new IOException("Config file is empty: " + source);
        }
        if (config.getSelf() == null || config.getPeer() == null) {
            throw new IOException("Config must describe both self and peer nodes: " + source);
        }
        if (config.getSelf().getId() != null && config.getSelf().getId().equals(config.getPeer().getId())) {
            throw new IOException("self and peer must have distinct ids: " + source);
        }
        if (config.getDecider() == null) {
            config.setDecider(new FailoverConfig.DeciderConfig());
        }
        if (config.getDecider().getCheckIntervalMs() <= 0) {
            throw new IOException("decider.checkIntervalMs must be positive: " + source);
        }
        if (config.getDecider().getBootstrapRetryDelayMs() < 0) {
            throw new IOException("decider.bootstrapRetryDelayMs must not be negative: " + source);
        }
    }
}
