package com.netgraph.cli;

import com.netgraph.core.config.ConfigLoader;
import com.netgraph.core.config.NetgraphConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by commands that read {@code netgraph.yaml}.
 */
public class ConfigOptions {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: netgraph.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    Path outputDir;

    /**
     * Loads the configuration and applies command-line overrides.
     *
     * @return effective configuration
     */
    NetgraphConfig load() {
        NetgraphConfig config = ConfigLoader.load(configPath);
        if (outputDir != null) {
            config = config.withOutputDirectory(outputDir.toString());
        }
        return config;
    }
}
