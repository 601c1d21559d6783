package org.dxworks.mdblocks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parser settings, passed explicitly into every parse.
 */
public class MdBlocksConfig {

    private static final Logger log = LoggerFactory.getLogger(MdBlocksConfig.class);

    private static final int DEFAULT_MAX_NESTING_DEPTH = 100;
    private static final String CONFIG_FILE_NAME = "mdblocks-config.yml";

    private final int maxNestingDepth;

    private MdBlocksConfig(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Maximum number of container levels (blockquotes, list items) a document may nest.
     */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public static MdBlocksConfig defaults() {
        return new MdBlocksConfig(DEFAULT_MAX_NESTING_DEPTH);
    }

    public static MdBlocksConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MdBlocksConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxNestingDepth = yamlConfig.maxNestingDepth;
                int effectiveMaxNestingDepth = (maxNestingDepth != null && maxNestingDepth > 0)
                        ? maxNestingDepth
                        : DEFAULT_MAX_NESTING_DEPTH;
                log.debug("Loaded {} (maxNestingDepth={})", configPath, effectiveMaxNestingDepth);
                return new MdBlocksConfig(effectiveMaxNestingDepth);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MdBlocksConfig with(int maxNestingDepth) {
        int effectiveMaxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
        return new MdBlocksConfig(effectiveMaxNestingDepth);
    }

    private static class YamlConfig {
        public Integer maxNestingDepth;
    }
}
