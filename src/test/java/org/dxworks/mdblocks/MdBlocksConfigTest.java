package org.dxworks.mdblocks;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MdBlocksConfigTest {

    @Test
    void defaultsAllowHundredLevels() {
        assertEquals(100, MdBlocksConfig.defaults().getMaxNestingDepth());
    }

    @Test
    void loadsYamlFile() {
        MdBlocksConfig config = MdBlocksConfig.load(Paths.get("src/test/resources/config/mdblocks-config.yml"));

        assertEquals(12, config.getMaxNestingDepth());
    }

    @Test
    void missingFileFallsBackToDefaults() {
        MdBlocksConfig config = MdBlocksConfig.load(Paths.get("src/test/resources/config/absent.yml"));

        assertEquals(100, config.getMaxNestingDepth());
    }

    @Test
    void malformedFileFallsBackToDefaults() {
        MdBlocksConfig config = MdBlocksConfig.load(Paths.get("src/test/resources/config/broken-config.yml"));

        assertEquals(100, config.getMaxNestingDepth());
    }

    @Test
    void nonPositiveDepthFallsBackToDefault(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("mdblocks-config.yml");
        Files.writeString(file, "maxNestingDepth: 0\n");

        assertEquals(100, MdBlocksConfig.load(file).getMaxNestingDepth());
        assertEquals(100, MdBlocksConfig.with(-3).getMaxNestingDepth());
        assertEquals(7, MdBlocksConfig.with(7).getMaxNestingDepth());
    }
}
