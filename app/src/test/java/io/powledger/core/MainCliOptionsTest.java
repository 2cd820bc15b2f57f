package io.powledger.core;

import io.powledger.core.chainio.ChainFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(3, options.difficulty());
        assertEquals(3, options.blocks());
        assertEquals(0, options.maxPowTries());
        assertNull(options.seed());
        assertEquals(ChainFormat.JSON, options.exportFormat());
        assertNull(options.exportFile());
        assertNull(options.validateFile());
        assertEquals(8080, options.apiPort());
    }

    @Test
    void parsesMiningExportAndApiFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--difficulty=2",
                "--blocks=5",
                "--max-pow-tries=100000",
                "--seed=42",
                "--export=yaml",
                "--export-file=out/chain.yaml",
                "--validate-file=in/chain.txt",
                "--enable-api",
                "--api-bind=0.0.0.0",
                "--api-port=8181",
                "--keep-alive"
        });
        assertFalse(options.showHelp());
        assertEquals(2, options.difficulty());
        assertEquals(5, options.blocks());
        assertEquals(100_000, options.maxPowTries());
        assertEquals(42L, options.seed());
        assertEquals(ChainFormat.YAML, options.exportFormat());
        assertEquals(Path.of("out/chain.yaml"), options.exportFile());
        assertEquals(Path.of("in/chain.txt"), options.validateFile());
        assertTrue(options.enableApi());
        assertEquals("0.0.0.0", options.apiBind());
        assertEquals(8181, options.apiPort());
        assertTrue(options.keepAlive());
    }

    @Test
    void invalidDifficultySetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--difficulty=65"});
        assertTrue(options.showHelp());
        assertEquals("Invalid value for --difficulty: 65", options.errorMessage());
    }

    @Test
    void unknownExportFormatSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--export=xml"});
        assertTrue(options.showHelp());
        assertTrue(options.errorMessage().contains("xml"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
