package io.fmtree.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @Test
    void parses_config_command_and_argument() {
        var cfg = CliConfig.fromArgs(new String[] { "--config", "tree.json", "proof", "3" });

        assertEquals(Path.of("tree.json"), cfg.configPath());
        assertEquals("proof", cfg.command());
        assertEquals("3", cfg.argument());
        assertFalse(cfg.help());
    }

    @Test
    void config_flag_may_follow_the_command() {
        var cfg = CliConfig.fromArgs(new String[] { "root", "-c", "tree.json" });

        assertEquals("root", cfg.command());
        assertEquals(Path.of("tree.json"), cfg.configPath());
    }

    @Test
    void negative_numbers_are_arguments_not_flags() {
        var cfg = CliConfig.fromArgs(new String[] { "-c", "t.json", "proof", "-1" });
        assertEquals("-1", cfg.argument());
    }

    @Test
    void help_wins() {
        assertTrue(CliConfig.fromArgs(new String[] { "root", "--help" }).help());
    }

    @Test
    void rejects_malformed_command_lines() {
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[0]));
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[] { "root" }));
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[] { "-c" }));
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[] { "--verbose", "root" }));
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[] { "-c", "t.json", "proof" }));
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[] { "-c", "t.json", "root", "1" }));
        assertThrows(CliConfig.UsageException.class, () -> CliConfig.fromArgs(new String[] { "-c", "t.json", "grow" }));
        assertThrows(CliConfig.UsageException.class,
                () -> CliConfig.fromArgs(new String[] { "-c", "t.json", "proof", "1", "2" }));
    }
}
