package com.rstfmt.core.config;

import com.rstfmt.core.check.IdempotenceChecker;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RstFmtConfig}.
 */
class RstFmtConfigTest {

    @Test
    void defaults_useWidth72AndDefaultCheckWidths() {
        RstFmtConfig config = RstFmtConfig.defaults();

        assertThat(config.format().width()).isEqualTo(RstFmtConfig.DEFAULT_WIDTH);
        assertThat(config.check().effectiveWidths()).isEqualTo(IdempotenceChecker.DEFAULT_WIDTHS);
        assertThat(config.markupRegistry().directive("toctree")).isNotNull();
    }

    @Test
    void checkSettings_acceptNullEntries() {
        RstFmtConfig.CheckSettings settings = new RstFmtConfig.CheckSettings(Arrays.asList(3, null, -1), " ");

        assertThat(settings.effectiveWidths()).containsExactly(3, null, null);
        assertThat(settings.dumpPath()).isNull();
    }

    @Test
    void checkSettings_dumpPathOrTemp_fallsBackToTemporaryDirectory() {
        RstFmtConfig.CheckSettings unset = new RstFmtConfig.CheckSettings(null, null);
        RstFmtConfig.CheckSettings set = new RstFmtConfig.CheckSettings(null, "/var/dumps");

        assertThat(unset.dumpPathOrTemp()).isEqualTo(Path.of(System.getProperty("java.io.tmpdir")));
        assertThat(set.dumpPathOrTemp()).isEqualTo(Path.of("/var/dumps"));
    }
}
