package org.carball.stackops.cli;

import org.carball.stackops.config.OutputFormat;
import org.carball.stackops.config.StackOpsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StackOpsCLITest {

    @TempDir
    Path tempDir;

    private String snapshot;
    private String query;

    @BeforeEach
    void setUp() throws IOException {
        snapshot = Files.writeString(tempDir.resolve("snapshot.json"), "{}").toString();
        query = Files.writeString(tempDir.resolve("query.yml"), "resource_type: server\n").toString();
    }

    @Test
    void shouldParseQueryInvocation() {
        // Given
        String[] args = {snapshot, query, "--pretty", "-f", "json", "--group-by", "project_id",
                "--engine.max-listing-calls", "4", "-v"};

        // When
        StackOpsConfig config = StackOpsCLI.parseArgs(args);

        // Then
        assertThat(config.getSnapshotFile()).isEqualTo(Path.of(snapshot));
        assertThat(config.getQueryFile()).isEqualTo(Path.of(query));
        assertThat(config.isCheckMode()).isFalse();
        assertThat(config.getPrettyPrint()).isTrue();
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.getGroupBy()).isEqualTo("project_id");
        assertThat(config.isVerbose()).isTrue();
    }

    @Test
    void shouldParseCheckInvocation() {
        String output = tempDir.resolve("tickets.json").toString();

        StackOpsConfig config = StackOpsCLI.parseArgs(new String[]{
                snapshot, "--check", "stale-snapshots", "--days", "60", "--project", "p1", "-o", output});

        assertThat(config.isCheckMode()).isTrue();
        assertThat(config.getCheckName()).isEqualTo("stale-snapshots");
        assertThat(config.getCheckDays()).isEqualTo(60);
        assertThat(config.getProjectId()).isEqualTo("p1");
        assertThat(config.getOutputFile()).isEqualTo(output);
        assertThat(config.getQueryFile()).isNull();
        assertThat(config.getPrettyPrint()).isNull();
    }

    @Test
    void shouldRequireExactlyOneOfQueryOrCheck() {
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, "--pretty"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one");
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, query, "--check", "stale-snapshots"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one");
    }

    @Test
    void shouldRejectMissingFiles() {
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{tempDir.resolve("none.json").toString(), query}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cloud snapshot file not found");
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, tempDir.resolve("none.yml").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Query file not found");
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, query, "-o",
                tempDir.resolve("missing/out.txt").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output directory does not exist");
    }

    @Test
    void shouldRejectCheckOptionsWithoutCheck() {
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, query, "--days", "5"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("only apply to --check");
    }

    @Test
    void shouldRejectBadValues() {
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, "--check", "x", "--days", "ten"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid number of days: ten");
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, "--check", "x", "--days", "0"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--days must be positive");
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, query, "--format", "xml"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, query, "--check"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Check name not specified");
    }

    @Test
    void shouldRejectUnknownOptions() {
        assertThatThrownBy(() -> StackOpsCLI.parseArgs(new String[]{snapshot, query, "--colour"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown option: --colour");
    }
}
