package io.coldtag.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.coldtag.core.result.FunctionStatus;
import io.coldtag.core.tag.Tag;
import io.coldtag.serialization.ColdtagSerializer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EvaluateCommandTest extends BaseCommandTest {

    private static final String ROSTER =
            """
            [
              {"id": "loc", "type": "location", "value": "A | B"},
              {"id": "start", "type": "datetime", "value": "2024-01-15 09:00"},
              {"id": "end", "type": "datetime", "value": "2024-01-15 10:00"},
              {"id": "avg", "type": "number", "value": "",
               "functionConfig": {"functionType": "avgTemp", "locationTagIds": ["loc"],
                                  "startTagId": "start", "endTagId": "end"}},
              {"id": "hot", "type": "location",
               "functionConfig": {"functionType": "maxTempLocation", "locationTagIds": ["loc"],
                                  "startTagId": "start", "endTagId": "end"}},
              {"id": "plain", "type": "text", "value": "note"}
            ]
            """;

    private static final String READINGS =
            """
            [
              {"deviceId": "A", "timestamp": "2024-01-15 09:00:00", "temperature": 4.0, "humidity": 55},
              {"deviceId": "B", "timestamp": "2024-01-15 09:30:00", "temperature": 9.0, "humidity": 60},
              {"deviceId": "C", "timestamp": "2024-01-15 09:30:00", "temperature": 30.0, "humidity": 60}
            ]
            """;

    @TempDir Path tempDir;

    private Path roster;
    private Path readings;

    @BeforeEach
    void setUp() throws Exception {
        roster = write(tempDir, "roster.json", ROSTER);
        readings = write(tempDir, "readings.json", READINGS);
    }

    @Test
    void shouldPrintResultOfSuccessfulFunction() {
        // When
        int exitCode =
                run(
                        "evaluate", "--no-color",
                        "--tags", roster.toString(),
                        "--readings", readings.toString(),
                        "--task", "T-1",
                        "avg");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out())
                .contains("✓ avg (avgTemp)")
                .contains("计算完成：6.5")
                .contains("查询设备: A | B")
                .contains("命中: 2 条");
    }

    @Test
    void shouldWriteUpdatedRosterWithApply() throws Exception {
        // Given
        Path output = tempDir.resolve("out.json");

        // When
        int exitCode =
                run(
                        "evaluate", "--no-color",
                        "--tags", roster.toString(),
                        "--readings", readings.toString(),
                        "--task", "T-1",
                        "--apply", output.toString(),
                        "hot");

        // Then
        assertThat(exitCode).isZero();
        List<Tag> tags = ColdtagSerializer.readTags(Files.readString(output, StandardCharsets.UTF_8));
        assertThat(tags).extracting(Tag::getId)
                .containsExactly("loc", "start", "end", "avg", "hot", "plain");
        Tag hot = tags.get(4);
        assertThat(hot.getValue()).isEqualTo(List.of("B"));
        assertThat(hot.getFunctionConfig().getLastStatus()).isEqualTo(FunctionStatus.SUCCESS);
        assertThat(hot.getFunctionConfig().getLastRunAt()).isNotNull();
    }

    @Test
    void shouldExitWithOneWhenFunctionFails() {
        int exitCode = run("evaluate", "--no-color", "--tags", roster.toString(), "avg");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out()).contains("✗ avg").contains("MISSING_INPUT").contains("未关联任务，无法计算");
    }

    @Test
    void shouldReportTagWithoutFunction() {
        int exitCode =
                run("evaluate", "--no-color", "--tags", roster.toString(), "--task", "T-1", "plain");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out()).contains("请先配置函数方法");
    }

    @Test
    void shouldExitWithTwoWhenRosterIsMissing() {
        int exitCode =
                run("evaluate", "--tags", tempDir.resolve("missing.json").toString(), "avg");

        assertThat(exitCode).isEqualTo(ColdtagCommand.EXIT_INPUT_ERROR);
        assertThat(err()).contains("Cannot read roster file");
    }

    @Test
    void shouldExitWithTwoWhenReadingsAreMalformed() throws Exception {
        Path broken = write(tempDir, "broken.json", "[{\"deviceId\": \"A\"}]");

        int exitCode =
                run(
                        "evaluate",
                        "--tags", roster.toString(),
                        "--readings", broken.toString(),
                        "--task", "T-1",
                        "avg");

        assertThat(exitCode).isEqualTo(ColdtagCommand.EXIT_INPUT_ERROR);
        assertThat(err()).contains("Failed to deserialize readings");
    }

    @Test
    void shouldExitWithTwoWhenConfigFileIsInvalid() throws Exception {
        // Given
        Path config = write(tempDir, "coldtag.properties", "coldtag.detail.preview-limit=0\n");

        // When
        int exitCode =
                run(
                        "evaluate",
                        "--config", config.toString(),
                        "--tags", roster.toString(),
                        "avg");

        // Then
        assertThat(exitCode).isEqualTo(ColdtagCommand.EXIT_INPUT_ERROR);
        assertThat(err()).contains("Invalid configuration");
    }
}
