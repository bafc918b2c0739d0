package org.carball.stackops.query.handler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.stackops.exception.InvalidArgumentException;
import org.carball.stackops.exception.MissingMandatoryParamException;
import org.carball.stackops.model.preset.QueryPresetsDateTime;
import org.carball.stackops.model.property.ServerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientSideHandlerDateTimeTest {

    private static final Instant NOW = Instant.parse("2021-08-01T00:00:00Z");
    private static final Map<String, Object> TWENTY_DAYS = Map.of("days", 20);

    private ClientSideHandlerDateTime handler;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        handler = new ClientSideHandlerDateTime(PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsDateTime.values()),
                        List.of(ServerProperties.SERVER_CREATION_DATE, ServerProperties.SERVER_LAST_UPDATED_DATE))
                .build(), Clock.fixed(NOW, ZoneOffset.UTC));

        logger = (Logger) LoggerFactory.getLogger(ClientSideHandlerDateTime.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldOnlySupportDateTimeProperties() {
        assertThat(handler.checkSupported(QueryPresetsDateTime.OLDER_THAN, ServerProperties.SERVER_CREATION_DATE))
                .isTrue();
        assertThat(handler.checkSupported(QueryPresetsDateTime.OLDER_THAN, ServerProperties.SERVER_NAME)).isFalse();
    }

    @Test
    void shouldTreatTimestampExactlyAtThresholdAsOlder() {
        // 2021-08-01 minus 20 days
        String boundary = "2021-07-12T00:00:00Z";

        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, boundary, TWENTY_DAYS)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN_OR_EQUAL, boundary, TWENTY_DAYS)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, boundary, TWENTY_DAYS)).isFalse();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN_OR_EQUAL, boundary, TWENTY_DAYS)).isTrue();
    }

    @Test
    void shouldCompareEitherSideOfThreshold() {
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-11T23:59:59Z", TWENTY_DAYS)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-12T00:00:01Z", TWENTY_DAYS)).isFalse();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, "2021-07-12T00:00:01Z", TWENTY_DAYS)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, "2021-07-11T23:59:59Z", TWENTY_DAYS)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"2020-01-01T00:00:00Z", "2021-07-11T23:59:59Z", "2021-07-12T00:00:00Z",
            "2021-07-12T00:00:01Z", "2021-07-31T12:00:00Z"})
    void olderThanAndYoungerThanShouldPartitionTimestamps(String timestamp) {
        boolean older = handler.evaluate(QueryPresetsDateTime.OLDER_THAN, timestamp, TWENTY_DAYS);
        boolean younger = handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, timestamp, TWENTY_DAYS);

        assertThat(older ^ younger).isTrue();
    }

    @Test
    void shouldCombineTimeUnits() {
        Map<String, Object> args = Map.of("days", 1, "hours", 12, "minutes", 30, "seconds", 15);

        // 1 day 12:30:15 before NOW is 2021-07-30T11:29:45Z
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-30T11:29:45Z", args)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-30T11:29:46Z", args)).isFalse();
    }

    @Test
    void shouldParseCustomFormat() {
        Map<String, Object> args = Map.of("days", 20, "format", "yyyy-MM-dd HH:mm:ss");

        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-01 10:00:00", args)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, "2021-07-30 10:00:00", args)).isTrue();
    }

    @Test
    void shouldReadIsoTimestampsWithMicrosecondsAndNoZone() {
        // Cinder and Octavia report updated_at without an offset
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-01T10:00:00.123456", TWENTY_DAYS))
                .isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, "2021-07-30T10:00:00.000000", TWENTY_DAYS))
                .isTrue();
        assertThat(logAppender.list).noneMatch(event -> event.getLevel() == Level.WARN);
    }

    @Test
    void shouldHonourOffsetInIsoFallback() {
        Map<String, Object> oneHour = Map.of("hours", 1);

        // 2021-08-01T00:30:00+02:00 is 2021-07-31T22:30:00Z, 90 minutes ago
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-08-01T00:30:00+02:00", oneHour)).isTrue();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, "2021-07-31T23:30:00.5Z", oneHour)).isTrue();
    }

    @Test
    void shouldAcceptInstantValues() {
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, Instant.parse("2021-01-01T00:00:00Z"),
                TWENTY_DAYS)).isTrue();
    }

    @Test
    void shouldWarnAndNotMatchUnparseableTimestamp() {
        // When
        boolean older = handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "yesterday", TWENTY_DAYS);
        boolean younger = handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, "yesterday", TWENTY_DAYS);

        // Then
        assertThat(older).isFalse();
        assertThat(younger).isFalse();
        assertThat(logAppender.list).anySatisfy(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("yesterday");
        });
    }

    @Test
    void shouldNotMatchNullTimestamp() {
        assertThat(handler.evaluate(QueryPresetsDateTime.OLDER_THAN, null, TWENTY_DAYS)).isFalse();
        assertThat(handler.evaluate(QueryPresetsDateTime.YOUNGER_THAN, null, TWENTY_DAYS)).isFalse();
    }

    @Test
    void shouldRequireAtLeastOneTimeUnit() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-01T00:00:00Z", Map.of()))
                .isInstanceOf(MissingMandatoryParamException.class)
                .hasMessageContaining("days");
    }

    @Test
    void shouldRejectNegativeOrZeroThreshold() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-01T00:00:00Z",
                Map.of("days", -1)))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-01T00:00:00Z",
                Map.of("days", 0, "hours", 0)))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void shouldRejectInvalidFormatPattern() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsDateTime.OLDER_THAN, "2021-07-01T00:00:00Z",
                Map.of("days", 1, "format", "yyyy-MM-ddTHH:mm:ss")))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("format");
    }
}
