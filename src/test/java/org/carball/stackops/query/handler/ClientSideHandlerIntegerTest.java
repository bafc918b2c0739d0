package org.carball.stackops.query.handler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.stackops.exception.InvalidArgumentException;
import org.carball.stackops.exception.MissingMandatoryParamException;
import org.carball.stackops.model.preset.QueryPresetsInteger;
import org.carball.stackops.model.property.VolumeSnapshotProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientSideHandlerIntegerTest {

    private ClientSideHandlerInteger handler;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        handler = new ClientSideHandlerInteger(PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsInteger.values()), List.of(VolumeSnapshotProperties.SNAPSHOT_SIZE))
                .build());

        logger = (Logger) LoggerFactory.getLogger(ClientSideHandlerInteger.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldSupportMappedPresets() {
        for (QueryPresetsInteger preset : QueryPresetsInteger.values()) {
            assertThat(handler.checkSupported(preset, VolumeSnapshotProperties.SNAPSHOT_SIZE)).isTrue();
            assertThat(handler.checkSupported(preset, VolumeSnapshotProperties.SNAPSHOT_NAME)).isFalse();
        }
    }

    @Test
    void shouldCompareAgainstThreshold() {
        Map<String, Object> args = Map.of("value", 10);

        assertThat(handler.evaluate(QueryPresetsInteger.LESS_THAN, 8, args)).isTrue();
        assertThat(handler.evaluate(QueryPresetsInteger.LESS_THAN, 10, args)).isFalse();
        assertThat(handler.evaluate(QueryPresetsInteger.GREATER_THAN, 12, args)).isTrue();
        assertThat(handler.evaluate(QueryPresetsInteger.GREATER_THAN, 10, args)).isFalse();
        assertThat(handler.evaluate(QueryPresetsInteger.LESS_OR_EQUAL, 10, args)).isTrue();
        assertThat(handler.evaluate(QueryPresetsInteger.GREATER_OR_EQUAL, 10, args)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {-5, 0, 9, 10, 11, 1000})
    void lessThanAndGreaterOrEqualShouldPartitionValues(int value) {
        Map<String, Object> args = Map.of("value", 10);

        boolean less = handler.evaluate(QueryPresetsInteger.LESS_THAN, value, args);
        boolean greaterOrEqual = handler.evaluate(QueryPresetsInteger.GREATER_OR_EQUAL, value, args);

        assertThat(less ^ greaterOrEqual).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {-5, 0, 9, 10, 11, 1000})
    void greaterThanAndLessOrEqualShouldPartitionValues(int value) {
        Map<String, Object> args = Map.of("value", 10);

        boolean greater = handler.evaluate(QueryPresetsInteger.GREATER_THAN, value, args);
        boolean lessOrEqual = handler.evaluate(QueryPresetsInteger.LESS_OR_EQUAL, value, args);

        assertThat(greater ^ lessOrEqual).isTrue();
    }

    @Test
    void shouldAcceptIntegerFormattedThreshold() {
        assertThat(handler.evaluate(QueryPresetsInteger.GREATER_THAN, 20, Map.of("value", "15"))).isTrue();
    }

    @Test
    void shouldRejectNonIntegerThreshold() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsInteger.LESS_THAN, 5, Map.of("value", "ten")))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("integer");
    }

    @Test
    void shouldRequireThreshold() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsInteger.LESS_THAN, 5, Map.of()))
                .isInstanceOf(MissingMandatoryParamException.class);
    }

    @Test
    void shouldNotMatchNullValue() {
        assertThat(handler.evaluate(QueryPresetsInteger.LESS_THAN, null, Map.of("value", 10))).isFalse();
        assertThat(handler.evaluate(QueryPresetsInteger.GREATER_OR_EQUAL, null, Map.of("value", 10))).isFalse();
    }

    @Test
    void shouldWarnAndNotMatchNonNumericValue() {
        // When
        boolean matched = handler.evaluate(QueryPresetsInteger.LESS_THAN, "large", Map.of("value", 10));

        // Then
        assertThat(matched).isFalse();
        assertThat(logAppender.list).anySatisfy(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("large");
        });
    }
}
