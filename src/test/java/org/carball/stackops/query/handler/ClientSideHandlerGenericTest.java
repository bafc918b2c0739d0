package org.carball.stackops.query.handler;

import org.carball.stackops.exception.MissingMandatoryParamException;
import org.carball.stackops.exception.UnsupportedPresetException;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.preset.QueryPresetsString;
import org.carball.stackops.model.property.ServerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientSideHandlerGenericTest {

    private ClientSideHandlerGeneric handler;

    @BeforeEach
    void setUp() {
        handler = new ClientSideHandlerGeneric(PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsGeneric.values()),
                        List.of(ServerProperties.SERVER_STATUS, ServerProperties.SERVER_ID))
                .build());
    }

    @Test
    void shouldSupportMappedPropertiesOnly() {
        assertThat(handler.checkSupported(QueryPresetsGeneric.ANY_IN, ServerProperties.SERVER_STATUS)).isTrue();
        assertThat(handler.checkSupported(QueryPresetsGeneric.ANY_IN, ServerProperties.SERVER_NAME)).isFalse();
        assertThat(handler.checkSupported(QueryPresetsString.ANY_IN, ServerProperties.SERVER_STATUS)).isFalse();
    }

    @Test
    void shouldMatchValueInList() {
        Map<String, Object> args = Map.of("values", List.of("ERROR", "SHUTOFF"));

        assertThat(handler.evaluate(QueryPresetsGeneric.ANY_IN, "ERROR", args)).isTrue();
        assertThat(handler.evaluate(QueryPresetsGeneric.ANY_IN, "ACTIVE", args)).isFalse();
        assertThat(handler.evaluate(QueryPresetsGeneric.ANY_IN, null, args)).isFalse();
    }

    @Test
    void shouldCompareNumbersByValue() {
        assertThat(ClientSideHandlerGeneric.valuesEqual(1, 1L)).isTrue();
        assertThat(ClientSideHandlerGeneric.valuesEqual(2.0, 2)).isTrue();
        assertThat(ClientSideHandlerGeneric.valuesEqual(2.5, 2)).isFalse();
    }

    @Test
    void shouldCompareNonFiniteNumbersWithoutFailing() {
        assertThat(ClientSideHandlerGeneric.valuesEqual(10, Double.NaN)).isFalse();
        assertThat(ClientSideHandlerGeneric.valuesEqual(Double.NaN, Double.NaN)).isTrue();
        assertThat(ClientSideHandlerGeneric.valuesEqual(Double.POSITIVE_INFINITY, Float.POSITIVE_INFINITY)).isTrue();
        assertThat(ClientSideHandlerGeneric.valuesEqual(Long.MAX_VALUE, Double.POSITIVE_INFINITY)).isFalse();
        assertThat(handler.evaluate(QueryPresetsGeneric.ANY_IN, 40, Map.of("values", List.of(Double.NaN, 40))))
                .isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"ACTIVE", "ERROR", "SHUTOFF", "", "error"})
    void notAnyInShouldBeExactNegationOfAnyIn(String status) {
        Map<String, Object> args = Map.of("values", List.of("ERROR", "SHUTOFF"));

        boolean anyIn = handler.evaluate(QueryPresetsGeneric.ANY_IN, status, args);
        boolean notAnyIn = handler.evaluate(QueryPresetsGeneric.NOT_ANY_IN, status, args);

        assertThat(notAnyIn).isEqualTo(!anyIn);
    }

    @Test
    void shouldRejectEmptyValuesList() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsGeneric.ANY_IN, "ACTIVE", Map.of("values", List.of())))
                .isInstanceOf(MissingMandatoryParamException.class)
                .hasMessageContaining("at least one item");
    }

    @Test
    void shouldEvaluateEqualityPresetsOnNumbersByValue() {
        assertThat(handler.evaluate(QueryPresetsGeneric.EQUAL_TO, 1L, Map.of("value", 1))).isTrue();
        assertThat(handler.evaluate(QueryPresetsGeneric.NOT_EQUAL_TO, 2, Map.of("value", 1L))).isTrue();
        assertThat(handler.evaluate(QueryPresetsGeneric.EQUAL_TO, "1", Map.of("value", 1))).isFalse();
    }

    @Test
    void shouldRequireValueForEquality() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsGeneric.EQUAL_TO, "ACTIVE", Map.of()))
                .isInstanceOf(MissingMandatoryParamException.class)
                .hasMessageContaining("value");
    }

    @Test
    void shouldCompileFilterFunctionForSupportedPair() {
        // When
        Predicate<Object> predicate = handler.getFilterFunction(QueryPresetsGeneric.EQUAL_TO,
                ServerProperties.SERVER_STATUS, Map.of("value", "ACTIVE"));

        // Then
        assertThat(predicate.test("ACTIVE")).isTrue();
        assertThat(predicate.test("ERROR")).isFalse();
    }

    @Test
    void shouldRefuseFilterFunctionForUnsupportedProperty() {
        assertThatThrownBy(() -> handler.getFilterFunction(QueryPresetsGeneric.EQUAL_TO,
                ServerProperties.SERVER_NAME, Map.of("value", "web-1")))
                .isInstanceOf(UnsupportedPresetException.class)
                .hasMessageContaining("name");
    }

    @Test
    void shouldRefusePresetOfAnotherKind() {
        assertThatThrownBy(() -> handler.evaluate(QueryPresetsString.MATCHES_REGEX, "web-1", Map.of("regex", "web")))
                .isInstanceOf(UnsupportedPresetException.class);
    }
}
