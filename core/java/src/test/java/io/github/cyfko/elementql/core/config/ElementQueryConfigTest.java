package io.github.cyfko.elementql.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ElementQueryConfig Tests")
class ElementQueryConfigTest {

    @Test
    @DisplayName("Should build config with default values")
    void defaults() {
        // When
        ElementQueryConfig config = ElementQueryConfig.defaults();

        // Then
        assertTrue(config.isCaseSensitive(), "Comparisons should be case sensitive by default");
        assertEquals(0.0013020833333333, config.getPrecision(), "Default precision should be 1/768");
        assertEquals(UnknownConditionPolicy.IGNORE, config.getUnknownConditionPolicy());
    }

    @Test
    @DisplayName("Should build config with custom values")
    void customValues() {
        ElementQueryConfig config = ElementQueryConfig.builder()
                .caseSensitive(false)
                .precision(0.25)
                .unknownConditionPolicy(UnknownConditionPolicy.STRICT_EXCEPTION)
                .build();

        assertFalse(config.isCaseSensitive());
        assertEquals(0.25, config.getPrecision());
        assertEquals(UnknownConditionPolicy.STRICT_EXCEPTION, config.getUnknownConditionPolicy());
    }

    @Test
    @DisplayName("Zero precision is allowed")
    void zeroPrecision() {
        assertEquals(0.0, ElementQueryConfig.builder().precision(0.0).build().getPrecision());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.001, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Should reject invalid precision")
    void invalidPrecision(double precision) {
        ElementQueryConfig.Builder builder = ElementQueryConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.precision(precision));
    }

    @Test
    @DisplayName("Should reject null policy naming the knob")
    void nullPolicy() {
        NullPointerException ex = assertThrows(NullPointerException.class,
                () -> ElementQueryConfig.builder().unknownConditionPolicy(null));

        assertEquals("unknownConditionPolicy", ex.getMessage());
    }

    @Test
    @DisplayName("Builders produce independent instances")
    void independentInstances() {
        ElementQueryConfig.Builder builder = ElementQueryConfig.builder().precision(0.1);
        ElementQueryConfig first = builder.build();
        ElementQueryConfig second = builder.precision(0.2).build();

        assertEquals(0.1, first.getPrecision());
        assertEquals(0.2, second.getPrecision());
        assertTrue(first.toString().contains("precision=0.1"));
    }
}
