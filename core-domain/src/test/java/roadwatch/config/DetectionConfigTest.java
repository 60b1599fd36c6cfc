package roadwatch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import roadwatch.domain.exception.InvalidConfigurationException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DetectionConfigTest {

    @Test
    void defaults_shouldBeValid() {
        assertDoesNotThrow(() -> DetectionConfig.defaults().validate(3));
    }

    @Test
    @DisplayName("La validación reúne todas las violaciones en una sola excepción")
    void validate_shouldCollectEveryViolation() {
        DetectionConfig broken = DetectionConfig.defaults().toBuilder()
                .windowSize(0)
                .sprtUpperBound(-5.0)
                .quorum(4)
                .cusumThreshold(Double.NaN)
                .build();

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class,
                () -> broken.validate(3));

        assertEquals(4, ex.getViolations().size(), ex.getMessage());
        assertTrue(ex.getMessage().contains("quorum must be between 1 and 3"));
    }

    @Test
    void validate_shouldRejectCapNotAboveThreshold() {
        DetectionConfig config = DetectionConfig.defaults().withPageHinkleyStatisticCap(8.0);
        assertThrows(InvalidConfigurationException.class, () -> config.validate(3));
    }

    @Test
    @DisplayName("ticksFor redondea hacia arriba y nunca devuelve menos de un tick")
    void ticksFor_shouldRoundUp() {
        DetectionConfig config = DetectionConfig.defaults(); // 2 s por tick

        assertEquals(5, config.ticksFor(Duration.ofSeconds(10)));
        assertEquals(6, config.ticksFor(Duration.ofSeconds(11)));
        assertEquals(1, config.ticksFor(Duration.ofMillis(1)));
        assertEquals(60, config.ticksFor(Duration.ofSeconds(120)));
    }

    @Test
    @DisplayName("ticksFor satura en lugar de desbordar con duraciones enormes")
    void ticksFor_shouldSaturate() {
        DetectionConfig config = DetectionConfig.defaults();

        assertEquals(Integer.MAX_VALUE, config.ticksFor(Duration.ofSeconds(100_000_000_000_000_000L)));
        assertEquals(Integer.MAX_VALUE, config.ticksFor(Duration.ofSeconds(Long.MAX_VALUE, 999_999_999)));
        assertEquals(Integer.MAX_VALUE,
                config.withTickInterval(Duration.ofNanos(1)).ticksFor(Duration.ofSeconds(Long.MAX_VALUE)));
        assertEquals(1, config.ticksFor(Duration.ZERO));
    }

    @Test
    @DisplayName("Las opciones nulas conservan el valor vigente")
    void options_shouldOnlyOverrideProvidedFields() {
        DetectionConfig base = DetectionConfig.defaults();
        DetectionOptions options = DetectionOptions.builder()
                .cusumThreshold(12.0)
                .quorum(3)
                .build();

        DetectionConfig merged = options.applyTo(base);

        assertEquals(12.0, merged.cusumThreshold());
        assertEquals(3, merged.quorum());
        assertEquals(base.windowSize(), merged.windowSize());
        assertEquals(base.sprtLowerBound(), merged.sprtLowerBound());
        assertFalse(options.isEmpty());
        assertTrue(DetectionOptions.builder().build().isEmpty());
    }
}
