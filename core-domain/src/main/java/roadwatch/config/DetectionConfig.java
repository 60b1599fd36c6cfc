package roadwatch.config;

import lombok.Builder;
import lombok.With;
import roadwatch.domain.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Objeto de valor inmutable con todos los parámetros del motor de detección.
 * <p>
 * El motor lo trata como constante durante un tick. Sólo se sustituye entre ticks
 * mediante un comando de reconfiguración, nunca a mitad de una pasada.
 *
 * @param windowSize              Capacidad de la ventana deslizante de velocidades por entidad.
 * @param predictorMinSamples     Puntos mínimos para ajustar el ARMA(1,1). Por debajo se usa persistencia.
 * @param warmupSamples           Muestras válidas que una entidad necesita antes de emitir votos.
 * @param cusumThreshold          Umbral de alarma del acumulador CUSUM.
 * @param cusumDrift              Deriva (holgura) restada a cada residuo CUSUM.
 * @param sprtNormalMean          Media de H0 (tráfico normal).
 * @param sprtNormalStd           Desviación típica de H0.
 * @param sprtAnomalousMean       Media de H1 (accidente, tráfico mucho más lento).
 * @param sprtAnomalousStd        Desviación típica de H1.
 * @param sprtUpperBound          Frontera superior del log-ratio: decisión "accidente".
 * @param sprtLowerBound          Frontera inferior del log-ratio: decisión "normal".
 * @param pageHinkleyThreshold    Umbral de alarma de Page-Hinkley (m_t - M_t).
 * @param pageHinkleyDelta        Magnitud tolerada de la desviación por muestra.
 * @param pageHinkleyStatisticCap Techo del estadístico Page-Hinkley (acota la memoria del test).
 * @param nominalSpeed            Velocidad de flujo libre nominal (semilla de la línea base).
 * @param baselineMode            Origen de la línea base de Page-Hinkley.
 * @param quorum                  Votos anómalos necesarios para declarar un tick anómalo.
 * @param confirmationRunLength   Ticks anómalos consecutivos para confirmar un accidente.
 * @param hysteresisRunLength     Ticks normales consecutivos para dar un accidente por despejado.
 * @param historyCapacity         Registros cerrados que conserva el histórico en memoria.
 * @param tickInterval            Periodo nominal del tick (convierte duraciones de inyección a ticks).
 */
@Builder(toBuilder = true)
@With
public record DetectionConfig(
        // --- Predictor ---
        int windowSize,
        int predictorMinSamples,
        int warmupSamples,

        // --- CUSUM ---
        double cusumThreshold,
        double cusumDrift,

        // --- SPRT ---
        double sprtNormalMean,
        double sprtNormalStd,
        double sprtAnomalousMean,
        double sprtAnomalousStd,
        double sprtUpperBound,
        double sprtLowerBound,

        // --- Page-Hinkley ---
        double pageHinkleyThreshold,
        double pageHinkleyDelta,
        double pageHinkleyStatisticCap,
        double nominalSpeed,
        BaselineMode baselineMode,

        // --- Votación y ciclo de vida ---
        int quorum,
        int confirmationRunLength,
        int hysteresisRunLength,
        int historyCapacity,
        Duration tickInterval
) {

    public static DetectionConfig defaults() {
        return DetectionConfig.builder()
                .windowSize(60)
                .predictorMinSamples(10)
                .warmupSamples(10)
                .cusumThreshold(10.0)
                .cusumDrift(2.0)
                .sprtNormalMean(60.0)
                .sprtNormalStd(10.0)
                .sprtAnomalousMean(15.0)
                .sprtAnomalousStd(5.0)
                .sprtUpperBound(5.0)
                .sprtLowerBound(-5.0)
                .pageHinkleyThreshold(8.0)
                .pageHinkleyDelta(2.0)
                .pageHinkleyStatisticCap(16.0)
                .nominalSpeed(60.0)
                .baselineMode(BaselineMode.LEARNED)
                .quorum(2)
                .confirmationRunLength(3)
                .hysteresisRunLength(5)
                .historyCapacity(100)
                .tickInterval(Duration.ofSeconds(2))
                .build();
    }

    /**
     * Número de ticks que cubre una duración dada, redondeando hacia arriba (mínimo 1).
     * Satura en {@link Integer#MAX_VALUE}.
     */
    public int ticksFor(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return 1;
        }
        Duration interval = tickInterval == null || tickInterval.isNegative() || tickInterval.isZero()
                ? Duration.ofMillis(1)
                : tickInterval;
        try {
            long ticks = duration.dividedBy(interval);
            if (!duration.minus(interval.multipliedBy(ticks)).isZero()) {
                ticks++;
            }
            return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, ticks));
        } catch (ArithmeticException e) {
            // Duraciones desmesuradas saturan en lugar de desbordar
            return Integer.MAX_VALUE;
        }
    }

    /**
     * Valida la configuración completa.
     *
     * @param voterCount Número de detectores que votan (acota el quórum).
     * @return la propia configuración, para encadenar.
     * @throws InvalidConfigurationException con todas las violaciones encontradas.
     */
    public DetectionConfig validate(int voterCount) {
        List<String> violations = new ArrayList<>();

        positive(violations, "windowSize", windowSize);
        positive(violations, "predictorMinSamples", predictorMinSamples);
        if (predictorMinSamples < 3) {
            violations.add("predictorMinSamples must be at least 3 for an ARMA(1,1) fit");
        }
        if (warmupSamples < 0) {
            violations.add("warmupSamples must not be negative");
        }

        positive(violations, "cusumThreshold", cusumThreshold);
        nonNegative(violations, "cusumDrift", cusumDrift);

        finite(violations, "sprtNormalMean", sprtNormalMean);
        finite(violations, "sprtAnomalousMean", sprtAnomalousMean);
        positive(violations, "sprtNormalStd", sprtNormalStd);
        positive(violations, "sprtAnomalousStd", sprtAnomalousStd);
        finite(violations, "sprtUpperBound", sprtUpperBound);
        finite(violations, "sprtLowerBound", sprtLowerBound);
        if (!(sprtUpperBound > sprtLowerBound)) {
            violations.add("sprtUpperBound must be greater than sprtLowerBound");
        }

        positive(violations, "pageHinkleyThreshold", pageHinkleyThreshold);
        nonNegative(violations, "pageHinkleyDelta", pageHinkleyDelta);
        if (!(pageHinkleyStatisticCap > pageHinkleyThreshold)) {
            violations.add("pageHinkleyStatisticCap must be greater than pageHinkleyThreshold");
        }
        positive(violations, "nominalSpeed", nominalSpeed);
        if (baselineMode == null) {
            violations.add("baselineMode is required");
        }

        if (quorum < 1 || quorum > voterCount) {
            violations.add("quorum must be between 1 and " + voterCount);
        }
        positive(violations, "confirmationRunLength", confirmationRunLength);
        positive(violations, "hysteresisRunLength", hysteresisRunLength);
        positive(violations, "historyCapacity", historyCapacity);
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            violations.add("tickInterval must be a positive duration");
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
        return this;
    }

    private static void positive(List<String> violations, String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            violations.add(name + " must be a positive number");
        }
    }

    private static void nonNegative(List<String> violations, String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            violations.add(name + " must be a non-negative number");
        }
    }

    private static void finite(List<String> violations, String name, double value) {
        if (!Double.isFinite(value)) {
            violations.add(name + " must be a finite number");
        }
    }

    /**
     * Origen de la velocidad de referencia usada por Page-Hinkley.
     */
    public enum BaselineMode {
        /**
         * Usa siempre {@code nominalSpeed}.
         */
        NOMINAL,

        /**
         * Media de las observaciones hechas en fase NORMAL, sembrada con {@code nominalSpeed}.
         * Se congela mientras la entidad tenga un episodio en curso.
         */
        LEARNED
    }
}
