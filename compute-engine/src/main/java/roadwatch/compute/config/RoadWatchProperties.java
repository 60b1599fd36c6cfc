package roadwatch.compute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import roadwatch.compute.simulation.SimulatorSettings;
import roadwatch.config.DetectionConfig;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuración externa del servicio ({@code roadwatch.*} en application.yml).
 * Los valores por defecto de detección reflejan {@link DetectionConfig#defaults()}.
 */
@Data
@ConfigurationProperties(prefix = "roadwatch")
public class RoadWatchProperties {

    private static final DetectionConfig DEFAULTS = DetectionConfig.defaults();

    private Stream stream = new Stream();
    private Simulator simulator = new Simulator();
    private Detection detection = new Detection();

    @Data
    public static class Stream {
        /**
         * Periodo del tick.
         */
        private Duration tickInterval = DEFAULTS.tickInterval();
        /**
         * Arranca el bucle de ticks al levantar el contexto.
         */
        private boolean autoStart = true;
        /**
         * Registros devueltos por defecto en el histórico.
         */
        private int historyLimit = 20;
        /**
         * Espera máxima de la API a que una orden se aplique antes de responder 202.
         */
        private Duration commandTimeout = Duration.ofSeconds(5);
        /**
         * Duración de una inyección cuando la petición no la indica.
         */
        private Duration defaultInjectionDuration = Duration.ofSeconds(120);
        /**
         * Mensajes en cola del publicador antes de descartar los más antiguos.
         */
        private int publisherQueueCapacity = 256;
    }

    @Data
    public static class Simulator {
        private int vehicleCount = 5;
        private Long seed;
        private double normalSpeedMean = 60.0;
        private double normalSpeedStd = 10.0;
        private double noiseLevel = 5.0;
        private double accidentSpeedMean = 15.0;
        private double accidentSpeedStd = 5.0;
        private double maxSpeed = 120.0;
        private double accidentProbability = 0.015;
        private Duration accidentDurationMean = Duration.ofSeconds(120);
        private Duration accidentDurationStd = Duration.ofSeconds(30);
        private Duration minAccidentDuration = Duration.ofSeconds(30);
        private double originLat = 37.7749;
        private double originLon = -122.4194;
        private double positionSpread = 0.005;
        private double positionJitter = 0.0002;
        /**
         * Zona horaria del factor por franja horaria; vacía para la del sistema.
         */
        private String zone;

        public SimulatorSettings toSettings() {
            return SimulatorSettings.builder()
                    .vehicleCount(vehicleCount)
                    .seed(seed)
                    .normalSpeedMean(normalSpeedMean)
                    .normalSpeedStd(normalSpeedStd)
                    .noiseLevel(noiseLevel)
                    .accidentSpeedMean(accidentSpeedMean)
                    .accidentSpeedStd(accidentSpeedStd)
                    .maxSpeed(maxSpeed)
                    .accidentProbability(accidentProbability)
                    .accidentDurationMean(accidentDurationMean)
                    .accidentDurationStd(accidentDurationStd)
                    .minAccidentDuration(minAccidentDuration)
                    .originLat(originLat)
                    .originLon(originLon)
                    .positionSpread(positionSpread)
                    .positionJitter(positionJitter)
                    .zoneId(zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone))
                    .build();
        }
    }

    @Data
    public static class Detection {
        private int windowSize = DEFAULTS.windowSize();
        private int predictorMinSamples = DEFAULTS.predictorMinSamples();
        private int warmupSamples = DEFAULTS.warmupSamples();
        private double cusumThreshold = DEFAULTS.cusumThreshold();
        private double cusumDrift = DEFAULTS.cusumDrift();
        private double sprtNormalMean = DEFAULTS.sprtNormalMean();
        private double sprtNormalStd = DEFAULTS.sprtNormalStd();
        private double sprtAnomalousMean = DEFAULTS.sprtAnomalousMean();
        private double sprtAnomalousStd = DEFAULTS.sprtAnomalousStd();
        private double sprtUpperBound = DEFAULTS.sprtUpperBound();
        private double sprtLowerBound = DEFAULTS.sprtLowerBound();
        private double pageHinkleyThreshold = DEFAULTS.pageHinkleyThreshold();
        private double pageHinkleyDelta = DEFAULTS.pageHinkleyDelta();
        private double pageHinkleyStatisticCap = DEFAULTS.pageHinkleyStatisticCap();
        private double nominalSpeed = DEFAULTS.nominalSpeed();
        private DetectionConfig.BaselineMode baselineMode = DEFAULTS.baselineMode();
        private int quorum = DEFAULTS.quorum();
        private int confirmationRunLength = DEFAULTS.confirmationRunLength();
        private int hysteresisRunLength = DEFAULTS.hysteresisRunLength();
        private int historyCapacity = DEFAULTS.historyCapacity();

        /**
         * Construye la configuración del motor. La validación la hace el propio motor.
         */
        public DetectionConfig toDetectionConfig(Duration tickInterval) {
            return DetectionConfig.builder()
                    .windowSize(windowSize)
                    .predictorMinSamples(predictorMinSamples)
                    .warmupSamples(warmupSamples)
                    .cusumThreshold(cusumThreshold)
                    .cusumDrift(cusumDrift)
                    .sprtNormalMean(sprtNormalMean)
                    .sprtNormalStd(sprtNormalStd)
                    .sprtAnomalousMean(sprtAnomalousMean)
                    .sprtAnomalousStd(sprtAnomalousStd)
                    .sprtUpperBound(sprtUpperBound)
                    .sprtLowerBound(sprtLowerBound)
                    .pageHinkleyThreshold(pageHinkleyThreshold)
                    .pageHinkleyDelta(pageHinkleyDelta)
                    .pageHinkleyStatisticCap(pageHinkleyStatisticCap)
                    .nominalSpeed(nominalSpeed)
                    .baselineMode(baselineMode)
                    .quorum(quorum)
                    .confirmationRunLength(confirmationRunLength)
                    .hysteresisRunLength(hysteresisRunLength)
                    .historyCapacity(historyCapacity)
                    .tickInterval(tickInterval)
                    .build();
        }
    }
}
