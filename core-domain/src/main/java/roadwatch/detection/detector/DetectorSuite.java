package roadwatch.detection.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lista extensible de detectores que votan. Añadir un test nuevo es registrarlo aquí;
 * la votación sólo ve una lista de votos.
 */
public final class DetectorSuite {

    private final List<Supplier<? extends ChangePointDetector>> factories;

    private DetectorSuite(List<Supplier<? extends ChangePointDetector>> factories) {
        if (factories.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos un detector.");
        }
        this.factories = List.copyOf(factories);
    }

    /**
     * CUSUM, SPRT y Page-Hinkley, en ese orden.
     */
    public static DetectorSuite standard() {
        return new DetectorSuite(List.of(CusumDetector::new, SprtDetector::new, PageHinkleyDetector::new));
    }

    public static DetectorSuite of(List<Supplier<? extends ChangePointDetector>> factories) {
        return new DetectorSuite(factories);
    }

    public DetectorSuite with(Supplier<? extends ChangePointDetector> factory) {
        List<Supplier<? extends ChangePointDetector>> extended = new ArrayList<>(factories);
        extended.add(factory);
        return new DetectorSuite(extended);
    }

    /**
     * Instancias nuevas (estado a cero) para una entidad recién vista.
     */
    public List<ChangePointDetector> create() {
        List<ChangePointDetector> detectors = new ArrayList<>(factories.size());
        for (Supplier<? extends ChangePointDetector> factory : factories) {
            detectors.add(factory.get());
        }
        return detectors;
    }

    public int size() {
        return factories.size();
    }
}
