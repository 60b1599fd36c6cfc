package roadwatch.compute.simulation;

import lombok.Getter;

import java.time.Instant;

/**
 * Vehículo simulado: desplazamiento fijo en el mapa y, si lo hay, fin del accidente en curso.
 */
@Getter
class SimulatedVehicle {

    private final String id;
    private final double latOffset;
    private final double lonOffset;
    private Instant accidentEndsAt;

    SimulatedVehicle(String id, double latOffset, double lonOffset) {
        this.id = id;
        this.latOffset = latOffset;
        this.lonOffset = lonOffset;
    }

    boolean isInAccident(Instant now) {
        if (accidentEndsAt == null) {
            return false;
        }
        if (!now.isBefore(accidentEndsAt)) {
            accidentEndsAt = null;
            return false;
        }
        return true;
    }

    void startAccident(Instant endsAt) {
        this.accidentEndsAt = endsAt;
    }

    void clearAccident() {
        this.accidentEndsAt = null;
    }
}
