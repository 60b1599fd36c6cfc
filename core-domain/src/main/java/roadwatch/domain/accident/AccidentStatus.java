package roadwatch.domain.accident;

public enum AccidentStatus {
    ACTIVE, CLEARED
}
