package roadwatch.domain.traffic;

public record GeoPoint(double lat, double lon) {}
