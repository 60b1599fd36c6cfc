package roadwatch.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/api/v1";

    // Rutas REST
    public static final String STREAM = CURRENT_VERSION + "/stream";
    public static final String ACCIDENTS = CURRENT_VERSION + "/accidents";

    // Destinos STOMP
    public static final String WS_ENDPOINT = "/ws";
    public static final String TOPIC_TRAFFIC = "/topic/traffic";
    public static final String TOPIC_ACCIDENT_OPENED = "/topic/accidents/opened";
    public static final String TOPIC_ACCIDENT_CLEARED = "/topic/accidents/cleared";
    public static final String TOPIC_STREAM_STATUS = "/topic/stream/status";
}
