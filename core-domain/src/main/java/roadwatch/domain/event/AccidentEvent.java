package roadwatch.domain.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Evento de ciclo de vida emitido como máximo una vez por transición,
 * siempre después de la instantánea del tick que lo provocó.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type"
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = AccidentOpenedEvent.class, name = "ACCIDENT_OPENED"),
        @JsonSubTypes.Type(value = AccidentClearedEvent.class, name = "ACCIDENT_CLEARED")
})
public interface AccidentEvent {

    /**
     * Identificador del registro de accidente al que se refiere el evento.
     */
    String id();

    String entityId();
}
