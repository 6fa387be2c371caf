package acoustictelemetry.domain.telemetry;

import java.util.List;

/**
 * Secuencia de transmisiones generada a lo largo de una trayectoria.
 *
 * @param events        Transmisiones en orden estrictamente creciente de tiempo.
 * @param burstDuration Duración de cada ráfaga; solo metadato para el análisis de colisiones.
 * @param traversalTime Tiempo que tarda el transmisor en recorrer toda la trayectoria.
 */
public record TransmissionSchedule(List<TransmissionEvent> events, double burstDuration, double traversalTime) {

    public TransmissionSchedule {
        events = List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
