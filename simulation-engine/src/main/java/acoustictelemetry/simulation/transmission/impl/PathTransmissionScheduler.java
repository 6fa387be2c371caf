package acoustictelemetry.simulation.transmission.impl;

import acoustictelemetry.domain.exception.SimulationValidationException;
import acoustictelemetry.domain.geometry.Path;
import acoustictelemetry.domain.telemetry.TransmissionEvent;
import acoustictelemetry.domain.telemetry.TransmissionSchedule;
import acoustictelemetry.simulation.transmission.DelayDistribution;
import acoustictelemetry.simulation.transmission.TransmissionScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Recorre la trayectoria a velocidad constante y emite una transmisión tras cada retardo.
 * <p>
 * La primera transmisión ocurre en t = 0 en el origen. La posición de cada emisión se
 * interpola sobre la trayectoria a la distancia {@code velocity * t}. La emisión termina en
 * cuanto el tiempo supera el necesario para recorrer la trayectoria completa.
 */
@Slf4j
public class PathTransmissionScheduler implements TransmissionScheduler {

    @Override
    public TransmissionSchedule scheduleTransmissions(Path path, double velocity, DelayDistribution delays,
                                                      double burstDuration, Random random) {
        if (path == null) {
            throw new SimulationValidationException("Falta la trayectoria sobre la que transmitir.");
        }
        if (!(velocity > 0.0) || !Double.isFinite(velocity)) {
            throw new SimulationValidationException("La velocidad debe ser positiva: " + velocity);
        }
        if (!(burstDuration >= 0.0) || !Double.isFinite(burstDuration)) {
            throw new SimulationValidationException("La duración de ráfaga debe ser no negativa: " + burstDuration);
        }
        if (delays == null || random == null) {
            throw new SimulationValidationException("Faltan la distribución de retardos o el generador aleatorio.");
        }

        double traversalTime = path.totalLength() / velocity;
        List<TransmissionEvent> events = new ArrayList<>();

        int id = 1;
        double elapsed = 0.0;
        events.add(new TransmissionEvent(id++, path.origin(), elapsed));

        while (true) {
            double delay = delays.draw(random);
            if (!(delay > 0.0) || !Double.isFinite(delay)) {
                throw new SimulationValidationException("La distribución de retardos devolvió un valor no positivo: " + delay);
            }
            elapsed += delay;
            if (elapsed > traversalTime) {
                break;
            }
            events.add(new TransmissionEvent(id++, path.interpolate(velocity * elapsed), elapsed));
        }

        log.debug("{} transmisiones generadas sobre {} m de trayectoria ({} s).",
                events.size(), path.totalLength(), traversalTime);
        return new TransmissionSchedule(events, burstDuration, traversalTime);
    }
}
