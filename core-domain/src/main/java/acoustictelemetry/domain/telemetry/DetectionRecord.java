package acoustictelemetry.domain.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Detección simulada de una transmisión por un receptor.
 * Los nombres JSON siguen el esquema de salida de detecciones.
 */
@JsonPropertyOrder({"transmission_id", "receiver_id", "receiver_x", "receiver_y",
        "transmission_x", "transmission_y", "elapsed_time"})
public record DetectionRecord(
        @JsonProperty("transmission_id") int transmissionId,
        @JsonProperty("receiver_id") int receiverId,
        @JsonProperty("receiver_x") double receiverX,
        @JsonProperty("receiver_y") double receiverY,
        @JsonProperty("transmission_x") double transmissionX,
        @JsonProperty("transmission_y") double transmissionY,
        @JsonProperty("elapsed_time") double elapsedTime
) {

    public static DetectionRecord of(TransmissionEvent transmission, Receiver receiver) {
        return new DetectionRecord(
                transmission.transmissionId(),
                receiver.receiverId(),
                receiver.x(),
                receiver.y(),
                transmission.x(),
                transmission.y(),
                transmission.elapsedTime());
    }
}
