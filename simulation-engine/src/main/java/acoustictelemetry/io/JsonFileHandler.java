package acoustictelemetry.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lee configuraciones de simulación desde JSON y exporta resultados a JSON.
 * <p>
 * Genérico sobre el tipo: cualquier objeto compatible con Jackson (records, clases con
 * builder {@code @Jacksonized}).
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: se comparte
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Un campo desconocido en una configuración suele ser una errata: mejor fallar
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public static ObjectMapper mapper() {
        return objectMapper;
    }

    /**
     * Serializa un objeto a un archivo JSON; si ya existe se sobrescribe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON al tipo indicado.
     *
     * @throws IOException Si el archivo no existe o no se puede leer o interpretar.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Deserializando archivo {} a {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o interpretar el archivo JSON {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un recurso del classpath (p. ej. una configuración empaquetada).
     *
     * @throws IOException Si el recurso no existe o no se puede interpretar.
     */
    public <T> T readFromResource(String resourceName, Class<T> objectType) throws IOException {
        log.info("Deserializando recurso {} a {}", resourceName, objectType.getSimpleName());
        try (InputStream in = JsonFileHandler.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Recurso no encontrado en el classpath: " + resourceName);
            }
            return objectMapper.readValue(in, objectType);
        }
    }
}
