package beambench.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Intercambio de casos y resultados con colaboradores externos mediante archivos JSON.
 * <p>
 * Las cargas polimórficas se escriben con el discriminador {@code "type"}
 * (POINT, UNIFORM, TRIANGULAR, MOMENT). Las marcas temporales de los resultados
 * usan el módulo de java.time.
 */
@Slf4j
public class JsonFileHandler {

    // Es thread-safe y costoso de crear: una única instancia.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Los resultados exponen campos derivados que no forman parte del constructor
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a la ruta indicada, sobrescribiendo el archivo si existe.
     *
     * @throws IOException Si falla la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        writeToFile(data, Paths.get(filePath));
    }

    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto del tipo indicado a partir de un archivo JSON.
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        return readFromFile(Paths.get(filePath), objectType);
    }

    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando {} a {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public String toJson(Object data) throws IOException {
        return objectMapper.writeValueAsString(data);
    }

    public <T> T fromJson(String json, Class<T> objectType) throws IOException {
        return objectMapper.readValue(json, objectType);
    }
}
