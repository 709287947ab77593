package stableid.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableid.StableIdException;
import stableid.model.ElementIdentity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * JSON form of {@link ElementIdentity}.
 *
 * <p>Untrusted input ({@link #read(Path)}, {@link #parse(String)}) is checked
 * against {@code eid-schema.json} before it is mapped; unknown properties are
 * ignored so descriptors from newer writers still load.
 */
public final class EidJson {

    private static final Logger log = LoggerFactory.getLogger(EidJson.class);
    private static final String SCHEMA_RESOURCE = "/eid-schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static volatile JsonSchema jsonSchema;

    private EidJson() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * @throws IOException               if the file cannot be read or is not JSON
     * @throws SchemaValidationException if the JSON does not describe a descriptor
     * @throws SchemaVersionException    if the major version is not supported
     */
    public static ElementIdentity read(Path path) throws IOException {
        log.debug("Reading descriptor from: {}", path);
        return parse(Files.readString(path), path.toString());
    }

    /** Validating parse of an untrusted JSON string. */
    public static ElementIdentity parse(String json) throws IOException {
        return parse(json, "<string>");
    }

    public static void write(ElementIdentity eid, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), eid);
        log.debug("Wrote descriptor for <{}> to {}", eid.target() != null ? eid.target().tag() : "?", path);
    }

    public static String toJson(ElementIdentity eid) throws IOException {
        return MAPPER.writeValueAsString(eid);
    }

    /** Maps JSON without schema validation; use {@link #parse(String)} for untrusted input. */
    public static ElementIdentity fromJson(String json) throws IOException {
        return MAPPER.readValue(json, ElementIdentity.class);
    }

    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Internals ─────────────────────────────────────────────────────────

    private static ElementIdentity parse(String json, String source) throws IOException {
        JsonNode tree = MAPPER.readTree(json);
        if (tree == null || tree.isMissingNode()) {
            throw new SchemaValidationException("Empty descriptor in " + source);
        }
        validateSchema(tree, source);
        ElementIdentity eid = MAPPER.treeToValue(tree, ElementIdentity.class);
        if (!isMajorVersionSupported(eid.version())) {
            throw new SchemaVersionException("Unsupported descriptor version: " + eid.version()
                    + " (expected: " + ElementIdentity.CURRENT_VERSION + ")");
        }
        return eid;
    }

    static boolean isMajorVersionSupported(String version) {
        if (version == null) return false;
        String major = ElementIdentity.CURRENT_VERSION.split("\\.")[0];
        return version.equals(major) || version.startsWith(major + ".");
    }

    private static void validateSchema(JsonNode tree, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("eid-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (jsonSchema == null) {
            synchronized (EidJson.class) {
                if (jsonSchema == null) {
                    try (InputStream is = EidJson.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        jsonSchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return jsonSchema;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaVersionException extends StableIdException {
        public SchemaVersionException(String msg) { super(msg); }
    }

    public static class SchemaValidationException extends StableIdException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
