package agentswarm.coordinator.registry;

import agentswarm.coordinator.model.Lease;
import agentswarm.coordinator.model.SessionMapping;
import agentswarm.coordinator.model.StatusRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding of the registry records. Readers ignore unknown fields.
 */
public final class RegistryCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private RegistryCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(Lease lease) {
        return write(lease);
    }

    public static String encode(StatusRecord status) {
        return write(status);
    }

    public static String encode(SessionMapping mapping) {
        return write(mapping);
    }

    /**
     * @throws IllegalArgumentException if the value is not a lease
     */
    public static Lease decodeLease(String raw) {
        return read(raw, Lease.class);
    }

    /**
     * Accepts the tagged object form as well as a bare {@code done} value.
     *
     * @throws IllegalArgumentException if the value is not a terminal status
     */
    public static StatusRecord decodeStatus(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("status record is null");
        }
        String trimmed = raw.trim();
        if ("done".equals(trimmed) || "\"done\"".equals(trimmed)) {
            return StatusRecord.done();
        }
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            if (node.isTextual()) {
                throw new IllegalArgumentException("Unknown bare status value: " + abbreviate(raw));
            }
            return MAPPER.treeToValue(node, StatusRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed status record: " + abbreviate(raw), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value is not a mapping
     */
    public static SessionMapping decodeMapping(String raw) {
        return read(raw, SessionMapping.class);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(String raw, Class<T> type) {
        if (raw == null) {
            throw new IllegalArgumentException(type.getSimpleName() + " is null");
        }
        try {
            return MAPPER.readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + ": " + abbreviate(raw), e);
        }
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 120 ? raw : raw.substring(0, 117) + "...";
    }
}
