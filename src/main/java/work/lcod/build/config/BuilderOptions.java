package work.lcod.build.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.build.asset.Digest;

/**
 * Opaque options blob handed to one builder. Only its digest matters to build preparation.
 */
public record BuilderOptions(Map<String, Object> config) {
    static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static final BuilderOptions EMPTY = new BuilderOptions(Map.of());

    public BuilderOptions {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public String toCanonicalJson() {
        try {
            return CANONICAL_JSON.writeValueAsString(config);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Builder options are not serializable: " + ex.getMessage(), ex);
        }
    }

    public Digest digest() {
        return Digest.of(toCanonicalJson());
    }
}
