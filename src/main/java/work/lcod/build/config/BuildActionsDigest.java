package work.lcod.build.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.build.asset.Digest;

/**
 * Fingerprints the ordered structure of the configured build actions.
 *
 * <p>Builder options are left out: each phase's options are tracked by its own builder options node so that an
 * options change only invalidates that phase.
 */
public final class BuildActionsDigest {
    private BuildActionsDigest() {}

    public static Digest compute(List<BuildAction> actions) {
        List<Map<String, Object>> records = new ArrayList<>(actions.size());
        for (BuildAction action : actions) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("package", action.packageName());
            record.put("builder", action.builderKey());
            record.put("inputs", action.inputs());
            record.put("buildExtensions", action.buildExtensions());
            record.put("hideOutput", action.hideOutput());
            records.add(record);
        }
        try {
            return Digest.of(BuilderOptions.CANONICAL_JSON.writeValueAsString(records));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to fingerprint build actions: " + ex.getMessage(), ex);
        }
    }
}
