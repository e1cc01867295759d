package work.lcod.build.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageNode;
import work.lcod.build.shared.BuildPaths;

/**
 * Loads the ordered build actions from {@code build.yaml} files.
 *
 * <p>Every package may define builders; only the root package lists phases:
 *
 * <pre>
 * builders:
 *   codegen:
 *     build_extensions:
 *       .dart: [.g.dart]
 *     hide_output: false
 * phases:
 *   - builder: "|codegen"
 *     target: ":$default"
 *     inputs: [lib/**]
 *     options:
 *       verbose: true
 * </pre>
 */
public final class BuildConfigLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private BuildConfigLoader() {}

    public static List<BuildAction> load(PackageGraph packageGraph) {
        Map<String, BuilderDefinition> definitions = new LinkedHashMap<>();
        for (PackageNode node : packageGraph.allPackages().values()) {
            JsonNode config = readConfig(node);
            if (config != null) {
                definitions.putAll(readDefinitions(config.get("builders"), node.name()));
            }
        }
        JsonNode rootConfig = readConfig(packageGraph.root());
        if (rootConfig == null || !rootConfig.hasNonNull("phases")) {
            return List.of();
        }
        return readPhases(rootConfig.get("phases"), packageGraph, definitions);
    }

    private static JsonNode readConfig(PackageNode node) {
        Path file = node.path().resolve(BuildPaths.BUILD_CONFIG_FILE);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try (var in = Files.newInputStream(file)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root != null && !root.isNull() && !root.isObject()) {
                throw new IllegalStateException("Build configuration must be a mapping: " + file);
            }
            return root;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read build configuration: " + file, ex);
        }
    }

    private static Map<String, BuilderDefinition> readDefinitions(JsonNode builders, String packageName) {
        Map<String, BuilderDefinition> definitions = new LinkedHashMap<>();
        if (builders == null || builders.isNull()) {
            return definitions;
        }
        if (!builders.isObject()) {
            throw new IllegalStateException("'builders' in package " + packageName + " must be a mapping");
        }
        var fields = builders.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            String key = KeyNormalization.normalizeBuilderKeyDefinition(entry.getKey(), packageName);
            JsonNode body = entry.getValue();
            Map<String, List<String>> extensions = readExtensions(key, body.get("build_extensions"));
            boolean hideOutput = body.path("hide_output").asBoolean(false);
            definitions.put(key, new BuilderDefinition(key, extensions, hideOutput));
        }
        return definitions;
    }

    private static Map<String, List<String>> readExtensions(String builderKey, JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            throw new IllegalStateException("Builder " + builderKey + " must declare build_extensions");
        }
        Map<String, List<String>> extensions = new LinkedHashMap<>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            extensions.put(entry.getKey(), readStrings(entry.getValue()));
        }
        return extensions;
    }

    private static List<BuildAction> readPhases(
        JsonNode phases,
        PackageGraph packageGraph,
        Map<String, BuilderDefinition> definitions
    ) {
        if (!phases.isArray()) {
            throw new IllegalStateException("'phases' must be a list");
        }
        String rootName = packageGraph.root().name();
        List<BuildAction> actions = new ArrayList<>();
        for (JsonNode phase : phases) {
            String usage = phase.path("builder").asText("");
            if (usage.isBlank()) {
                throw new IllegalStateException("Every phase must name a builder: " + phase);
            }
            String builderKey = KeyNormalization.normalizeBuilderKeyUsage(usage, rootName);
            BuilderDefinition definition = definitions.get(builderKey);
            if (definition == null) {
                throw new IllegalStateException("Unknown builder " + builderKey + " (referenced as '" + usage + "')");
            }
            String target = KeyNormalization.normalizeTargetKeyUsage(phase.path("target").asText(":$default"), rootName);
            String packageName = target.substring(0, target.indexOf(':'));
            packageGraph.require(packageName);

            actions.add(BuildAction.builder()
                .packageName(packageName)
                .builderKey(builderKey)
                .buildExtensions(definition.buildExtensions())
                .inputs(phase.hasNonNull("inputs") ? readStrings(phase.get("inputs")) : BuildAction.DEFAULT_INPUTS)
                .hideOutput(phase.has("hide_output") ? phase.get("hide_output").asBoolean() : definition.hideOutput())
                .builderOptions(readOptions(phase.get("options")))
                .build());
        }
        return actions;
    }

    private static List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                values.add(item.asText());
            }
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private static BuilderOptions readOptions(JsonNode node) {
        if (node == null || node.isNull()) {
            return BuilderOptions.EMPTY;
        }
        if (!node.isObject()) {
            throw new IllegalStateException("Builder options must be a mapping: " + node);
        }
        Map<String, Object> config = new LinkedHashMap<>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            config.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return new BuilderOptions(config);
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private record BuilderDefinition(String key, Map<String, List<String>> buildExtensions, boolean hideOutput) {}
}
