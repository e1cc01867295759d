package work.lcod.build.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.build.asset.AssetGlob;
import work.lcod.build.asset.AssetId;

/**
 * One phase of the build: a builder applied to the inputs of one package.
 *
 * <p>{@code buildExtensions} maps an input extension such as {@code .dart} to the output extensions it produces,
 * e.g. {@code .g.dart}. Actions with {@code hideOutput} write into the generated output directory instead of the
 * package itself.
 */
public record BuildAction(
    String packageName,
    String builderKey,
    Map<String, List<String>> buildExtensions,
    List<String> inputs,
    boolean hideOutput,
    BuilderOptions builderOptions
) {
    public static final List<String> DEFAULT_INPUTS = List.of("lib/**");

    public BuildAction {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(builderKey, "builderKey");
        Objects.requireNonNull(buildExtensions, "buildExtensions");
        if (buildExtensions.isEmpty()) {
            throw new IllegalArgumentException("Builder " + builderKey + " declares no build extensions");
        }
        var extensions = new LinkedHashMap<String, List<String>>();
        buildExtensions.forEach((input, outputs) -> extensions.put(input, List.copyOf(outputs)));
        buildExtensions = Collections.unmodifiableMap(extensions);
        inputs = inputs == null || inputs.isEmpty() ? DEFAULT_INPUTS : List.copyOf(inputs);
        builderOptions = builderOptions == null ? BuilderOptions.EMPTY : builderOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether {@code id} is a primary input of this action.
     */
    public boolean matchesInput(AssetId id) {
        if (!packageName.equals(id.packageName())) {
            return false;
        }
        if (inputs.stream().noneMatch(pattern -> new AssetGlob(pattern).matches(id.path()))) {
            return false;
        }
        return buildExtensions.keySet().stream().anyMatch(id.path()::endsWith);
    }

    /**
     * Outputs declared for {@code input}; the longest matching input extension wins.
     */
    public List<AssetId> expectedOutputs(AssetId input) {
        if (!matchesInput(input)) {
            return List.of();
        }
        String extension = buildExtensions.keySet().stream()
            .filter(input.path()::endsWith)
            .max(Comparator.comparingInt(String::length))
            .orElseThrow();
        List<AssetId> outputs = new ArrayList<>();
        for (String outputExtension : buildExtensions.get(extension)) {
            outputs.add(input.changeExtension(extension, outputExtension));
        }
        return outputs;
    }

    @Override
    public String toString() {
        return builderKey + " on " + packageName + (hideOutput ? " (hidden output)" : "");
    }

    public static final class Builder {
        private String packageName;
        private String builderKey;
        private Map<String, List<String>> buildExtensions = new LinkedHashMap<>();
        private List<String> inputs = DEFAULT_INPUTS;
        private boolean hideOutput;
        private BuilderOptions builderOptions = BuilderOptions.EMPTY;

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder builderKey(String builderKey) {
            this.builderKey = builderKey;
            return this;
        }

        public Builder buildExtension(String inputExtension, String... outputExtensions) {
            this.buildExtensions.put(inputExtension, List.of(outputExtensions));
            return this;
        }

        public Builder buildExtensions(Map<String, List<String>> buildExtensions) {
            this.buildExtensions = new LinkedHashMap<>(buildExtensions);
            return this;
        }

        public Builder inputs(List<String> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder hideOutput(boolean hideOutput) {
            this.hideOutput = hideOutput;
            return this;
        }

        public Builder builderOptions(BuilderOptions builderOptions) {
            this.builderOptions = builderOptions;
            return this;
        }

        public Builder builderOptions(Map<String, Object> config) {
            this.builderOptions = new BuilderOptions(config);
            return this;
        }

        public BuildAction build() {
            return new BuildAction(packageName, builderKey, buildExtensions, inputs, hideOutput, builderOptions);
        }
    }
}
