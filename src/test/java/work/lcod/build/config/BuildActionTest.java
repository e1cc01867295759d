package work.lcod.build.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.build.asset.AssetId;

class BuildActionTest {
    @Test
    void matchesInputsByPackageGlobAndExtension() {
        var action = BuildAction.builder()
            .packageName("app")
            .builderKey("app|codegen")
            .buildExtension(".dart", ".g.dart")
            .build();

        assertTrue(action.matchesInput(new AssetId("app", "lib/a.dart")));
        assertFalse(action.matchesInput(new AssetId("app", "test/a.dart")));
        assertFalse(action.matchesInput(new AssetId("app", "lib/a.txt")));
        assertFalse(action.matchesInput(new AssetId("dep", "lib/a.dart")));
    }

    @Test
    void longestInputExtensionWins() {
        var action = BuildAction.builder()
            .packageName("app")
            .builderKey("app|gen")
            .buildExtension(".dart", ".g.dart")
            .buildExtension(".model.dart", ".model.json", ".model.g.dart")
            .build();

        assertEquals(
            List.of(new AssetId("app", "lib/user.model.json"), new AssetId("app", "lib/user.model.g.dart")),
            action.expectedOutputs(new AssetId("app", "lib/user.model.dart"))
        );
        assertEquals(List.of(), action.expectedOutputs(new AssetId("app", "web/main.dart")));
    }

    @Test
    void requiresBuildExtensions() {
        assertThrows(IllegalArgumentException.class, () -> BuildAction.builder()
            .packageName("app")
            .builderKey("app|empty")
            .build());
    }

    @Test
    void actionsDigestIgnoresOptionsButTracksStructure() {
        var base = BuildAction.builder().packageName("app").builderKey("app|gen").buildExtension(".dart", ".g.dart");
        var plain = base.build();
        var withOptions = base.builderOptions(Map.<String, Object>of("verbose", true)).build();
        var hidden = base.hideOutput(true).build();

        assertEquals(BuildActionsDigest.compute(List.of(plain)), BuildActionsDigest.compute(List.of(withOptions)));
        assertNotEquals(BuildActionsDigest.compute(List.of(plain)), BuildActionsDigest.compute(List.of(hidden)));
        assertNotEquals(BuildActionsDigest.compute(List.of(plain)), BuildActionsDigest.compute(List.of(plain, plain)));
    }

    @Test
    void optionsDigestIsIndependentOfKeyOrder() {
        var first = new java.util.LinkedHashMap<String, Object>();
        first.put("a", 1);
        first.put("b", 2);
        var second = new java.util.LinkedHashMap<String, Object>();
        second.put("b", 2);
        second.put("a", 1);
        assertEquals(new BuilderOptions(first).digest(), new BuilderOptions(second).digest());
        assertNotEquals(BuilderOptions.EMPTY.digest(), new BuilderOptions(first).digest());
    }
}
