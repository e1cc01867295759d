package work.lcod.build.asset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AssetGlobTest {
    @Test
    void doubleStarMatchesNestedFiles() {
        var glob = new AssetGlob("lib/**");
        assertTrue(glob.matches("lib/a.dart"));
        assertTrue(glob.matches("lib/src/deep/b.dart"));
        assertFalse(glob.matches("test/a_test.dart"));
    }

    @Test
    void extensionGlobFiltersFiles() {
        var glob = new AssetGlob("lib/dev_compiler/**.js");
        assertTrue(glob.matches("lib/dev_compiler/amd/require.js"));
        assertFalse(glob.matches("lib/dev_compiler/README.md"));
    }

    @Test
    void reportsLiteralPrefix() {
        assertEquals("lib/dev_compiler", new AssetGlob("lib/dev_compiler/**.js").literalPrefix());
        assertEquals("", new AssetGlob("**.dart").literalPrefix());
        assertEquals(".lcod_build", new AssetGlob(".lcod_build/asset_graph.json").literalPrefix());
    }

    @Test
    void detectsLiteralPatterns() {
        assertTrue(new AssetGlob("build.yaml").isLiteral());
        assertFalse(new AssetGlob("lib/**").isLiteral());
    }
}
