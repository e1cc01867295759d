package work.lcod.build.asset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

class DigestTest {
    @Test
    void hashesWithSha256() {
        assertEquals(
            "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            Digest.of(new byte[0]).hex()
        );
    }

    @Test
    void differentContentGivesDifferentDigest() {
        assertNotEquals(Digest.of("a"), Digest.of("b"));
    }

    @Test
    void normalizesHexCase() {
        assertEquals(new Digest("abcdef"), new Digest("ABCDEF"));
    }
}
