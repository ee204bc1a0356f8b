package no.cantara.depguard.finding;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintsTest {

    private static final String CHECK = "deps.no_wildcards";
    private static final String CODE = "wildcard_version";

    @Test
    void digestIsSha256Hex() {
        String fp = Fingerprints.forDependency(CHECK, CODE, "Cargo.toml", "serde", null);
        assertEquals(64, fp.length());
        assertTrue(fp.matches("[0-9a-f]{64}"));
    }

    @Test
    void knownDigestOfJoinedFields() {
        assertEquals("157bc9aee66a5aaf94de931c73988ed120f75c0178d597d32fd3ba19c72543d8",
                Fingerprints.forDependency(CHECK, CODE, "Cargo.toml", "serde", null));
        assertEquals(Fingerprints.sha256Hex("a|b|c|d"), Fingerprints.forDependency("a", "b", "c", "d", null));
        assertEquals(Fingerprints.sha256Hex("a|b|c|d|e"), Fingerprints.forDependency("a", "b", "c", "d", "e"));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", Fingerprints.sha256Hex(""));
    }

    @Test
    void sameInputsSameDigest() {
        for (int i = 0; i < 5; i++) {
            assertEquals(
                    Fingerprints.forDependency(CHECK, CODE, "crates/a/Cargo.toml", "serde", "../b"),
                    Fingerprints.forDependency(CHECK, CODE, "crates/a/Cargo.toml", "serde", "../b"));
        }
    }

    @Test
    void everyFieldTakesPart() {
        Set<String> digests = new HashSet<>();
        digests.add(Fingerprints.forDependency(CHECK, CODE, "Cargo.toml", "serde", null));
        digests.add(Fingerprints.forDependency("deps.other", CODE, "Cargo.toml", "serde", null));
        digests.add(Fingerprints.forDependency(CHECK, "other_code", "Cargo.toml", "serde", null));
        digests.add(Fingerprints.forDependency(CHECK, CODE, "a/Cargo.toml", "serde", null));
        digests.add(Fingerprints.forDependency(CHECK, CODE, "Cargo.toml", "tokio", null));
        digests.add(Fingerprints.forDependency(CHECK, CODE, "Cargo.toml", "serde", "../x"));
        assertEquals(6, digests.size());
    }

    @Test
    void workspaceFingerprintDiffersFromDependencyFingerprint() {
        assertNotEquals(
                Fingerprints.forWorkspace(CHECK, CODE, "serde"),
                Fingerprints.forDependency(CHECK, CODE, "serde", "", null));
    }
}
