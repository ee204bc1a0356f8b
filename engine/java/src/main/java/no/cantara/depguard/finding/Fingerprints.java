package no.cantara.depguard.finding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Stable SHA-256 identities for findings.
 *
 * <p>Identity fields are joined with {@code |} and hashed as UTF-8; the result is
 * 64 lower-case hex characters. Message text never takes part, so rewording a
 * finding keeps its fingerprint.
 */
public final class Fingerprints {

    private static final String DELIMITER = "|";

    private Fingerprints() {}

    /**
     * Fingerprint of a finding about one dependency declaration.
     *
     * @param extra optional disambiguator (dependency path, git URL), appended only when non-null
     */
    public static String forDependency(String checkId, String code, String manifestPath,
                                       String dependencyName, String extra) {
        List<String> parts = new ArrayList<>(List.of(checkId, code, manifestPath, dependencyName));
        if (extra != null) {
            parts.add(extra);
        }
        return sha256Hex(String.join(DELIMITER, parts));
    }

    /** Fingerprint of a workspace-level finding that has no single manifest. */
    public static String forWorkspace(String checkId, String code, String subject) {
        return sha256Hex(String.join(DELIMITER, checkId, code, subject));
    }

    static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
