package no.cantara.depguard.report;

import no.cantara.depguard.check.CheckRegistry;
import no.cantara.depguard.engine.DepguardEngine;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Classpath fixtures and a fixed clock shared by the report tests. */
final class Fixtures {

    static final Instant NOW = Instant.parse("2026-01-02T03:04:05Z");
    static final ToolMeta TOOL = new ToolMeta(ToolMeta.NAME, "0.0.0-test");

    private Fixtures() {}

    static Path path(String resource) {
        URL url = Fixtures.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalStateException("fixture missing: " + resource);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static Path workspace() {
        return path("fixtures/cli/workspace.yaml");
    }

    static Path config() {
        return path("fixtures/cli/depguard.yaml");
    }

    static DepguardRunner runner() {
        return new DepguardRunner(
                DepguardEngine.sequential(CheckRegistry.defaults()),
                TOOL, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
