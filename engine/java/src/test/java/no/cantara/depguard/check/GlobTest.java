package no.cantara.depguard.check;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobTest {

    @Test
    void literalMatchesExactly() {
        Glob g = Glob.compile("serde");
        assertTrue(g.matches("serde"));
        assertFalse(g.matches("serde_json"));
        assertFalse(g.matches("Serde"));
    }

    @Test
    void starMatchesAnyRunIncludingSeparators() {
        assertTrue(Glob.compile("serde*").matches("serde_json"));
        assertTrue(Glob.compile("serde*").matches("serde"));
        assertTrue(Glob.compile("/opt/*").matches("/opt/vendor/lib"));
        assertTrue(Glob.compile("../**").matches("../outside/deep/lib"));
    }

    @Test
    void questionMarkMatchesOneCharacter() {
        Glob g = Glob.compile("tokio-?");
        assertTrue(g.matches("tokio-x"));
        assertFalse(g.matches("tokio-"));
        assertFalse(g.matches("tokio-xy"));
    }

    @Test
    void characterClasses() {
        assertTrue(Glob.compile("v[0-9]").matches("v7"));
        assertFalse(Glob.compile("v[0-9]").matches("vx"));
        assertTrue(Glob.compile("v[!0-9]").matches("vx"));
        assertFalse(Glob.compile("v[!0-9]").matches("v1"));
        assertTrue(Glob.compile("[]]").matches("]"));
    }

    @Test
    void alternation() {
        Glob g = Glob.compile("{serde,tokio}*");
        assertTrue(g.matches("serde_derive"));
        assertTrue(g.matches("tokio"));
        assertFalse(g.matches("rand"));
    }

    @Test
    void regexMetacharactersAreLiteral() {
        assertTrue(Glob.compile("a.b+c").matches("a.b+c"));
        assertFalse(Glob.compile("a.b").matches("axb"));
        assertTrue(Glob.compile("\\*").matches("*"));
        assertFalse(Glob.compile("\\*").matches("x"));
    }

    @Test
    void invalidPatternsAreRejected() {
        for (String bad : List.of("[abc", "{a,b", "{a,{b}}", "abc\\", "a}")) {
            GlobSyntaxException e = assertThrows(GlobSyntaxException.class, () -> Glob.compile(bad), bad);
            assertEquals(bad, e.pattern());
        }
    }

    @Test
    void allowlistMatchesAnyPattern() {
        Allowlist allow = Allowlist.of(List.of("serde*", "tokio"));
        assertTrue(allow.isAllowed("serde_json"));
        assertTrue(allow.isAllowed("tokio"));
        assertFalse(allow.isAllowed("rand"));
        assertTrue(Allowlist.of(List.of()).isEmpty());
        assertFalse(Allowlist.of(null).isAllowed("anything"));
    }
}
