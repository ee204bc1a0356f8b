package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.EffectiveConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckRegistryTest {

    @Test
    void defaultsRegisterEveryCheckInOrder() {
        assertEquals(CheckIds.ALL_CHECKS, CheckRegistry.defaults().ids());
    }

    @Test
    void findById() {
        CheckRegistry registry = CheckRegistry.defaults();
        assertInstanceOf(PathSafetyCheck.class, registry.find(CheckIds.DEPS_PATH_SAFETY).orElseThrow());
        assertTrue(registry.find("deps.not_a_check").isEmpty());
    }

    @Test
    void duplicateIdsAreRejected() {
        Check custom = new Check() {
            @Override
            public String id() {
                return CheckIds.DEPS_NO_WILDCARDS;
            }

            @Override
            public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
            }
        };
        assertThrows(IllegalArgumentException.class,
                () -> CheckRegistry.of(List.of(new NoWildcardsCheck(), custom)));
    }
}
