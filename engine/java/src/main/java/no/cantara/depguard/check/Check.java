package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.EffectiveConfig;

import java.util.List;

/**
 * One independent policy rule over the workspace model.
 *
 * <p>Implementations read only the model and config, append to {@code out}, and never
 * throw for any well-formed model. A check whose policy is absent or disabled appends
 * nothing. Output order is irrelevant; the engine sorts afterwards.
 */
public interface Check {

    /** Stable dotted identifier, also the key of the check's policy. */
    String id();

    void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out);
}
