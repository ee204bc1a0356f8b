package no.cantara.depguard.model;

import java.util.Map;
import java.util.TreeMap;

/**
 * The constraint a manifest declares for one dependency.
 *
 * <p>When {@code workspace} is true the declaration inherits from the shared
 * workspace definition, and its own {@code version}/{@code path} are not
 * interpreted independently.
 *
 * @param defaultFeatures explicit default-features flag, or {@code null} when unspecified
 */
public record DepSpec(
        String version,
        String path,
        boolean workspace,
        String git,
        String branch,
        String tag,
        String rev,
        Boolean defaultFeatures,
        boolean optional
) {

    public static DepSpec ofVersion(String version) {
        return builder().version(version).build();
    }

    public static DepSpec ofPath(String path) {
        return builder().path(path).build();
    }

    public static DepSpec inherited() {
        return builder().workspace(true).build();
    }

    /** True when this spec carries its own version requirement. */
    public boolean isIndependentlyVersioned() {
        return !workspace && version != null;
    }

    /** The spec as a key-ordered map holding only the fields that are set. */
    public Map<String, Object> toData() {
        Map<String, Object> m = new TreeMap<>();
        if (version != null) m.put("version", version);
        if (path != null) m.put("path", path);
        if (workspace) m.put("workspace", true);
        if (git != null) m.put("git", git);
        if (branch != null) m.put("branch", branch);
        if (tag != null) m.put("tag", tag);
        if (rev != null) m.put("rev", rev);
        if (defaultFeatures != null) m.put("default-features", defaultFeatures);
        if (optional) m.put("optional", true);
        return m;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String version;
        private String path;
        private boolean workspace;
        private String git;
        private String branch;
        private String tag;
        private String rev;
        private Boolean defaultFeatures;
        private boolean optional;

        private Builder() {}

        public Builder version(String version) { this.version = version; return this; }
        public Builder path(String path) { this.path = path; return this; }
        public Builder workspace(boolean workspace) { this.workspace = workspace; return this; }
        public Builder git(String git) { this.git = git; return this; }
        public Builder branch(String branch) { this.branch = branch; return this; }
        public Builder tag(String tag) { this.tag = tag; return this; }
        public Builder rev(String rev) { this.rev = rev; return this; }
        public Builder defaultFeatures(Boolean defaultFeatures) { this.defaultFeatures = defaultFeatures; return this; }
        public Builder optional(boolean optional) { this.optional = optional; return this; }

        public DepSpec build() {
            return new DepSpec(version, path, workspace, git, branch, tag, rev, defaultFeatures, optional);
        }
    }
}
