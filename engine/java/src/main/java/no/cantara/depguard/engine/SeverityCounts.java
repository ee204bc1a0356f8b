package no.cantara.depguard.engine;

import no.cantara.depguard.finding.Finding;

import java.util.List;

/**
 * Number of findings per severity.
 */
public record SeverityCounts(int info, int warning, int error) {

    public static SeverityCounts of(List<Finding> findings) {
        int info = 0, warning = 0, error = 0;
        for (Finding f : findings) {
            switch (f.severity()) {
                case INFO -> info++;
                case WARNING -> warning++;
                case ERROR -> error++;
            }
        }
        return new SeverityCounts(info, warning, error);
    }

    public int total() {
        return info + warning + error;
    }
}
