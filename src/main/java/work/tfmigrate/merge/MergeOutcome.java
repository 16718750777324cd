package work.tfmigrate.merge;

import java.util.List;

/**
 * What one orchestration pass did to a unit or document.
 *
 * @param skipped true when the pass had already run on this unit during the current invocation
 */
public record MergeOutcome(
    boolean skipped,
    int primariesUpdated,
    int satellitesRemoved,
    List<MergeDiagnostic> diagnostics
) {
    public MergeOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    public static MergeOutcome alreadyProcessed() {
        return new MergeOutcome(true, 0, 0, List.of());
    }
}
