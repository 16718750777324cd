package work.tfmigrate.merge;

import java.util.List;

/**
 * Outcome of matching satellites to primaries. Every satellite appears exactly once: in one assignment,
 * among the orphans, or among the unmatched.
 *
 * @param orphans satellites whose reference could not be resolved
 * @param unmatched satellites whose target does not exist in the unit
 */
public record MatchResult<H>(
    List<Assignment<H>> assignments,
    List<SatelliteResource<H>> orphans,
    List<SatelliteResource<H>> unmatched
) {
    public MatchResult {
        assignments = List.copyOf(assignments);
        orphans = List.copyOf(orphans);
        unmatched = List.copyOf(unmatched);
    }

    /**
     * A primary and the satellites that belong to it, in encounter order.
     */
    public record Assignment<H>(PrimaryResource<H> primary, List<SatelliteResource<H>> satellites) {
        public Assignment {
            satellites = List.copyOf(satellites);
        }
    }
}
