package work.tfmigrate.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns satellites to primaries. Pure: inputs are never modified and the result depends only on them.
 */
public final class SatelliteMatcher {
    private static final Logger log = LoggerFactory.getLogger(SatelliteMatcher.class);

    private SatelliteMatcher() {}

    public static <H> MatchResult<H> match(List<PrimaryResource<H>> primaries, List<SatelliteResource<H>> satellites) {
        Map<PrimaryResource<H>, List<SatelliteResource<H>>> byPrimary = new LinkedHashMap<>();
        List<SatelliteResource<H>> orphans = new ArrayList<>();
        List<SatelliteResource<H>> unmatched = new ArrayList<>();
        warnOnDuplicateDefaults(primaries);

        for (var satellite : satellites) {
            PrimaryResource<H> target = null;
            var reference = satellite.target();
            if (reference instanceof TargetReference.Unparseable) {
                orphans.add(satellite);
                continue;
            }
            if (reference instanceof TargetReference.ImplicitDefault implicit) {
                target = findDefault(primaries, implicit.scope());
            } else if (reference instanceof TargetReference.Named named) {
                target = findNamed(primaries, named);
            }
            if (target == null) {
                unmatched.add(satellite);
            } else {
                byPrimary.computeIfAbsent(target, key -> new ArrayList<>()).add(satellite);
            }
        }

        List<MatchResult.Assignment<H>> assignments = new ArrayList<>();
        for (var primary : primaries) {
            var assigned = byPrimary.get(primary);
            if (assigned != null) {
                assignments.add(new MatchResult.Assignment<>(primary, assigned));
            }
        }
        return new MatchResult<>(assignments, orphans, unmatched);
    }

    private static <H> PrimaryResource<H> findDefault(List<PrimaryResource<H>> primaries, String scope) {
        for (var primary : primaries) {
            if (primary.variant() == Variant.DEFAULT && Objects.equals(primary.scope(), scope)) {
                return primary;
            }
        }
        return null;
    }

    private static <H> PrimaryResource<H> findNamed(List<PrimaryResource<H>> primaries, TargetReference.Named named) {
        PrimaryResource<H> fallback = null;
        for (var primary : primaries) {
            if (primary.key() == null || !primary.key().equals(named.key())) {
                continue;
            }
            if (named.kind() == null || primary.kind().equals(named.kind())) {
                return primary;
            }
            if (fallback == null) {
                fallback = primary;
            }
        }
        return fallback;
    }

    private static <H> void warnOnDuplicateDefaults(List<PrimaryResource<H>> primaries) {
        Map<String, List<String>> defaultsByScope = new LinkedHashMap<>();
        for (var primary : primaries) {
            if (primary.variant() == Variant.DEFAULT) {
                defaultsByScope
                    .computeIfAbsent(String.valueOf(primary.scope()), key -> new ArrayList<>())
                    .add(primary.kind() + "." + primary.name());
            }
        }
        defaultsByScope.forEach((scope, names) -> {
            if (names.size() > 1) {
                log.warn("Found {} default profiles {}; satellites without a reference go to {}",
                    names.size(), names, names.get(0));
            }
        });
    }
}
