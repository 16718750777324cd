package work.tfmigrate.merge;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.hcl.Body;

/**
 * Turns unresolved satellites into diagnostics and writes them as trailing annotation blocks.
 *
 * <p>Each block opens with {@link #MARKER}, carries the message, then the removed declaration with every
 * line prefixed by {@code "*  "}. A closing comment line and a blank line end the block.
 */
public final class DiagnosticsReporter {
    public static final String MARKER = "/** MIGRATION_WARNING:";
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsReporter.class);

    private DiagnosticsReporter() {}

    /**
     * Diagnostics for a match and the merges that followed it: orphans first, then unmatched targets, then
     * unsupported modes, each in satellite order.
     */
    public static <H> List<MergeDiagnostic> collect(
        MergeSchema schema,
        MatchResult<H> match,
        List<SatelliteResource<H>> unsupported
    ) {
        List<MergeDiagnostic> diagnostics = new ArrayList<>();
        match.orphans().forEach(s -> diagnostics.add(describe(schema, DiagnosticReason.UNPARSEABLE_REFERENCE, s)));
        match.unmatched().forEach(s -> diagnostics.add(describe(schema, DiagnosticReason.TARGET_NOT_FOUND, s)));
        unsupported.forEach(s -> diagnostics.add(describe(schema, DiagnosticReason.UNSUPPORTED_MODE, s)));
        return diagnostics;
    }

    public static MergeDiagnostic describe(MergeSchema schema, DiagnosticReason reason, SatelliteResource<?> satellite) {
        String subject = schema.satelliteLabel() + " \"" + satellite.name() + "\"";
        String message = switch (reason) {
            case UNPARSEABLE_REFERENCE -> subject + " has unparseable " + schema.referenceAttribute()
                + " reference - manual migration required";
            case TARGET_NOT_FOUND -> subject + " references " + targetDescription(schema, satellite.target())
                + " which was not found - manual migration required";
            case UNSUPPORTED_MODE -> subject + " has unsupported " + schema.modeAttribute() + " \""
                + satellite.mode() + "\" - manual migration required";
        };
        return new MergeDiagnostic(reason, satellite.name(), message, satellite.source());
    }

    /**
     * Appends one annotation block per diagnostic at the end of {@code root}. Nothing is written when the list
     * is empty or when the unit already carries annotations from an earlier run.
     *
     * @return number of blocks appended
     */
    public static int appendTo(Body root, List<MergeDiagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return 0;
        }
        if (root.containsUnstructured(MARKER)) {
            log.debug("Unit already carries migration warnings; skipping {} diagnostic(s)", diagnostics.size());
            return 0;
        }
        for (var diagnostic : diagnostics) {
            root.appendUnstructured(render(diagnostic));
        }
        return diagnostics.size();
    }

    public static void log(String unit, List<MergeDiagnostic> diagnostics) {
        for (var diagnostic : diagnostics) {
            log.warn("{}: {}", unit, diagnostic.message());
        }
    }

    public static String render(MergeDiagnostic diagnostic) {
        var out = new StringBuilder(MARKER).append(' ').append(diagnostic.message()).append('\n');
        if (diagnostic.source() != null && !diagnostic.source().isBlank()) {
            for (String line : diagnostic.source().strip().split("\\r?\\n", -1)) {
                out.append("*  ").append(line.replace("*/", "* /")).append('\n');
            }
        }
        return out.append("*/\n\n").toString();
    }

    private static String targetDescription(MergeSchema schema, TargetReference target) {
        if (target instanceof TargetReference.Named named) {
            return "\"" + named.key() + "\"";
        }
        return "the default " + schema.defaultKind();
    }
}
