package work.tfmigrate.hcl;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One configuration unit (a single {@code .tf} file) held as an editable tree.
 */
public final class ConfigFile {
    private final String filename;
    private final Body body;
    private final Set<String> processedPasses = new HashSet<>();

    public ConfigFile(String filename) {
        this.filename = filename == null ? "<memory>" : filename;
        this.body = new Body(null, 0);
    }

    public String filename() {
        return filename;
    }

    public Body body() {
        return body;
    }

    public List<Block> resources() {
        return body.blocks().stream().filter(Block::isResource).collect(Collectors.toList());
    }

    /**
     * Records that a cross-resource pass already ran on this unit during the current invocation.
     */
    public boolean markProcessed(String passId) {
        return processedPasses.add(passId);
    }

    public String render() {
        return ConfigWriter.write(body);
    }
}
