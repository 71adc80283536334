package de.bsommerfeld.addons.store;

import de.bsommerfeld.addons.core.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Backing file of the {@link InstalledStateStore}. Every save rewrites the
 * whole document atomically.
 */
public class StateFile {

    private static final Logger LOG = LoggerFactory.getLogger(StateFile.class);

    private final Path path;

    public StateFile(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    /**
     * Reads the document. A missing file is an empty state.
     *
     * @throws IOException if the file exists but cannot be read or bound
     */
    public StateDocument load() throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No installed state at {}, starting empty", path);
            return StateDocument.empty();
        }
        StateDocument document = JsonFiles.read(path, StateDocument.class);
        return document != null ? document : StateDocument.empty();
    }

    /**
     * Replaces the file with {@code document}.
     *
     * @throws IOException if the write fails; the previous file is left intact
     */
    public void save(StateDocument document) throws IOException {
        JsonFiles.writeAtomically(path, document);
        LOG.debug("Saved installed state ({} addons) to {}", document.system().size(), path);
    }
}
