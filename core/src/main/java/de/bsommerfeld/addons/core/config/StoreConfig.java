package de.bsommerfeld.addons.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * User-editable store settings, kept in {@code addon-store.json} inside the
 * application data directory. Relative paths are resolved against that
 * directory by {@link #toPaths(Path)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoreConfig {

    @JsonProperty("core-addons-dir")
    private String coreAddonsDir = "addons/core";

    @JsonProperty("local-addons-dir")
    private String localAddonsDir = "addons/local";

    @JsonProperty("repositories-dir")
    private String repositoriesDir = "addons/git";

    @JsonProperty("data-dir")
    private String dataDir = "addons/data";

    // Where the container runtime sees data-dir. Defaults to data-dir itself.
    @JsonProperty("extern-data-dir")
    private String externDataDir;

    @JsonProperty("state-file")
    private String stateFile = "addons.json";

    // Detected from os.arch when unset.
    @JsonProperty("arch")
    private String arch;

    public String getCoreAddonsDir() {
        return coreAddonsDir;
    }

    public void setCoreAddonsDir(String coreAddonsDir) {
        this.coreAddonsDir = coreAddonsDir;
    }

    public String getLocalAddonsDir() {
        return localAddonsDir;
    }

    public void setLocalAddonsDir(String localAddonsDir) {
        this.localAddonsDir = localAddonsDir;
    }

    public String getRepositoriesDir() {
        return repositoriesDir;
    }

    public void setRepositoriesDir(String repositoriesDir) {
        this.repositoriesDir = repositoriesDir;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getExternDataDir() {
        return externDataDir;
    }

    public void setExternDataDir(String externDataDir) {
        this.externDataDir = externDataDir;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public String getArch() {
        return arch;
    }

    public void setArch(String arch) {
        this.arch = arch;
    }

    /** Resolves every configured location against {@code baseDir}. */
    public AddonPaths toPaths(Path baseDir) {
        Path data = baseDir.resolve(dataDir);
        return new AddonPaths(
                baseDir.resolve(coreAddonsDir),
                baseDir.resolve(localAddonsDir),
                baseDir.resolve(repositoriesDir),
                data,
                externDataDir != null ? baseDir.resolve(externDataDir) : data,
                baseDir.resolve(stateFile));
    }
}
