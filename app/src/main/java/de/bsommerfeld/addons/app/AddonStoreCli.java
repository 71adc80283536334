package de.bsommerfeld.addons.app;

import com.google.inject.Inject;
import de.bsommerfeld.addons.catalog.CatalogService;
import de.bsommerfeld.addons.catalog.ScanResult;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import de.bsommerfeld.addons.core.domain.RepositoryRecord;
import de.bsommerfeld.addons.store.AddonDataService;
import de.bsommerfeld.addons.store.InstalledStateStore;
import de.bsommerfeld.addons.store.UnknownAddonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Command dispatcher behind {@link AddonStoreMain}. Every command starts with
 * a fresh scan; {@code sync} additionally reconciles installed definitions.
 *
 * <pre>
 * sync                          scan and reconcile (default)
 * list                          print repositories, installed and available addons
 * install   &lt;key&gt; [version]     install from the catalog, latest version by default
 * update    &lt;key&gt; [version]     move an installed addon to the catalog definition
 * uninstall &lt;key&gt;
 * write-options &lt;key&gt;           validate and write the runtime options file
 * </pre>
 */
public class AddonStoreCli {

    private static final Logger LOG = LoggerFactory.getLogger(AddonStoreCli.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final CatalogService catalogService;
    private final InstalledStateStore store;
    private final AddonDataService dataService;

    @Inject
    public AddonStoreCli(CatalogService catalogService, InstalledStateStore store, AddonDataService dataService) {
        this.catalogService = catalogService;
        this.store = store;
        this.dataService = dataService;
    }

    public int run(List<String> args, PrintStream out) {
        String command = args.isEmpty() ? "sync" : args.get(0);
        List<String> params = args.isEmpty() ? List.of() : args.subList(1, args.size());

        ScanResult scan = catalogService.rescan();
        try {
            switch (command) {
                case "sync":
                    return sync(scan, out);
                case "list":
                    return list(out);
                case "install":
                    return install(params, out);
                case "update":
                    return update(params, out);
                case "uninstall":
                    return uninstall(params, out);
                case "write-options":
                    return writeOptions(params, out);
                default:
                    out.println("Unknown command: " + command);
                    return USAGE;
            }
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return USAGE;
        } catch (UnknownAddonException e) {
            out.println(e.getMessage());
            return FAILED;
        }
    }

    private int sync(ScanResult scan, PrintStream out) {
        int refreshed = store.reconcileAutoUpdates();
        out.printf("%d addons available, %d installed, %d refreshed, %d warnings%n",
                scan.catalog().size(), store.listInstalled().size(), refreshed, scan.warnings().size());
        return OK;
    }

    private int list(PrintStream out) {
        out.println("Repositories:");
        for (RepositoryRecord repository : catalogService.repositories().list()) {
            out.printf("  %-10s %s%n", repository.slug(), repository.name());
        }
        out.println("Addons:");
        for (QualifiedSlug slug : store.listAll()) {
            String installed = store.versionInstalled(slug);
            out.printf("  %-30s %-10s %s%n", slug, dataService.getLatestVersion(slug),
                    installed != null ? "installed " + installed : "");
        }
        for (QualifiedSlug slug : store.listDetached()) {
            out.printf("Detached: %s%n", slug);
        }
        return OK;
    }

    private int install(List<String> params, PrintStream out) throws UnknownAddonException {
        QualifiedSlug slug = slugParam(params);
        String version = versionParam(slug, params);
        if (!store.install(slug, version)) {
            return FAILED;
        }
        out.printf("Installed %s %s%n", slug, version);
        return OK;
    }

    private int update(List<String> params, PrintStream out) throws UnknownAddonException {
        QualifiedSlug slug = slugParam(params);
        String version = versionParam(slug, params);
        if (!store.update(slug, version)) {
            return FAILED;
        }
        out.printf("Updated %s to %s%n", slug, version);
        return OK;
    }

    private int uninstall(List<String> params, PrintStream out) {
        QualifiedSlug slug = slugParam(params);
        if (!store.uninstall(slug)) {
            return FAILED;
        }
        out.printf("Uninstalled %s%n", slug);
        return OK;
    }

    private int writeOptions(List<String> params, PrintStream out) {
        QualifiedSlug slug = slugParam(params);
        if (!dataService.writeOptionsFile(slug)) {
            return FAILED;
        }
        out.printf("Wrote %s%n", dataService.optionsPath(slug));
        return OK;
    }

    private static QualifiedSlug slugParam(List<String> params) {
        if (params.isEmpty()) {
            throw new IllegalArgumentException("Missing addon key (<repository>_<slug>)");
        }
        return QualifiedSlug.parse(params.get(0));
    }

    private String versionParam(QualifiedSlug slug, List<String> params) throws UnknownAddonException {
        if (params.size() > 1) {
            return params.get(1);
        }
        AddonDefinition latest = catalogService.catalog().get(slug);
        if (latest == null) {
            throw new UnknownAddonException(slug);
        }
        LOG.debug("No version given for {}, using catalog version {}", slug, latest.version());
        return latest.version();
    }
}
