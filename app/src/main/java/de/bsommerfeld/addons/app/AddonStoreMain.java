package de.bsommerfeld.addons.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.addons.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public class AddonStoreMain {

    static {
        // logback.xml reads LOG_DIR, so it must be set before the first logger exists.
        Path logDir = StorageUtils.getLogsDir(StorageUtils.getAppDataDir());
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AddonStoreMain.class);

    public static void main(String[] args) {
        LOG.info("Starting addon store");
        Injector injector = Guice.createInjector(new AppModule());
        int exitCode = injector.getInstance(AddonStoreCli.class).run(Arrays.asList(args), System.out);
        System.exit(exitCode);
    }
}
