package de.bsommerfeld.addons.core.domain;

import java.util.List;
import java.util.Locale;

/**
 * CPU architecture names as used in addon definitions and image tags.
 */
public final class Architecture {

    public static final String ARMHF = "armhf";
    public static final String AARCH64 = "aarch64";
    public static final String I386 = "i386";
    public static final String AMD64 = "amd64";

    /** Every architecture a definition may declare, also the default when it declares none. */
    public static final List<String> SUPPORTED = List.of(ARMHF, AARCH64, I386, AMD64);

    private Architecture() {
    }

    /** Detects the architecture of the running JVM from {@code os.arch}. */
    public static String detect() {
        return fromOsArch(System.getProperty("os.arch", ""));
    }

    /**
     * Maps a JVM {@code os.arch} value onto the addon naming scheme.
     *
     * @throws IllegalStateException if the architecture has no addon images
     */
    public static String fromOsArch(String osArch) {
        String arch = osArch.toLowerCase(Locale.ENGLISH);
        if (arch.equals("amd64") || arch.equals("x86_64")) {
            return AMD64;
        }
        if (arch.equals("aarch64") || arch.equals("arm64")) {
            return AARCH64;
        }
        if (arch.startsWith("arm")) {
            return ARMHF;
        }
        if (arch.equals("x86") || arch.matches("i[3-6]86")) {
            return I386;
        }
        throw new IllegalStateException("Unsupported architecture: " + osArch);
    }
}
