package com.projectcontext.core.registry;

import java.nio.file.Path;

/**
 * The persisted registry was written by a newer, unknown schema version.
 */
public class UnsupportedRegistryVersionException extends RegistryException {

    private final int version;

    public UnsupportedRegistryVersionException(Path file, int version, int supported) {
        super("Registry file " + file + " has schema version " + version
            + " but this build supports up to version " + supported);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
