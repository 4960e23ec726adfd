package com.projectcontext.core.registry;

import java.nio.file.Path;

/**
 * The persisted registry exists but cannot be parsed.
 *
 * <p>Fatal: the store never repairs or overwrites the file on its own.
 */
public class CorruptRegistryException extends RegistryException {

    private final Path file;

    public CorruptRegistryException(Path file, String reason, Throwable cause) {
        super("Registry file " + file + " is corrupt: " + reason, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
