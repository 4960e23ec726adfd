package com.projectcontext.core.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Replaces {@code target} with {@code content} so that readers see either the
     * old or the new file, never a partial one.
     *
     * <p>The content is written to a temporary file in the target's directory,
     * forced to disk, then moved over the target with {@code ATOMIC_MOVE}. If the
     * filesystem cannot move atomically, a plain replacing move is used. The
     * temporary file is removed when anything fails.
     *
     * @param target file to replace
     * @param content complete new content
     * @throws IOException if writing or moving fails; {@code target} is untouched
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Returns the real path when the file exists, otherwise the absolute normalized path.
     *
     * @param path path to canonicalize
     * @return canonical path
     */
    public static Path canonicalize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            return absolute;
        }
    }

    /**
     * Lists {@code start} followed by its ancestors, nearest first.
     *
     * @param start starting directory
     * @param maxLevelsUp how many parents to include at most
     * @return start and up to {@code maxLevelsUp} ancestors
     */
    public static List<Path> selfAndAncestors(Path start, int maxLevelsUp) {
        List<Path> chain = new ArrayList<>();
        Path current = start;
        int level = 0;
        while (current != null && level <= maxLevelsUp) {
            chain.add(current);
            current = current.getParent();
            level++;
        }
        return chain;
    }
}
