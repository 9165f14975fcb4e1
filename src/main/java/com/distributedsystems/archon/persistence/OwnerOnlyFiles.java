package com.distributedsystems.archon.persistence;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Owner read/write for files, owner rwx for their directories. No-op on file systems
 * without POSIX attributes.
 */
@Slf4j
public final class OwnerOnlyFiles {

    private static final Set<PosixFilePermission> FILE_MODE = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> DIR_MODE = PosixFilePermissions.fromString("rwx------");

    private OwnerOnlyFiles() {
    }

    public static void ensureDirectory(Path dir) throws IOException {
        if (dir == null) return;
        if (!Files.isDirectory(dir)) {
            try {
                Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(DIR_MODE));
            } catch (UnsupportedOperationException e) {
                Files.createDirectories(dir);
            }
        }
    }

    /** Creates an empty file that is owner-only from the moment it exists. */
    public static void createFile(Path file) throws IOException {
        try {
            Files.createFile(file, PosixFilePermissions.asFileAttribute(FILE_MODE));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions unsupported for {}", file);
            Files.createFile(file);
        }
    }

    /** True when group or other users hold any permission on {@code path}. */
    public static boolean sharedWithOthers(Path path) throws IOException {
        try {
            Set<PosixFilePermission> mode = Files.getPosixFilePermissions(path);
            return mode.stream().anyMatch(p -> !p.name().startsWith("OWNER_"));
        } catch (UnsupportedOperationException e) {
            return false;
        }
    }

    public static void restrict(Path file) throws IOException {
        if (Files.exists(file)) {
            apply(file, FILE_MODE);
        }
    }

    private static void apply(Path path, Set<PosixFilePermission> mode) throws IOException {
        try {
            Files.setPosixFilePermissions(path, mode);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions unsupported for {}", path);
        }
    }
}
