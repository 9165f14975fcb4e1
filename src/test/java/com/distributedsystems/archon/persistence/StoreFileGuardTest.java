package com.distributedsystems.archon.persistence;

import com.distributedsystems.archon.exe.ArchonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StoreFileGuardTest {

    @TempDir
    Path dir;

    @BeforeEach
    void posixOnly() {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    }

    private static String mode(Path path) throws Exception {
        return PosixFilePermissions.toString(Files.getPosixFilePermissions(path));
    }

    private StoreFileGuard guardFor(Path base) {
        ArchonConfig config = mock(ArchonConfig.class);
        when(config.getDbPath()).thenReturn(base.toString());
        return new StoreFileGuard(config);
    }

    @Test
    void storeFileAndDirectoryAreOwnerOnlyBeforeTheDatabaseOpens() throws Exception {
        Path base = dir.resolve("store/archon");

        guardFor(base).prepareStore();

        Path store = dir.resolve("store/archon.mv.db");
        assertThat(mode(dir.resolve("store"))).isEqualTo("rwx------");
        assertThat(mode(store)).isEqualTo("rw-------");
        assertThat(Files.size(store)).isZero();
    }

    @Test
    void existingStoreIsLeftInPlace() throws Exception {
        Path store = dir.resolve("archon.mv.db");
        Files.writeString(store, "data");

        guardFor(dir.resolve("archon")).prepareStore();

        assertThat(Files.readString(store)).isEqualTo("data");
    }

    @Test
    void createdFilesNeverCarryGroupOrOtherBits() throws Exception {
        Path file = dir.resolve("secret");

        OwnerOnlyFiles.createFile(file);

        assertThat(mode(file)).isEqualTo("rw-------");
        assertThat(OwnerOnlyFiles.sharedWithOthers(file)).isFalse();
        assertThatThrownBy(() -> OwnerOnlyFiles.createFile(file))
                .isInstanceOf(java.nio.file.FileAlreadyExistsException.class);
    }

    @Test
    void readyEventRestrictsStoreFilesTheDatabaseCreatedItself() throws Exception {
        Path trace = dir.resolve("archon.trace.db");
        Files.writeString(trace, "trace");
        Files.setPosixFilePermissions(trace, PosixFilePermissions.fromString("rw-r--r--"));
        assertThat(OwnerOnlyFiles.sharedWithOthers(trace)).isTrue();

        guardFor(dir.resolve("archon")).restrictStoreFiles();

        assertThat(mode(trace)).isEqualTo("rw-------");
    }
}
