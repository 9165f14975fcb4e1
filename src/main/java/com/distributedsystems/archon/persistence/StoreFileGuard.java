package com.distributedsystems.archon.persistence;

import com.distributedsystems.archon.exe.ArchonConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Keeps the local store files readable by the owning user only. The store file is created
 * owner-only before the datasource first opens it; H2 treats an empty file as a new store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreFileGuard {

    static final String STORE_SUFFIX = ".mv.db";
    static final String[] STORE_SUFFIXES = {STORE_SUFFIX, ".trace.db"};

    private final ArchonConfig config;

    @PostConstruct
    public void prepareStore() throws IOException {
        Path base = Paths.get(config.getDbPath()).toAbsolutePath();
        Path dir = base.getParent();
        OwnerOnlyFiles.ensureDirectory(dir);
        if (dir != null && OwnerOnlyFiles.sharedWithOthers(dir)) {
            log.warn("Store directory {} is accessible to other users", dir);
        }
        Path store = Paths.get(base + STORE_SUFFIX);
        if (!Files.exists(store)) {
            OwnerOnlyFiles.createFile(store);
            log.info("Created store file {}", store);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restrictStoreFiles() {
        Path base = Paths.get(config.getDbPath()).toAbsolutePath();
        try {
            for (String suffix : STORE_SUFFIXES) {
                OwnerOnlyFiles.restrict(Paths.get(base + suffix));
            }
        } catch (IOException e) {
            log.warn("Could not restrict permissions on store {}: {}", base, e.getMessage());
        }
    }
}
