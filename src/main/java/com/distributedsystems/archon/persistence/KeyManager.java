package com.distributedsystems.archon.persistence;

import com.distributedsystems.archon.exe.ArchonConfig;
import com.distributedsystems.archon.signer.Secp256k1;
import com.distributedsystems.archon.util.CryptoUtil;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.security.KeyPair;

/**
 * Custody of the local node's signing key. The private half never leaves this class.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyManager {

    private final ArchonConfig config;

    private volatile KeyPair keyPair;
    private volatile String publicKeyHex;

    @PostConstruct
    public void init() throws IOException {
        String keyPath = config.getSignerKeyPath();
        if (keyPath.isEmpty()) {
            install(Secp256k1.generateKeyPair());
            log.warn("[{}] No signer key path configured; using an ephemeral signing key",
                    CryptoUtil.shortKey(publicKeyHex));
            return;
        }
        Path path = Paths.get(keyPath);
        if (Files.exists(path)) {
            install(load(path));
            OwnerOnlyFiles.restrict(path);
            log.info("[{}] Loaded signing key from {}", CryptoUtil.shortKey(publicKeyHex), path);
        } else {
            KeyPair generated = Secp256k1.generateKeyPair();
            OwnerOnlyFiles.ensureDirectory(path.toAbsolutePath().getParent());
            OwnerOnlyFiles.createFile(path);
            Files.writeString(path, Secp256k1.scalarOf(generated.getPrivate()).toString(16) + "\n",
                    StandardCharsets.US_ASCII, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            install(generated);
            log.info("[{}] Generated signing key at {}", CryptoUtil.shortKey(publicKeyHex), path);
        }
    }

    public static KeyManager ephemeral(ArchonConfig config) {
        KeyManager manager = new KeyManager(config);
        manager.install(Secp256k1.generateKeyPair());
        return manager;
    }

    public String publicKeyHex() {
        return publicKeyHex;
    }

    public String sign(byte[] message) throws GeneralSecurityException {
        KeyPair current = keyPair;
        if (current == null) {
            throw new GeneralSecurityException("signing key not loaded");
        }
        return Secp256k1.sign(current.getPrivate(), message);
    }

    private KeyPair load(Path path) throws IOException {
        String hex = Files.readString(path, StandardCharsets.US_ASCII).trim();
        try {
            return Secp256k1.keyPairFromScalar(new BigInteger(hex, 16));
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt signing key file " + path, e);
        }
    }

    private void install(KeyPair pair) {
        this.keyPair = pair;
        this.publicKeyHex = Secp256k1.compressedHex(pair.getPublic());
    }
}
