package com.distributedsystems.archon.signer;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import com.distributedsystems.archon.persistence.KeyManager;
import com.distributedsystems.archon.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;

@Slf4j
@Component
@RequiredArgsConstructor
public class LocalKeySigner implements SignerAdapter {

    private final KeyManager keyManager;

    @Override
    public String nodePublicKey() {
        return keyManager.publicKeyHex();
    }

    @Override
    public String sign(byte[] message) {
        try {
            return keyManager.sign(message);
        } catch (GeneralSecurityException | RuntimeException e) {
            log.warn("[{}] signmessage failed: {}", CryptoUtil.shortKey(nodePublicKey()), e.getMessage());
            throw new ArchonException(ErrorKind.SIGNER_UNAVAILABLE, "signing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean verify(byte[] message, String signature, String publicKeyHex) {
        return Secp256k1.verify(CryptoUtil.normalizeHex(publicKeyHex), message, signature);
    }
}
