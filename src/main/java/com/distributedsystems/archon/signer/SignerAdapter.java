package com.distributedsystems.archon.signer;

/**
 * Signing oracle for the local node. Implementations never hand out key material; they
 * sign arbitrary bytes and verify signatures produced by any node key.
 */
public interface SignerAdapter {

    /** Compressed secp256k1 public key of the local node, lower-case hex. */
    String nodePublicKey();

    /**
     * @return signature over {@code message}
     * @throws com.distributedsystems.archon.error.ArchonException with kind
     *         {@code SIGNER_UNAVAILABLE} when the oracle cannot sign
     */
    String sign(byte[] message);

    boolean verify(byte[] message, String signature, String publicKeyHex);
}
