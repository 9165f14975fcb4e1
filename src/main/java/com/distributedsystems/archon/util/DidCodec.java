package com.distributedsystems.archon.util;

import com.google.common.io.BaseEncoding;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Derives {@code did:cid:} identifiers from a compressed node key.
 * <p>
 * Encoding v1: the identifier is a CIDv1 ({@code 0x01}), raw codec ({@code 0x55}), with a
 * sha2-256 multihash ({@code 0x12 0x20 || digest}), rendered as multibase base32 lower-case
 * without padding ({@code 'b'} prefix). The digest input is the 33 key bytes for generation 0
 * and {@code key || "archon-reprovision" || uint32be(generation)} for later generations, so
 * anyone holding the key and the generation number can recompute the identifier.
 */
public final class DidCodec {

    public static final String DID_PREFIX = "did:cid:";
    public static final char MULTIBASE_BASE32_LOWER = 'b';

    private static final byte CID_V1 = 0x01;
    private static final byte RAW_CODEC = 0x55;
    private static final byte SHA2_256 = 0x12;
    private static final byte DIGEST_LENGTH = 0x20;
    private static final int CID_LENGTH = 4 + 32;
    private static final byte[] REPROVISION_DOMAIN = "archon-reprovision".getBytes(StandardCharsets.US_ASCII);
    private static final BaseEncoding BASE32 = BaseEncoding.base32().lowerCase().omitPadding();

    private DidCodec() {
    }

    public static String derive(String compressedPubkeyHex, int generation) {
        if (!CryptoUtil.isCompressedPubkey(compressedPubkeyHex)) {
            throw new IllegalArgumentException("not a compressed secp256k1 public key");
        }
        if (generation < 0) {
            throw new IllegalArgumentException("generation must be >= 0");
        }
        byte[] digest = CryptoUtil.sha256(content(CryptoUtil.fromHex(compressedPubkeyHex), generation));
        ByteBuffer cid = ByteBuffer.allocate(CID_LENGTH)
                .put(CID_V1)
                .put(RAW_CODEC)
                .put(SHA2_256)
                .put(DIGEST_LENGTH)
                .put(digest);
        return DID_PREFIX + MULTIBASE_BASE32_LOWER + BASE32.encode(cid.array());
    }

    public static boolean verify(String did, String compressedPubkeyHex, int generation) {
        try {
            return derive(CryptoUtil.normalizeHex(compressedPubkeyHex), generation).equals(did);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Structural check: prefix, multibase tag, and a decodable v1 raw/sha2-256 CID. */
    public static boolean isWellFormed(String did) {
        if (did == null || !did.startsWith(DID_PREFIX)) return false;
        String multibase = did.substring(DID_PREFIX.length());
        if (multibase.length() < 2 || multibase.charAt(0) != MULTIBASE_BASE32_LOWER) return false;
        byte[] cid;
        try {
            cid = BASE32.decode(multibase.substring(1));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return cid.length == CID_LENGTH
                && cid[0] == CID_V1
                && cid[1] == RAW_CODEC
                && cid[2] == SHA2_256
                && cid[3] == DIGEST_LENGTH;
    }

    private static byte[] content(byte[] pubkey, int generation) {
        if (generation == 0) return pubkey;
        ByteArrayOutputStream out = new ByteArrayOutputStream(pubkey.length + REPROVISION_DOMAIN.length + 4);
        out.writeBytes(pubkey);
        out.writeBytes(REPROVISION_DOMAIN);
        out.writeBytes(ByteBuffer.allocate(4).putInt(generation).array());
        return out.toByteArray();
    }
}
