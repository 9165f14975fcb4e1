package com.distributedsystems.archon.signer;

import com.distributedsystems.archon.util.CryptoUtil;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.interfaces.ECPrivateKey;
import org.bouncycastle.jce.interfaces.ECPublicKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.jce.spec.ECPrivateKeySpec;
import org.bouncycastle.jce.spec.ECPublicKeySpec;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;

/**
 * secp256k1 ECDSA (SHA-256, DER signatures, base64 on the wire) on the BouncyCastle provider.
 */
public final class Secp256k1 {

    private static final String CURVE = "secp256k1";
    private static final String ALGORITHM = "SHA256withECDSA";
    private static final ECNamedCurveParameterSpec PARAMS;

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        PARAMS = ECNamedCurveTable.getParameterSpec(CURVE);
    }

    private Secp256k1() {
    }

    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
            generator.initialize(new ECGenParameterSpec(CURVE), new SecureRandom());
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("secp256k1 key generation failed", e);
        }
    }

    public static KeyPair keyPairFromScalar(BigInteger d) {
        if (d.signum() <= 0 || d.compareTo(PARAMS.getN()) >= 0) {
            throw new IllegalArgumentException("private scalar out of range");
        }
        try {
            KeyFactory factory = KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
            PrivateKey priv = factory.generatePrivate(new ECPrivateKeySpec(d, PARAMS));
            ECPoint q = PARAMS.getG().multiply(d).normalize();
            PublicKey pub = factory.generatePublic(new ECPublicKeySpec(q, PARAMS));
            return new KeyPair(pub, priv);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot rebuild secp256k1 key pair", e);
        }
    }

    public static BigInteger scalarOf(PrivateKey key) {
        return ((ECPrivateKey) key).getD();
    }

    public static String compressedHex(PublicKey key) {
        return CryptoUtil.toHex(((ECPublicKey) key).getQ().getEncoded(true));
    }

    public static PublicKey publicKeyFromCompressed(String hex) throws GeneralSecurityException {
        ECPoint q;
        try {
            q = PARAMS.getCurve().decodePoint(CryptoUtil.fromHex(hex));
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("not a point on secp256k1", e);
        }
        return KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME)
                .generatePublic(new ECPublicKeySpec(q, PARAMS));
    }

    public static String sign(PrivateKey key, byte[] message) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
        signature.initSign(key);
        signature.update(message);
        return Base64.getEncoder().encodeToString(signature.sign());
    }

    public static boolean verify(String publicKeyHex, byte[] message, String signatureB64) {
        if (signatureB64 == null || signatureB64.isBlank() || !CryptoUtil.isCompressedPubkey(publicKeyHex)) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
            signature.initVerify(publicKeyFromCompressed(publicKeyHex));
            signature.update(message);
            return signature.verify(Base64.getDecoder().decode(signatureB64));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }
}
