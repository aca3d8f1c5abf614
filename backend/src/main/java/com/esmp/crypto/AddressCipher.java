package com.esmp.crypto;

import com.esmp.config.EsmpProperties;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;

/**
 * At-rest encryption of the profile address field.
 *
 * <p>AES-256-GCM with a fresh 96-bit IV per encryption, IV prepended, Base64 encoded. The key is
 * derived per profile with HKDF-SHA256 from the server secret and the owner's public key, and the
 * public key is also bound as associated data, so a ciphertext copied onto another profile
 * will not decrypt.
 */
@Component
public class AddressCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(AddressCipher.class);

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final int IV_SIZE = 12;
    private static final int TAG_SIZE = 128;
    private static final int KEY_SIZE = 32;
    private static final byte[] INFO_PREFIX = "esmp-profile-address:".getBytes(StandardCharsets.UTF_8);

    private final byte[] secret;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public AddressCipher(EsmpProperties properties) {
        this(resolveSecret(properties.profile().addressKey()));
    }

    public AddressCipher(byte[] secret) {
        if (secret == null || secret.length < KEY_SIZE) {
            throw new IllegalArgumentException("Address secret must be at least " + KEY_SIZE + " bytes");
        }
        this.secret = secret.clone();
    }

    public String encrypt(String ownerPubkey, String plaintext) {
        byte[] iv = new byte[IV_SIZE];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(ownerPubkey), new GCMParameterSpec(TAG_SIZE, iv));
            cipher.updateAAD(ownerPubkey.getBytes(StandardCharsets.UTF_8));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] result = new byte[IV_SIZE + ciphertext.length];
            System.arraycopy(iv, 0, result, 0, IV_SIZE);
            System.arraycopy(ciphertext, 0, result, IV_SIZE, ciphertext.length);
            return Base64.getEncoder().encodeToString(result);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Address encryption failed", e);
        }
    }

    public String decrypt(String ownerPubkey, String encoded) {
        try {
            byte[] decoded = Base64.getDecoder().decode(encoded);
            if (decoded.length <= IV_SIZE) {
                throw new IllegalStateException("Address ciphertext is truncated");
            }
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(ownerPubkey), new GCMParameterSpec(TAG_SIZE, decoded, 0, IV_SIZE));
            cipher.updateAAD(ownerPubkey.getBytes(StandardCharsets.UTF_8));
            byte[] plaintext = cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Address ciphertext could not be decrypted", e);
        }
    }

    private SecretKeySpec deriveKey(String ownerPubkey) {
        byte[] owner = ownerPubkey.getBytes(StandardCharsets.UTF_8);
        byte[] info = new byte[INFO_PREFIX.length + owner.length];
        System.arraycopy(INFO_PREFIX, 0, info, 0, INFO_PREFIX.length);
        System.arraycopy(owner, 0, info, INFO_PREFIX.length, owner.length);

        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(secret, null, info));
        byte[] key = new byte[KEY_SIZE];
        hkdf.generateBytes(key, 0, KEY_SIZE);
        return new SecretKeySpec(key, "AES");
    }

    private static byte[] resolveSecret(String configured) {
        if (configured != null && !configured.isBlank()) {
            return Base64.getDecoder().decode(configured.trim());
        }
        logger.warn("esmp.profile.address-key is not set; using a random key. "
                + "Stored addresses will not be readable after a restart.");
        byte[] generated = new byte[KEY_SIZE];
        new SecureRandom().nextBytes(generated);
        return generated;
    }
}
