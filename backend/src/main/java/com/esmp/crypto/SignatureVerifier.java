package com.esmp.crypto;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Ed25519 verification over canonical bytes. Keys and signatures are standard base64;
 * anything that does not decode to a 32-byte key and a 64-byte signature simply fails.
 */
@Component
public class SignatureVerifier {

    private static final int SIGNATURE_SIZE = 64;

    public boolean verify(byte[] message, String signatureBase64, String pubkeyBase64) {
        if (message == null || signatureBase64 == null || pubkeyBase64 == null) {
            return false;
        }
        try {
            byte[] key = Base64.getDecoder().decode(pubkeyBase64);
            byte[] signature = Base64.getDecoder().decode(signatureBase64);
            if (key.length != Ed25519PublicKeyParameters.KEY_SIZE || signature.length != SIGNATURE_SIZE) {
                return false;
            }
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(key, 0));
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
