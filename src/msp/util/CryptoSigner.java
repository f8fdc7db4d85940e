/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp.util;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;

/**
 * Signer bound to a single private key. The matching public key is kept so
 * that callers can check it against a certificate.
 */
public final class CryptoSigner {

    private final PrivateKey key;
    private final PublicKey publicKey;
    private final String algorithm;
    private final String provider;

    CryptoSigner(PrivateKey key, PublicKey publicKey, String algorithm, String provider) {

        this.key = key;
        this.publicKey = publicKey;
        this.algorithm = algorithm;
        this.provider = provider;
    }

    public byte[] sign(byte[] message) throws GeneralSecurityException {

        Signature signEngine = Signature.getInstance(algorithm, provider);
        signEngine.initSign(key);
        signEngine.update(message);
        return signEngine.sign();
    }

    public PublicKey getPublic() {

        return publicKey;
    }

    public String getAlgorithm() {

        return algorithm;
    }

    @Override
    public String toString() {

        // never print the private key
        return "[CryptoSigner:" + algorithm + "]";
    }
}
