/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp.util;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.PKIXCertPathBuilderResult;
import java.security.cert.X509Certificate;
import java.util.Date;

/**
 * Cryptographic capabilities an MSP relies on. Implementations must be safe
 * for concurrent use.
 */
public interface CryptoProvider {

    PublicKey importPublicKey(X509Certificate certificate) throws GeneralSecurityException;

    /**
     * Imports a private key from PEM key material (PKCS#8 or SEC1).
     */
    PrivateKey importPrivateKey(byte[] keyMaterial) throws IOException, GeneralSecurityException;

    CryptoSigner getSigner(PrivateKey key) throws GeneralSecurityException;

    /**
     * Builds and verifies a certification path from the certificate to one of
     * the trust anchors in the options, possibly through its intermediates.
     */
    PKIXCertPathBuilderResult verifyChain(X509Certificate certificate, VerificationOptions opts, Date date) throws GeneralSecurityException;

    boolean verify(PublicKey key, byte[] signature, byte[] message) throws GeneralSecurityException;
}
