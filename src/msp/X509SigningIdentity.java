/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import msp.util.CryptoSigner;

/**
 * X.509 identity with a signer bound to its private key. The signer's public
 * key is checked against the certificate when the MSP is set up.
 */
public class X509SigningIdentity extends X509Identity implements SigningIdentity {

    private final CryptoSigner signer;

    X509SigningIdentity(IdentityIdentifier id, X509Certificate certificate, PublicKey pk, CryptoSigner signer, X509MSP msp) {

        super(id, certificate, pk, msp);
        this.signer = signer;
    }

    @Override
    public byte[] sign(byte[] message) throws MSPException {

        try {
            return signer.sign(message);
        } catch (GeneralSecurityException ex) {
            throw new MSPException.CryptoOperationException("Failed to sign message with identity " + this + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public Identity getPublicVersion() {

        return new X509Identity(getIdentifier(), getCertificate(), getPublicKey(), getMSP());
    }
}
