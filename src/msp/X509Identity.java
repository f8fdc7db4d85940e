/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import msp.util.MSPCommon;
import org.hyperledger.fabric.protos.common.MspPrincipal;

/**
 * Identity backed by an X.509 certificate. Instances are created by
 * {@link X509MSP} only, after the certificate has been parsed.
 */
public class X509Identity implements Identity {

    private final IdentityIdentifier id;
    private final X509Certificate certificate;
    private final PublicKey pk;
    private final X509MSP msp;

    X509Identity(IdentityIdentifier id, X509Certificate certificate, PublicKey pk, X509MSP msp) {

        this.id = id;
        this.certificate = certificate;
        this.pk = pk;
        this.msp = msp;
    }

    @Override
    public IdentityIdentifier getIdentifier() {

        return id;
    }

    @Override
    public String getMSPIdentifier() {

        return id.getMspid();
    }

    @Override
    public X509Certificate getCertificate() {

        return certificate;
    }

    @Override
    public PublicKey getPublicKey() {

        return pk;
    }

    X509MSP getMSP() {

        return msp;
    }

    @Override
    public void validate() throws MSPException {

        msp.validate(this);
    }

    @Override
    public boolean verify(byte[] message, byte[] signature) throws MSPException {

        try {
            return msp.getCryptoProvider().verify(pk, signature, message);
        } catch (GeneralSecurityException ex) {
            throw new MSPException.CryptoOperationException("Could not verify signature for identity " + this + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public byte[] serialize() throws MSPException {

        try {

            byte[] pemCert = MSPCommon.getSerializedCertificate(certificate);
            return MSPCommon.getSerializedIdentity(id.getMspid(), pemCert).toByteArray();

        } catch (IOException | CertificateEncodingException ex) {

            throw new MSPException("Could not serialize identity " + this + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void satisfiesPrincipal(MspPrincipal.MSPPrincipal principal) throws MSPException {

        msp.satisfiesPrincipal(this, principal);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 31 * hash + this.id.hashCode();
        hash = 31 * hash + this.certificate.hashCode();
        return hash;
    }

    @Override
    public boolean equals(Object o) {

        if (this == o) return true;
        if (o == null) return false;
        if (!(o instanceof X509Identity)) return false;
        X509Identity i = (X509Identity) o;
        return this.id.equals(i.id) && this.certificate.equals(i.certificate);
    }

    @Override
    public String toString(){

        return this.id + " " + this.certificate.getSubjectX500Principal().getName();
    }
}
