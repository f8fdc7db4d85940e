/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.security.PublicKey;
import java.security.cert.X509Certificate;
import org.hyperledger.fabric.protos.common.MspPrincipal;

/**
 * An authenticated member of a membership domain, backed by a certificate
 * and the public key imported from it.
 */
public interface Identity {

    IdentityIdentifier getIdentifier();

    /**
     * Identifier of the MSP this identity claims to belong to.
     */
    String getMSPIdentifier();

    X509Certificate getCertificate();

    PublicKey getPublicKey();

    /**
     * Checks this identity against the roots of trust of its MSP.
     */
    void validate() throws MSPException;

    boolean verify(byte[] message, byte[] signature) throws MSPException;

    /**
     * Returns the bytes of the SerializedIdentity record for this identity.
     * The encoding is canonical: two identities with the same MSP and
     * certificate serialize to the same bytes.
     */
    byte[] serialize() throws MSPException;

    void satisfiesPrincipal(MspPrincipal.MSPPrincipal principal) throws MSPException;
}
