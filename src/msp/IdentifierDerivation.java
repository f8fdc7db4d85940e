/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import msp.util.MSPCommon;
import org.apache.commons.codec.binary.Hex;

/**
 * Produces the local identifier of an identity from its certificate.
 */
@FunctionalInterface
public interface IdentifierDerivation {

    String DEFAULT_ID = "DEFAULT";

    String localIdentifier(X509Certificate certificate) throws MSPException;

    /**
     * Every identity gets the same local identifier.
     */
    static IdentifierDerivation placeholder() {

        return (certificate) -> DEFAULT_ID;
    }

    /**
     * Hex encoded digest of the DER certificate.
     */
    static IdentifierDerivation certificateHash(String algorithm) {

        return (certificate) -> {

            try {
                return Hex.encodeHexString(MSPCommon.hash(certificate.getEncoded(), algorithm));
            } catch (GeneralSecurityException ex) {
                throw new MSPException("Failed to derive identifier with " + algorithm + ": " + ex.getMessage(), ex);
            }
        };
    }
}
