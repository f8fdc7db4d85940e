/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.util.List;
import org.hyperledger.fabric.protos.common.MspPrincipal;
import org.hyperledger.fabric.protos.msp.MspConfig;

/**
 * A membership service provider: turns serialized identities into
 * {@link Identity} objects, validates them against a configured root of
 * trust and checks them against principals.
 *
 * Implementations are safe for concurrent readers once {@link #setup} has
 * returned; a later setup replaces the whole configuration at once.
 */
public interface MSP {

    void setup(MspConfig.MSPConfig config) throws MSPException;

    ProviderType getType();

    String getIdentifier() throws MSPException;

    SigningIdentity getDefaultSigningIdentity() throws MSPException;

    SigningIdentity getSigningIdentity(IdentityIdentifier identifier) throws MSPException;

    List<Identity> getRootCerts() throws MSPException;

    List<Identity> getIntermediateCerts() throws MSPException;

    List<Identity> getAdmins() throws MSPException;

    /**
     * Returns normally if the identity chains up to one of the roots of trust
     * of this MSP.
     */
    void validate(Identity id) throws MSPException;

    Identity deserializeIdentity(byte[] serializedIdentity) throws MSPException;

    /**
     * Returns normally if the identity matches the principal.
     */
    void satisfiesPrincipal(Identity id, MspPrincipal.MSPPrincipal principal) throws MSPException;
}
