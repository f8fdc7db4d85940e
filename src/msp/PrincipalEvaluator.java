/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import com.google.protobuf.InvalidProtocolBufferException;
import java.util.Arrays;
import org.hyperledger.fabric.protos.common.MspPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an identity satisfies an MSP principal. Holds no state:
 * everything it needs comes from the MSP and the identity it is given.
 */
public class PrincipalEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(PrincipalEvaluator.class);

    /**
     * Returns normally if the identity satisfies the principal, throws
     * otherwise.
     */
    public void satisfies(MSP msp, Identity id, MspPrincipal.MSPPrincipal principal) throws MSPException {

        if (id == null || principal == null) {

            throw new MSPException.DecodeException("Nil identity or principal");
        }

        switch (principal.getPrincipalClassification()) {

            // in this case, we have to check whether the
            // identity has a role in the msp - member or admin
            case ROLE:

                satisfiesRole(msp, id, principal);
                break;

            // in this case we have to serialize this instance
            // and compare it byte-by-byte with the principal
            case IDENTITY:

                satisfiesIdentity(id, principal);
                break;

            case ORGANIZATION_UNIT:

                throw new MSPException.NotImplementedException("Organizational unit principals are not supported yet");

            default:

                throw new MSPException.UnknownPrincipalTypeException("Invalid principal type: " + principal.getPrincipalClassificationValue());
        }
    }

    private void satisfiesRole(MSP msp, Identity id, MspPrincipal.MSPPrincipal principal) throws MSPException {

        MspPrincipal.MSPRole mspRole = null;

        try {
            mspRole = MspPrincipal.MSPRole.parseFrom(principal.getPrincipal());
        } catch (InvalidProtocolBufferException ex) {
            throw new MSPException.DecodeException("Could not unmarshal MSPRole from principal: " + ex.getMessage(), ex);
        }

        logger.debug("Checking identity MSP against principal MSP (expected " + mspRole.getMspIdentifier() + ", got " + id.getMSPIdentifier() + ")");

        if (!mspRole.getMspIdentifier().equals(id.getMSPIdentifier())) {

            throw new MSPException.DomainMismatchException("The identity is a member of a different MSP (expected "
                    + mspRole.getMspIdentifier() + ", got " + id.getMSPIdentifier() + ")");
        }

        switch (mspRole.getRole()) {

            // a member is any identity that is valid for the MSP
            case MEMBER:

                msp.validate(id);
                break;

            case ADMIN:

                throw new MSPException.NotImplementedException("Admin role principals are not supported yet");

            default:

                throw new MSPException.UnknownRoleException("Invalid MSP role type: " + mspRole.getRoleValue());
        }
    }

    private void satisfiesIdentity(Identity id, MspPrincipal.MSPPrincipal principal) throws MSPException {

        byte[] idBytes = id.serialize();

        if (!Arrays.equals(idBytes, principal.getPrincipal().toByteArray())) {

            throw new MSPException.IdentityMismatchException("The identities do not match");
        }
    }
}
