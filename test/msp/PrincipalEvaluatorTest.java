package msp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.protobuf.ByteString;

import org.hyperledger.fabric.protos.common.MspPrincipal;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import msp.util.MSPCommon;
import msp.util.PkiFixtures;
import msp.util.PkiFixtures.Entity;

@DisplayName("Principal evaluation")
class PrincipalEvaluatorTest {

    private static Entity root;
    private static Entity unrelatedRoot;
    private static Entity member;
    private static Entity outsider;
    private static Entity admin;

    private static X509MSP msp;
    private static Identity memberId;
    private static Identity outsiderId;
    private static Identity adminId;

    @BeforeAll static void beforeAll() throws Exception {
        root = PkiFixtures.rootCA("org1-ca");
        unrelatedRoot = PkiFixtures.rootCA("org2-ca");
        member = PkiFixtures.endEntity("peer0", root);
        outsider = PkiFixtures.endEntity("peer9", unrelatedRoot);
        admin = PkiFixtures.endEntity("admin", root);

        msp = X509MSP.getInstance();
        msp.setup(PkiFixtures.wrap(PkiFixtures.config("org1", root).addAdmins(ByteString.copyFrom(admin.pem()))));

        memberId = identityOf(member);
        outsiderId = identityOf(outsider);
        adminId = msp.getAdmins().get(0);
    }

    private static Identity identityOf(Entity entity) throws Exception {
        return msp.deserializeIdentity(MSPCommon.getSerializedIdentity("org1", entity.pem()).toByteArray());
    }

    private static MspPrincipal.MSPPrincipal rolePrincipal(String mspid, MspPrincipal.MSPRole.MSPRoleType role) {
        return MspPrincipal.MSPPrincipal.newBuilder()
            .setPrincipalClassification(MspPrincipal.MSPPrincipal.Classification.ROLE)
            .setPrincipal(MspPrincipal.MSPRole.newBuilder().setMspIdentifier(mspid).setRole(role).build().toByteString())
            .build();
    }

    private static MspPrincipal.MSPPrincipal identityPrincipal(byte[] serialized) {
        return MspPrincipal.MSPPrincipal.newBuilder()
            .setPrincipalClassification(MspPrincipal.MSPPrincipal.Classification.IDENTITY)
            .setPrincipal(ByteString.copyFrom(serialized))
            .build();
    }

    @Test void testValidMemberSatisfiesMemberRole() throws Exception {
        msp.satisfiesPrincipal(memberId, rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.MEMBER));
    }

    @Test void testIdentityDelegatesToItsMSP() throws Exception {
        memberId.satisfiesPrincipal(rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.MEMBER));
        assertThrows(MSPException.DomainMismatchException.class,
            () -> memberId.satisfiesPrincipal(rolePrincipal("org2", MspPrincipal.MSPRole.MSPRoleType.MEMBER)));
    }

    @Test void testInvalidMemberFailsMemberRole() {
        assertThrows(MSPException.ChainVerificationException.class,
            () -> msp.satisfiesPrincipal(outsiderId, rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.MEMBER)));
    }

    @Test void testRoleOfAnotherMSPIsDomainMismatch() {
        Exception exception = assertThrows(MSPException.DomainMismatchException.class,
            () -> msp.satisfiesPrincipal(memberId, rolePrincipal("org2", MspPrincipal.MSPRole.MSPRoleType.MEMBER)));
        assertThat(exception.getMessage(), containsString("expected org2, got org1"));
    }

    @Test void testAdminRoleIsNotImplementedEvenForListedAdmins() {
        assertThrows(MSPException.NotImplementedException.class,
            () -> msp.satisfiesPrincipal(adminId, rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.ADMIN)));
        assertThrows(MSPException.NotImplementedException.class,
            () -> msp.satisfiesPrincipal(memberId, rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.ADMIN)));
    }

    @Test void testUnsupportedRolesAreRejected() {
        assertThrows(MSPException.UnknownRoleException.class,
            () -> msp.satisfiesPrincipal(memberId, rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.PEER)));

        MspPrincipal.MSPPrincipal unknown = MspPrincipal.MSPPrincipal.newBuilder()
            .setPrincipalClassification(MspPrincipal.MSPPrincipal.Classification.ROLE)
            .setPrincipal(MspPrincipal.MSPRole.newBuilder().setMspIdentifier("org1").setRoleValue(42).build().toByteString())
            .build();
        Exception exception = assertThrows(MSPException.UnknownRoleException.class, () -> msp.satisfiesPrincipal(memberId, unknown));
        assertThat(exception.getMessage(), containsString("42"));
    }

    @Test void testMalformedRolePayloadIsRejected() {
        MspPrincipal.MSPPrincipal malformed = MspPrincipal.MSPPrincipal.newBuilder()
            .setPrincipalClassification(MspPrincipal.MSPPrincipal.Classification.ROLE)
            .setPrincipal(ByteString.copyFrom(new byte[] { 0x0A, 0x05 }))
            .build();
        assertThrows(MSPException.DecodeException.class, () -> msp.satisfiesPrincipal(memberId, malformed));
    }

    @Test void testIdentityPrincipalMatchesSerializedIdentity() throws Exception {
        msp.satisfiesPrincipal(memberId, identityPrincipal(memberId.serialize()));
        // no chain check for identity principals
        msp.satisfiesPrincipal(outsiderId, identityPrincipal(outsiderId.serialize()));
    }

    @Test void testIdentityPrincipalMismatch() throws Exception {
        assertThrows(MSPException.IdentityMismatchException.class,
            () -> msp.satisfiesPrincipal(memberId, identityPrincipal(adminId.serialize())));
        assertThrows(MSPException.IdentityMismatchException.class,
            () -> msp.satisfiesPrincipal(memberId, identityPrincipal(new byte[0])));
    }

    @Test void testOrganizationUnitIsNotImplemented() {
        MspPrincipal.MSPPrincipal ou = MspPrincipal.MSPPrincipal.newBuilder()
            .setPrincipalClassification(MspPrincipal.MSPPrincipal.Classification.ORGANIZATION_UNIT)
            .setPrincipal(MspPrincipal.OrganizationUnit.newBuilder().setMspIdentifier("org1").setOrganizationalUnitIdentifier("client").build().toByteString())
            .build();
        assertThrows(MSPException.NotImplementedException.class, () -> msp.satisfiesPrincipal(memberId, ou));
    }

    @Test void testUnknownClassificationIsRejected() {
        MspPrincipal.MSPPrincipal unknown = MspPrincipal.MSPPrincipal.newBuilder()
            .setPrincipalClassificationValue(99)
            .build();
        Exception exception = assertThrows(MSPException.UnknownPrincipalTypeException.class, () -> msp.satisfiesPrincipal(memberId, unknown));
        assertThat(exception.getMessage(), containsString("99"));
    }

    @Test void testNilArgumentsAreRejected() {
        assertThrows(MSPException.DecodeException.class, () -> msp.satisfiesPrincipal(null, identityPrincipal(new byte[0])));
        assertThrows(MSPException.DecodeException.class, () -> msp.satisfiesPrincipal(memberId, null));
    }

    @Test void testEvaluatorUsesTheGivenMSP() throws Exception {
        PrincipalEvaluator evaluator = new PrincipalEvaluator();
        evaluator.satisfies(msp, memberId, rolePrincipal("org1", MspPrincipal.MSPRole.MSPRoleType.MEMBER));
        assertThat(memberId.getMSPIdentifier(), is("org1"));
    }
}
