/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.PKIXCertPathBuilderResult;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import msp.util.BCCryptoProvider;
import msp.util.CryptoProvider;
import msp.util.CryptoSigner;
import msp.util.MSPCommon;
import msp.util.VerificationOptions;
import org.hyperledger.fabric.protos.common.MspPrincipal;
import org.hyperledger.fabric.protos.msp.Identities;
import org.hyperledger.fabric.protos.msp.MspConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MSP for X.509 certificates. Holds the roots of trust, intermediate CAs,
 * admins and the optional default signing identity of one membership domain.
 *
 * All of that lives in an immutable {@link TrustStore}; {@link #setup} builds
 * a new one and publishes it with a single write, so readers never need to
 * lock and never see a partially configured MSP.
 */
public class X509MSP implements MSP {

    private final CryptoProvider crypto;
    private final IdentifierDerivation idDerivation;
    private final CertPathAcceptor pathAcceptor;
    private final Clock clock;
    private final Logger logger;
    private final PrincipalEvaluator evaluator = new PrincipalEvaluator();

    private volatile TrustStore store = null;

    public X509MSP() {

        this(new BCCryptoProvider(), LoggerFactory.getLogger(X509MSP.class));
    }

    public X509MSP(CryptoProvider crypto, Logger logger) {

        this(crypto, IdentifierDerivation.placeholder(), CertPathAcceptor.ANY, Clock.systemUTC(), logger);
    }

    public X509MSP(CryptoProvider crypto, IdentifierDerivation idDerivation, CertPathAcceptor pathAcceptor, Clock clock, Logger logger) {

        this.crypto = crypto;
        this.idDerivation = idDerivation;
        this.pathAcceptor = pathAcceptor;
        this.clock = clock;
        this.logger = logger;
    }

    public static X509MSP getInstance() {

        return new X509MSP();
    }

    CryptoProvider getCryptoProvider() {

        return crypto;
    }

    @Override
    public void setup(MspConfig.MSPConfig config) throws MSPException {

        if (config == null) {

            throw new MSPException.ConfigException("Setup error: nil conf reference");
        }

        MspConfig.FabricMSPConfig conf = null;

        try {
            conf = MspConfig.FabricMSPConfig.parseFrom(config.getConfig());
        } catch (InvalidProtocolBufferException ex) {
            throw new MSPException.ConfigException("Failed unmarshalling fabric msp config: " + ex.getMessage(), ex);
        }

        setup(conf);
    }

    public synchronized void setup(MspConfig.FabricMSPConfig conf) throws MSPException {

        if (conf == null) {

            throw new MSPException.ConfigException("Setup error: nil conf reference");
        }

        String name = conf.getName();

        if (name.isEmpty()) {

            throw new MSPException.ConfigException("Setup error: MSP configuration carries no name");
        }

        logger.debug("Setting up MSP instance " + name);

        // a root of trust is mandatory
        if (conf.getRootCertsCount() == 0) {

            throw new MSPException.ConfigException("Expected at least one CA certificate for MSP " + name);
        }

        List<Identity> admins = new ArrayList<>();
        for (ByteString admCert : conf.getAdminsList()) {

            admins.add(getIdentityFromConf(name, admCert.toByteArray()));
        }

        List<Identity> rootCerts = new ArrayList<>();
        for (ByteString trustedCert : conf.getRootCertsList()) {

            Identity id = getIdentityFromConf(name, trustedCert.toByteArray());

            if (!MSPCommon.isCA(id.getCertificate())) {

                logger.warn("Root certificate " + id.getCertificate().getSubjectX500Principal() + " of MSP " + name + " is not marked as a CA");
            }

            rootCerts.add(id);
        }

        List<Identity> intermediateCerts = new ArrayList<>();
        for (ByteString trustedCert : conf.getIntermediateCertsList()) {

            intermediateCerts.add(getIdentityFromConf(name, trustedCert.toByteArray()));
        }

        SigningIdentity signer = null;
        if (conf.hasSigningIdentity()) {

            signer = getSigningIdentityFromConf(name, conf.getSigningIdentity());
        }

        // verify options are rebuilt from scratch with roots and intermediates
        List<X509Certificate> roots = new ArrayList<>();
        for (Identity id : rootCerts) roots.add(id.getCertificate());

        List<X509Certificate> intermediates = new ArrayList<>();
        for (Identity id : intermediateCerts) intermediates.add(id.getCertificate());

        VerificationOptions opts = new VerificationOptions(roots, intermediates);

        this.store = new TrustStore(name, rootCerts, intermediateCerts, admins, signer, opts);

        logger.debug("MSP " + name + " set up with " + admins.size() + " admins and verification options " + opts);
    }

    private X509Identity getIdentityFromConf(String mspid, byte[] idBytes) throws MSPException {

        if (idBytes == null || idBytes.length == 0) {

            throw new MSPException.DecodeException("getIdentityFromConf error: nil idBytes");
        }

        return newIdentity(mspid, idBytes);
    }

    private SigningIdentity getSigningIdentityFromConf(String mspid, MspConfig.SigningIdentityInfo sidInfo) throws MSPException {

        // extract the public part of the identity
        X509Identity idPub = getIdentityFromConf(mspid, sidInfo.getPublicSigner().toByteArray());

        if (!sidInfo.hasPrivateSigner()) {

            throw new MSPException.ConfigException("Signing identity of MSP " + mspid + " carries no private key");
        }

        CryptoSigner signer = null;

        try {

            PrivateKey key = crypto.importPrivateKey(sidInfo.getPrivateSigner().getKeyMaterial().toByteArray());
            signer = crypto.getSigner(key);

        } catch (IOException | GeneralSecurityException ex) {

            throw new MSPException.ConfigException("Failed to import the private key of the signing identity of MSP " + mspid + ": " + ex.getMessage(), ex);
        }

        if (!MSPCommon.samePublicKey(signer.getPublic(), idPub.getPublicKey())) {

            throw new MSPException.ConfigException("The private key of the signing identity of MSP " + mspid + " does not match its certificate");
        }

        return new X509SigningIdentity(idPub.getIdentifier(), idPub.getCertificate(), idPub.getPublicKey(), signer, this);
    }

    private X509Identity newIdentity(String mspid, byte[] pemCert) throws MSPException {

        byte[] derCert = null;

        try {
            derCert = MSPCommon.decodePem(pemCert);
        } catch (IOException ex) {
            throw new MSPException.DecodeException("Could not decode the PEM structure: " + ex.getMessage(), ex);
        }

        if (derCert == null) {

            throw new MSPException.DecodeException("Could not decode the PEM structure");
        }

        X509Certificate cert = null;

        try {
            cert = MSPCommon.getCertificate(derCert);
        } catch (IOException | CertificateException ex) {
            throw new MSPException.ParseException("Failed to parse x509 cert: " + ex.getMessage(), ex);
        }

        PublicKey pk = null;

        try {
            pk = crypto.importPublicKey(cert);
        } catch (GeneralSecurityException ex) {
            throw new MSPException.ParseException("Failed to import certificate's public key: " + ex.getMessage(), ex);
        }

        // TODO: check that the subject or issuer of the certificate names this MSP once an encoding for the MSP id is agreed on

        return new X509Identity(new IdentityIdentifier(mspid, idDerivation.localIdentifier(cert)), cert, pk, this);
    }

    private TrustStore current() throws MSPException {

        TrustStore s = this.store;

        if (s == null) {

            throw new MSPException.UninitializedException("Invalid msp instance: setup has not completed");
        }

        return s;
    }

    @Override
    public ProviderType getType() {

        return ProviderType.FABRIC;
    }

    @Override
    public String getIdentifier() throws MSPException {

        return current().getName();
    }

    @Override
    public SigningIdentity getDefaultSigningIdentity() throws MSPException {

        logger.debug("Obtaining default signing identity");

        SigningIdentity signer = current().getSigner();

        if (signer == null) {

            throw new MSPException.NotFoundException("This MSP does not possess a valid default signing identity");
        }

        return signer;
    }

    @Override
    public SigningIdentity getSigningIdentity(IdentityIdentifier identifier) throws MSPException {

        SigningIdentity signer = current().getSigner();

        if (signer != null && signer.getIdentifier().equals(identifier)) {

            return signer;
        }

        throw new MSPException.NotFoundException("No signing identity " + identifier + " in this MSP");
    }

    @Override
    public List<Identity> getRootCerts() throws MSPException {

        return current().getRootCerts();
    }

    @Override
    public List<Identity> getIntermediateCerts() throws MSPException {

        return current().getIntermediateCerts();
    }

    @Override
    public List<Identity> getAdmins() throws MSPException {

        return current().getAdmins();
    }

    @Override
    public void validate(Identity id) throws MSPException {

        TrustStore s = current();

        if (id == null) {

            throw new MSPException("Nil identity");
        }

        logger.info("MSP " + s.getName() + " validating identity " + id);

        X509Certificate cert = id.getCertificate();

        // CAs cannot be directly used as identities
        if (MSPCommon.isCA(cert)) {

            throw new MSPException.CAUsedAsIdentityException("A CA certificate cannot be used directly by this MSP");
        }

        PKIXCertPathBuilderResult result = null;

        try {
            result = crypto.verifyChain(cert, s.getVerificationOptions(), Date.from(clock.instant()));
        } catch (GeneralSecurityException ex) {
            throw new MSPException.ChainVerificationException("The supplied identity is not valid: " + ex.getMessage(), ex);
        }

        List<X509Certificate> certPath = new ArrayList<>();
        for (java.security.cert.Certificate c : result.getCertPath().getCertificates()) {

            certPath.add((X509Certificate) c);
        }

        if (!certPath.isEmpty() && certPath.get(0).equals(cert)) {

            certPath = certPath.subList(1, certPath.size());
        }

        if (!pathAcceptor.accept(cert, certPath, result.getTrustAnchor())) {

            throw new MSPException.ChainVerificationException("The certification path of the supplied identity was rejected");
        }

        logger.debug("Certificate chain for " + id + " is valid");
    }

    @Override
    public Identity deserializeIdentity(byte[] serializedIdentity) throws MSPException {

        TrustStore s = current();

        logger.debug("Obtaining identity");

        if (serializedIdentity == null) {

            throw new MSPException.DecodeException("Could not deserialize a SerializedIdentity: nil bytes");
        }

        // We first deserialize to a SerializedIdentity to get the MSP ID
        Identities.SerializedIdentity sId = null;

        try {
            sId = Identities.SerializedIdentity.parseFrom(serializedIdentity);
        } catch (InvalidProtocolBufferException ex) {
            throw new MSPException.DecodeException("Could not deserialize a SerializedIdentity: " + ex.getMessage(), ex);
        }

        if (!sId.getMspid().equals(s.getName())) {

            throw new MSPException.MSPMismatchException("Expected MSP ID " + s.getName() + ", received " + sId.getMspid());
        }

        return getIdentityFromConf(s.getName(), sId.getIdBytes().toByteArray());
    }

    @Override
    public void satisfiesPrincipal(Identity id, MspPrincipal.MSPPrincipal principal) throws MSPException {

        evaluator.satisfies(this, id, principal);
    }
}
