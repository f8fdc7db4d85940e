/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Security;
import java.security.Signature;
import java.security.cert.CertPathBuilder;
import java.security.cert.CertStore;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.PKIXCertPathBuilderResult;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECKey;
import java.security.interfaces.RSAKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.RSAPublicKeySpec;
import java.util.Date;
import java.util.LinkedList;
import java.util.List;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.interfaces.ECPrivateKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.jce.spec.ECParameterSpec;
import org.bouncycastle.jce.spec.ECPublicKeySpec;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.encoders.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CryptoProvider} backed by the BouncyCastle JCA provider. Keys are
 * temporary: nothing is written to a key store.
 */
public class BCCryptoProvider implements CryptoProvider {

    private static final Logger logger = LoggerFactory.getLogger(BCCryptoProvider.class);

    public static final String EC_SIGNATURE_ALGORITHM = "SHA256withECDSA";
    public static final String RSA_SIGNATURE_ALGORITHM = "SHA256withRSA";

    private final String provider = BouncyCastleProvider.PROVIDER_NAME;

    public BCCryptoProvider() {

        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {

            logger.debug("Registering BouncyCastle security provider");
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    @Override
    public PublicKey importPublicKey(X509Certificate certificate) throws GeneralSecurityException {

        PublicKey key = certificate.getPublicKey();

        if (!(key instanceof ECKey) && !(key instanceof RSAKey)) {

            throw new NoSuchAlgorithmException("Unsupported public key algorithm " + key.getAlgorithm());
        }

        return key;
    }

    @Override
    public PrivateKey importPrivateKey(byte[] keyMaterial) throws IOException, GeneralSecurityException {

        if (keyMaterial == null) throw new IOException("No key material supplied");

        Object obj = null;

        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(keyMaterial), StandardCharsets.US_ASCII);
                PEMParser pp = new PEMParser(reader)) {

            obj = pp.readObject();

        } catch (DecoderException ex) {

            throw new IOException("Malformed PEM body: " + ex.getMessage(), ex);
        }

        PrivateKeyInfo keyInfo = null;

        if (obj instanceof PrivateKeyInfo) {

            keyInfo = (PrivateKeyInfo) obj;

        } else if (obj instanceof PEMKeyPair) {

            keyInfo = ((PEMKeyPair) obj).getPrivateKeyInfo();

        } else if (obj instanceof PEMEncryptedKeyPair) {

            throw new IOException("Encrypted private keys are not supported");

        } else {

            throw new IOException("Key material does not contain a PEM encoded private key");
        }

        return new JcaPEMKeyConverter().setProvider(provider).getPrivateKey(keyInfo);
    }

    @Override
    public CryptoSigner getSigner(PrivateKey key) throws GeneralSecurityException {

        if (key instanceof ECKey) {

            return new CryptoSigner(key, derivePublicKey(key), EC_SIGNATURE_ALGORITHM, provider);
        }

        if (key instanceof RSAPrivateCrtKey) {

            RSAPrivateCrtKey rsaKey = (RSAPrivateCrtKey) key;
            PublicKey pub = KeyFactory.getInstance("RSA", provider).generatePublic(
                    new RSAPublicKeySpec(rsaKey.getModulus(), rsaKey.getPublicExponent()));

            return new CryptoSigner(key, pub, RSA_SIGNATURE_ALGORITHM, provider);
        }

        throw new NoSuchAlgorithmException("Unsupported private key algorithm " + key.getAlgorithm());
    }

    @Override
    public PKIXCertPathBuilderResult verifyChain(X509Certificate certificate, VerificationOptions opts, Date date) throws GeneralSecurityException {

        // Create the selector that specifies the starting certificate
        X509CertSelector selector = new X509CertSelector();
        selector.setCertificate(certificate);

        PKIXBuilderParameters pkixParams = new PKIXBuilderParameters(opts.getTrustAnchors(), selector);

        // no revocation support
        pkixParams.setRevocationEnabled(false);
        pkixParams.setSigProvider(provider);
        pkixParams.setDate(date);

        // BouncyCastle provider needs the target certificate in the intermediate set
        List<X509Certificate> certs = new LinkedList<>(opts.getIntermediates());
        certs.add(certificate);

        CertStore intermediateCertStore = CertStore.getInstance("Collection",
                new CollectionCertStoreParameters(certs), provider);
        pkixParams.addCertStore(intermediateCertStore);

        // Build and verify the certification chain
        CertPathBuilder builder = CertPathBuilder.getInstance("PKIX", provider);
        return (PKIXCertPathBuilderResult) builder.build(pkixParams);
    }

    @Override
    public boolean verify(PublicKey key, byte[] signature, byte[] message) throws GeneralSecurityException {

        String algorithm = null;

        if (key instanceof ECKey) algorithm = EC_SIGNATURE_ALGORITHM;
        else if (key instanceof RSAKey) algorithm = RSA_SIGNATURE_ALGORITHM;
        else throw new NoSuchAlgorithmException("Unsupported public key algorithm " + key.getAlgorithm());

        Signature sigEngine = Signature.getInstance(algorithm, provider);
        sigEngine.initVerify(key);
        sigEngine.update(message);

        return sigEngine.verify(signature);
    }

    private PublicKey derivePublicKey(PrivateKey key) throws GeneralSecurityException {

        KeyFactory keyFactory = KeyFactory.getInstance("EC", provider);

        ECPrivateKey ecKey = (key instanceof ECPrivateKey ? (ECPrivateKey) key : (ECPrivateKey) keyFactory.translateKey(key));
        ECParameterSpec params = ecKey.getParameters();

        if (params == null) throw new InvalidKeySpecException("EC private key carries no curve parameters");

        ECPoint q = params.getG().multiply(ecKey.getD()).normalize();

        return keyFactory.generatePublic(new ECPublicKeySpec(q, params));
    }
}
