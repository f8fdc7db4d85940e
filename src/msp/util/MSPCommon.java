/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp.util;

import com.google.protobuf.ByteString;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.PublicKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Arrays;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.hyperledger.fabric.protos.msp.Identities;

/**
 * Certificate, PEM and wire record helpers shared by the MSP classes.
 */
public class MSPCommon {

    public static final String CERTIFICATE_PEM_TYPE = "CERTIFICATE";

    /**
     * Returns the content of the first PEM block found in the input, or null
     * if there is none or it is not a certificate. A block whose body is not
     * valid base64 is reported as an {@link IOException}.
     */
    public static byte[] decodePem(byte[] bytes) throws IOException {

        if (bytes == null) return null;

        PemObject obj = null;

        try (PemReader reader = new PemReader(new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.US_ASCII))) {

            obj = reader.readPemObject();

        } catch (DecoderException ex) {

            throw new IOException("Malformed PEM body: " + ex.getMessage(), ex);
        }

        if (obj == null || !CERTIFICATE_PEM_TYPE.equals(obj.getType())) return null;

        return obj.getContent();
    }

    public static X509Certificate getCertificate(byte[] derCert) throws IOException, CertificateException {

        CertificateFactory certFactory = CertificateFactory.getInstance("X.509");

        try (InputStream in = new ByteArrayInputStream(derCert)) {

            return (X509Certificate) certFactory.generateCertificate(in);
        }
    }

    /**
     * Canonical PEM form of a certificate, as carried in a serialized identity.
     */
    public static byte[] getSerializedCertificate(X509Certificate certificate) throws IOException, CertificateEncodingException {

        PemObject pemObj = new PemObject(CERTIFICATE_PEM_TYPE, certificate.getEncoded());

        StringWriter strWriter = new StringWriter();
        try (PemWriter writer = new PemWriter(strWriter)) {

            writer.writeObject(pemObj);
        }

        return strWriter.toString().getBytes(StandardCharsets.US_ASCII);
    }

    public static Identities.SerializedIdentity getSerializedIdentity(String mspid, byte[] serializedCert) {

        Identities.SerializedIdentity.Builder ident = Identities.SerializedIdentity.newBuilder();
        ident.setMspid(mspid);
        ident.setIdBytes(ByteString.copyFrom(serializedCert));
        return ident.build();
    }

    public static boolean isCA(X509Certificate certificate) {

        return certificate.getBasicConstraints() != -1;
    }

    /**
     * Compares two public keys by value, independently of the provider that
     * produced them.
     */
    public static boolean samePublicKey(PublicKey a, PublicKey b) {

        if (a == null || b == null) return false;

        if (a instanceof ECPublicKey && b instanceof ECPublicKey) {

            return ((ECPublicKey) a).getW().equals(((ECPublicKey) b).getW());
        }

        if (a instanceof RSAPublicKey && b instanceof RSAPublicKey) {

            RSAPublicKey ra = (RSAPublicKey) a;
            RSAPublicKey rb = (RSAPublicKey) b;
            return ra.getModulus().equals(rb.getModulus()) && ra.getPublicExponent().equals(rb.getPublicExponent());
        }

        return Arrays.equals(a.getEncoded(), b.getEncoded());
    }

    public static byte[] hash(byte[] bytes, String algorithm) throws NoSuchAlgorithmException, NoSuchProviderException {

        MessageDigest digestEngine = MessageDigest.getInstance(algorithm, BouncyCastleProvider.PROVIDER_NAME);

        return digestEngine.digest(bytes);
    }
}
