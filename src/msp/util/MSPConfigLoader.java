/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp.util;

import com.google.protobuf.ByteString;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedList;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.hyperledger.fabric.protos.msp.MspConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an MSP configuration record from a local MSP directory:
 *
 * <pre>
 *   cacerts/            root CA certificates
 *   intermediatecerts/  intermediate CA certificates
 *   admincerts/         admin certificates
 *   signcerts/          certificate of the default signing identity
 *   keystore/           private key of the default signing identity
 * </pre>
 *
 * Every directory is optional. A signing identity is only configured when
 * both signcerts/ and keystore/ hold a file.
 */
public class MSPConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(MSPConfigLoader.class);

    public static final String CACERTS = "cacerts";
    public static final String INTERMEDIATECERTS = "intermediatecerts";
    public static final String ADMINCERTS = "admincerts";
    public static final String SIGNCERTS = "signcerts";
    public static final String KEYSTORE = "keystore";

    // MSPConfig.type value for X.509 based MSPs
    public static final int FABRIC_TYPE = 0;

    public static MspConfig.MSPConfig load(String dir, String mspid) throws IOException {

        File root = new File(dir);

        if (!root.isDirectory()) {

            throw new FileNotFoundException("MSP directory " + dir + " does not exist");
        }

        logger.debug("Loading MSP " + mspid + " from " + root.getAbsolutePath());

        MspConfig.FabricMSPConfig.Builder conf = MspConfig.FabricMSPConfig.newBuilder();
        conf.setName(mspid);

        for (File f : listFiles(new File(root, CACERTS))) {

            conf.addRootCerts(ByteString.copyFrom(FileUtils.readFileToByteArray(f)));
        }

        for (File f : listFiles(new File(root, INTERMEDIATECERTS))) {

            conf.addIntermediateCerts(ByteString.copyFrom(FileUtils.readFileToByteArray(f)));
        }

        for (File f : listFiles(new File(root, ADMINCERTS))) {

            conf.addAdmins(ByteString.copyFrom(FileUtils.readFileToByteArray(f)));
        }

        List<File> signcerts = listFiles(new File(root, SIGNCERTS));
        List<File> keys = listFiles(new File(root, KEYSTORE));

        if (!signcerts.isEmpty() && !keys.isEmpty()) {

            File certFile = signcerts.get(0);
            File keyFile = keys.get(0);

            logger.debug("Using " + certFile.getName() + " and key " + keyFile.getName() + " as signing identity of MSP " + mspid);

            MspConfig.KeyInfo keyInfo = MspConfig.KeyInfo.newBuilder()
                    .setKeyIdentifier(keyFile.getName())
                    .setKeyMaterial(ByteString.copyFrom(FileUtils.readFileToByteArray(keyFile)))
                    .build();

            conf.setSigningIdentity(MspConfig.SigningIdentityInfo.newBuilder()
                    .setPublicSigner(ByteString.copyFrom(FileUtils.readFileToByteArray(certFile)))
                    .setPrivateSigner(keyInfo));

        } else if (!signcerts.isEmpty() || !keys.isEmpty()) {

            logger.warn("MSP directory " + dir + " holds only one of " + SIGNCERTS + " and " + KEYSTORE + ", no signing identity configured");
        }

        return MspConfig.MSPConfig.newBuilder()
                .setType(FABRIC_TYPE)
                .setConfig(conf.build().toByteString())
                .build();
    }

    private static List<File> listFiles(File dir) {

        if (!dir.isDirectory()) return new LinkedList<>();

        Collection<File> files = FileUtils.listFiles(dir, null, false);

        List<File> result = new ArrayList<>(files);
        result.sort(Comparator.comparing(File::getName));

        return result;
    }
}
