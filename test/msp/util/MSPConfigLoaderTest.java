package msp.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.hyperledger.fabric.protos.msp.MspConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import msp.MSPException;
import msp.SigningIdentity;
import msp.X509MSP;
import msp.util.PkiFixtures.Entity;

@DisplayName("MSP directory loader")
class MSPConfigLoaderTest {

    private static Entity root;
    private static Entity intermediate;
    private static Entity peer;
    private static Entity admin;

    @BeforeAll static void beforeAll() throws Exception {
        root = PkiFixtures.rootCA("org1-ca");
        intermediate = PkiFixtures.intermediateCA("org1-ica", root);
        peer = PkiFixtures.endEntity("peer0", intermediate);
        admin = PkiFixtures.endEntity("admin", root);
    }

    private static void write(File dir, String sub, String name, byte[] content) throws Exception {
        FileUtils.writeByteArrayToFile(new File(new File(dir, sub), name), content);
    }

    @Test void testFullDirectory(@TempDir File dir) throws Exception {
        write(dir, MSPConfigLoader.CACERTS, "ca.pem", root.pem());
        write(dir, MSPConfigLoader.INTERMEDIATECERTS, "ica.pem", intermediate.pem());
        write(dir, MSPConfigLoader.ADMINCERTS, "admin.pem", admin.pem());
        write(dir, MSPConfigLoader.SIGNCERTS, "peer0.pem", peer.pem());
        write(dir, MSPConfigLoader.KEYSTORE, "peer0_sk", PkiFixtures.sec1Pem(peer.keyPair.getPrivate()));

        MspConfig.MSPConfig conf = MSPConfigLoader.load(dir.getAbsolutePath(), "org1");
        assertThat(conf.getType(), is(MSPConfigLoader.FABRIC_TYPE));

        MspConfig.FabricMSPConfig fabricConf = MspConfig.FabricMSPConfig.parseFrom(conf.getConfig());
        assertThat(fabricConf.getName(), is(equalTo("org1")));
        assertThat(fabricConf.getRootCertsCount(), is(1));
        assertThat(fabricConf.getIntermediateCertsCount(), is(1));
        assertThat(fabricConf.getAdminsCount(), is(1));
        assertThat(fabricConf.getSigningIdentity().getPrivateSigner().getKeyIdentifier(), is(equalTo("peer0_sk")));

        X509MSP msp = X509MSP.getInstance();
        msp.setup(conf);

        SigningIdentity signer = msp.getDefaultSigningIdentity();
        signer.validate();
        byte[] msg = "envelope".getBytes(StandardCharsets.UTF_8);
        assertThat(signer.verify(msg, signer.sign(msg)), is(true));
    }

    @Test void testSignCertWithoutKeyGivesNoSigner(@TempDir File dir) throws Exception {
        write(dir, MSPConfigLoader.CACERTS, "ca.pem", root.pem());
        write(dir, MSPConfigLoader.SIGNCERTS, "peer0.pem", peer.pem());

        MspConfig.MSPConfig conf = MSPConfigLoader.load(dir.getAbsolutePath(), "org1");
        assertThat(MspConfig.FabricMSPConfig.parseFrom(conf.getConfig()).hasSigningIdentity(), is(false));

        X509MSP msp = X509MSP.getInstance();
        msp.setup(conf);
        assertThrows(MSPException.NotFoundException.class, () -> msp.getDefaultSigningIdentity());
    }

    @Test void testFilesAreReadInNameOrder(@TempDir File dir) throws Exception {
        Entity otherRoot = PkiFixtures.rootCA("org1-ca2");
        write(dir, MSPConfigLoader.CACERTS, "b.pem", otherRoot.pem());
        write(dir, MSPConfigLoader.CACERTS, "a.pem", root.pem());

        MspConfig.FabricMSPConfig fabricConf = MspConfig.FabricMSPConfig.parseFrom(MSPConfigLoader.load(dir.getAbsolutePath(), "org1").getConfig());
        assertThat(fabricConf.getRootCerts(0).toByteArray(), is(equalTo(root.pem())));
        assertThat(fabricConf.getRootCerts(1).toByteArray(), is(equalTo(otherRoot.pem())));
    }

    @Test void testEmptyDirectoryFailsAtSetup(@TempDir File dir) throws Exception {
        MspConfig.MSPConfig conf = MSPConfigLoader.load(dir.getAbsolutePath(), "org1");
        assertThrows(MSPException.ConfigException.class, () -> X509MSP.getInstance().setup(conf));
    }

    @Test void testMissingDirectory(@TempDir File dir) {
        assertThrows(FileNotFoundException.class, () -> MSPConfigLoader.load(new File(dir, "nope").getAbsolutePath(), "org1"));
    }
}
