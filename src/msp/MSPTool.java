/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.io.File;
import java.io.IOException;
import msp.util.MSPCommon;
import msp.util.MSPConfigLoader;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a PEM certificate against a local MSP directory.
 *
 * Usage: MSPTool &lt;mspDir&gt; &lt;mspId&gt; &lt;certFile&gt;
 */
public class MSPTool {

    private static final Logger logger = LoggerFactory.getLogger(MSPTool.class);

    public static final int VALID = 0;
    public static final int INVALID = 1;
    public static final int ERROR = 2;

    public static void main(String[] args) {

        System.exit(run(args));
    }

    static int run(String[] args) {

        if (args.length != 3) {

            System.err.println("Usage: MSPTool <mspDir> <mspId> <certFile>");
            return ERROR;
        }

        String mspDir = args[0];
        String mspid = args[1];
        String certFile = args[2];

        X509MSP msp = X509MSP.getInstance();

        try {
            msp.setup(MSPConfigLoader.load(mspDir, mspid));
        } catch (IOException | MSPException ex) {
            logger.error("Failed to set up MSP " + mspid + " from " + mspDir, ex);
            return ERROR;
        }

        byte[] pemCert = null;

        try {
            pemCert = FileUtils.readFileToByteArray(new File(certFile));
        } catch (IOException ex) {
            logger.error("Could not read certificate file " + certFile, ex);
            return ERROR;
        }

        try {

            Identity id = msp.deserializeIdentity(MSPCommon.getSerializedIdentity(mspid, pemCert).toByteArray());
            id.validate();

            logger.info("Identity " + id + " is valid for MSP " + mspid);
            return VALID;

        } catch (MSPException ex) {

            logger.info("Identity in " + certFile + " is not valid for MSP " + mspid + ": " + ex.getMessage());
            return INVALID;
        }
    }
}
