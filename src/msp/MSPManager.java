/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import com.google.protobuf.InvalidProtocolBufferException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import org.hyperledger.fabric.protos.msp.Identities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the MSPs of several membership domains and routes serialized
 * identities to the MSP they name. Reconfiguration installs a new set of
 * MSPs in one step.
 */
public class MSPManager {

    private static final Logger logger = LoggerFactory.getLogger(MSPManager.class);

    private final AtomicReference<Map<String, MSP>> msps = new AtomicReference<>(null);

    private MSPManager() {

    }

    public static MSPManager getInstance() {

        return new MSPManager();
    }

    /**
     * Replaces the managed MSPs. Every MSP must already be set up.
     */
    public void setup(List<MSP> list) throws MSPException {

        if (list == null) {

            throw new MSPException.ConfigException("Setup error: nil MSP list");
        }

        Map<String, MSP> map = new TreeMap<>();

        for (MSP msp : list) {

            String mspid = msp.getIdentifier();

            if (map.containsKey(mspid)) {

                throw new MSPException.ConfigException("Duplicate MSP identifier " + mspid);
            }

            map.put(mspid, msp);
        }

        msps.set(Collections.unmodifiableMap(map));

        logger.info("MSP manager set up with MSPs " + map.keySet());
    }

    public Map<String, MSP> getMSPs() throws MSPException {

        return current();
    }

    public MSP getMSP(String mspid) throws MSPException {

        MSP msp = current().get(mspid);

        if (msp == null) {

            throw new MSPException.NotFoundException("MSP " + mspid + " is unknown");
        }

        return msp;
    }

    public Identity deserializeIdentity(byte[] serializedIdentity) throws MSPException {

        if (serializedIdentity == null) {

            throw new MSPException.DecodeException("Could not deserialize a SerializedIdentity: nil bytes");
        }

        Identities.SerializedIdentity sId = null;

        try {
            sId = Identities.SerializedIdentity.parseFrom(serializedIdentity);
        } catch (InvalidProtocolBufferException ex) {
            throw new MSPException.DecodeException("Could not deserialize a SerializedIdentity: " + ex.getMessage(), ex);
        }

        logger.debug("Routing identity to MSP " + sId.getMspid());

        return getMSP(sId.getMspid()).deserializeIdentity(serializedIdentity);
    }

    private Map<String, MSP> current() throws MSPException {

        Map<String, MSP> map = msps.get();

        if (map == null) {

            throw new MSPException.UninitializedException("MSP manager has not been set up");
        }

        return map;
    }
}
