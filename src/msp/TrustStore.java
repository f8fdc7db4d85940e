/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import msp.util.VerificationOptions;

/**
 * Snapshot of the configuration of one {@link X509MSP}. Fully built before it
 * is published and never modified afterwards.
 */
final class TrustStore {

    private final String name;
    private final List<Identity> rootCerts;
    private final List<Identity> intermediateCerts;
    private final List<Identity> admins;
    private final SigningIdentity signer;
    private final VerificationOptions opts;

    TrustStore(String name, List<Identity> rootCerts, List<Identity> intermediateCerts, List<Identity> admins,
            SigningIdentity signer, VerificationOptions opts) {

        this.name = name;
        this.rootCerts = Collections.unmodifiableList(new ArrayList<>(rootCerts));
        this.intermediateCerts = Collections.unmodifiableList(new ArrayList<>(intermediateCerts));
        this.admins = Collections.unmodifiableList(new ArrayList<>(admins));
        this.signer = signer;
        this.opts = opts;
    }

    String getName() {

        return name;
    }

    List<Identity> getRootCerts() {

        return rootCerts;
    }

    List<Identity> getIntermediateCerts() {

        return intermediateCerts;
    }

    List<Identity> getAdmins() {

        return admins;
    }

    // may be null
    SigningIdentity getSigner() {

        return signer;
    }

    VerificationOptions getVerificationOptions() {

        return opts;
    }
}
