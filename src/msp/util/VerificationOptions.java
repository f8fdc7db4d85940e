/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp.util;

import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Trust anchors and chain-building aids used to verify member certificates.
 * Built once per setup and never modified afterwards.
 */
public final class VerificationOptions {

    private final Set<TrustAnchor> trustAnchors;
    private final List<X509Certificate> intermediates;

    public VerificationOptions(Collection<X509Certificate> roots, Collection<X509Certificate> intermediates) {

        Set<TrustAnchor> anchors = new HashSet<>();
        for (X509Certificate root : roots) {
            anchors.add(new TrustAnchor(root, null));
        }

        this.trustAnchors = Collections.unmodifiableSet(anchors);
        this.intermediates = Collections.unmodifiableList(new ArrayList<>(intermediates));
    }

    public Set<TrustAnchor> getTrustAnchors() {

        return trustAnchors;
    }

    public List<X509Certificate> getIntermediates() {

        return intermediates;
    }

    @Override
    public String toString() {

        return "[" + trustAnchors.size() + " roots, " + intermediates.size() + " intermediates]";
    }
}
