/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Decides whether a certification path that was already verified is
 * acceptable for an identity. Paths run from the issuer of the identity's
 * certificate up to, but excluding, the trust anchor.
 */
@FunctionalInterface
public interface CertPathAcceptor {

    CertPathAcceptor ANY = (certificate, path, anchor) -> true;

    boolean accept(X509Certificate certificate, List<X509Certificate> path, TrustAnchor anchor);
}
