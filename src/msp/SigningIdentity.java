/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

/**
 * An identity that also holds the private key matching its certificate.
 */
public interface SigningIdentity extends Identity {

    byte[] sign(byte[] message) throws MSPException;

    Identity getPublicVersion();
}
