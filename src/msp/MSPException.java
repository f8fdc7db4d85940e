/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

/**
 * Root of every failure reported by an MSP. Each kind of failure has its own
 * subclass so that callers can tell a configuration problem from a rejected
 * identity without parsing messages.
 */
public class MSPException extends Exception {

    public MSPException(String msg) {

        super(msg);
    }

    public MSPException(String msg, Throwable cause) {

        super(msg, cause);
    }

    /** Missing or malformed setup input. */
    public static class ConfigException extends MSPException {

        public ConfigException(String msg) {
            super(msg);
        }

        public ConfigException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }

    /** Input that is not PEM, or not the expected protobuf record. */
    public static class DecodeException extends MSPException {

        public DecodeException(String msg) {
            super(msg);
        }

        public DecodeException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }

    /** PEM decoded fine but the certificate structure inside is malformed. */
    public static class ParseException extends MSPException {

        public ParseException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }

    public static class UninitializedException extends MSPException {

        public UninitializedException(String msg) {
            super(msg);
        }
    }

    public static class CAUsedAsIdentityException extends MSPException {

        public CAUsedAsIdentityException(String msg) {
            super(msg);
        }
    }

    /** Wraps the reason reported by the PKIX path builder. */
    public static class ChainVerificationException extends MSPException {

        public ChainVerificationException(String msg) {
            super(msg);
        }

        public ChainVerificationException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }

    public static class MSPMismatchException extends MSPException {

        public MSPMismatchException(String msg) {
            super(msg);
        }
    }

    public static class DomainMismatchException extends MSPException {

        public DomainMismatchException(String msg) {
            super(msg);
        }
    }

    public static class IdentityMismatchException extends MSPException {

        public IdentityMismatchException(String msg) {
            super(msg);
        }
    }

    public static class UnknownRoleException extends MSPException {

        public UnknownRoleException(String msg) {
            super(msg);
        }
    }

    public static class UnknownPrincipalTypeException extends MSPException {

        public UnknownPrincipalTypeException(String msg) {
            super(msg);
        }
    }

    public static class NotImplementedException extends MSPException {

        public NotImplementedException(String msg) {
            super(msg);
        }
    }

    public static class NotFoundException extends MSPException {

        public NotFoundException(String msg) {
            super(msg);
        }
    }

    /** Signing or signature verification failed inside the crypto provider. */
    public static class CryptoOperationException extends MSPException {

        public CryptoOperationException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }
}
