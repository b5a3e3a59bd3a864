package com.omnioracle.domain;

/**
 * Remote read could not be issued or its payload could not be decoded.
 */
public class RemoteReadException extends OracleException {

    public static final String READ_CHANNEL_UNSET = "READ_CHANNEL_UNSET";
    public static final String PEER_INACTIVE = "PEER_INACTIVE";
    public static final String PEER_REF_UNSET = "PEER_REF_UNSET";
    public static final String PAYLOAD_INVALID = "PAYLOAD_INVALID";
    public static final String UNSUPPORTED_SELECTOR = "UNSUPPORTED_SELECTOR";

    public RemoteReadException(String code, String message) {
        super(code, message);
    }

    public RemoteReadException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
