package com.modelgateway.exception;

/**
 * The request's deadline passed before it could be served. Reported separately
 * from failures so callers can tell "too slow" apart from "broken".
 */
public class RequestExpiredException extends GatewayException {

    public RequestExpiredException(String requestId) {
        super(GatewayErrorCode.REQUEST_EXPIRED, "Request " + requestId + " expired before it was served");
    }
}
