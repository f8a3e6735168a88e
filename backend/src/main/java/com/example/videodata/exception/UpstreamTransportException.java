package com.example.videodata.exception;

public class UpstreamTransportException extends VideoDataException {

    private final Integer statusCode;

    public UpstreamTransportException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public UpstreamTransportException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
