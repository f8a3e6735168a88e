package com.example.videodata.exception;

public class UpstreamDecodeException extends VideoDataException {

    public UpstreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
