package com.example.videodata.exception;

public class DataIntegrityException extends VideoDataException {

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
