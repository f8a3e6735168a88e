package com.example.videodata.exception;

public abstract class VideoDataException extends RuntimeException {

    protected VideoDataException(String message) {
        super(message);
    }

    protected VideoDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
