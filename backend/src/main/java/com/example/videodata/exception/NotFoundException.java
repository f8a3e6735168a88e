package com.example.videodata.exception;

public class NotFoundException extends VideoDataException {

    public NotFoundException(String message) {
        super(message);
    }
}
