package com.example.renditions.exceptions;

public class EncoderInitializationException extends RuntimeException {
    public EncoderInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
