package com.example.renditions.exceptions;

public class UnsupportedMediaFormatException extends RuntimeException {
    public UnsupportedMediaFormatException(String message) {
        super(message);
    }
}
