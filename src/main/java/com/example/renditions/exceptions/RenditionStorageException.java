package com.example.renditions.exceptions;

public class RenditionStorageException extends RuntimeException {
    public RenditionStorageException(String message) {
        super(message);
    }

    public RenditionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
