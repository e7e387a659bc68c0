package com.purchasingpower.uicatalog.exception;

public class ComponentDetectionException extends RuntimeException {

    public ComponentDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
