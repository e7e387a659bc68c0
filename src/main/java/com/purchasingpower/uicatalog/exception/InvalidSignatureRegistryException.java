package com.purchasingpower.uicatalog.exception;

import lombok.Getter;

/**
 * Raised when the component signature registry is misconfigured.
 * Thrown while the registry is built, never while a document is analyzed.
 */
@Getter
public class InvalidSignatureRegistryException extends RuntimeException {

    private final String signatureName;

    public InvalidSignatureRegistryException(String signatureName, String message) {
        super(signatureName != null
                ? "Invalid component signature '" + signatureName + "': " + message
                : "Invalid component signature registry: " + message);
        this.signatureName = signatureName;
    }
}
