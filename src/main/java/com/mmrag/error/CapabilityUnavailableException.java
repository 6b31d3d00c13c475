package com.mmrag.error;

public class CapabilityUnavailableException extends RuntimeException {
    private final String capability;

    public CapabilityUnavailableException(String capability, String message) {
        super(capability + " unavailable: " + message);
        this.capability = capability;
    }

    public CapabilityUnavailableException(String capability, String message, Throwable cause) {
        super(capability + " unavailable: " + message, cause);
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
