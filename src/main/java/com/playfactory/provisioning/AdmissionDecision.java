package com.playfactory.provisioning;

/**
 * Outcome of an admission check.
 */
public record AdmissionDecision(boolean allowed, String reason) {

    public static AdmissionDecision allow() {
        return new AdmissionDecision(true, "Capacity available");
    }

    public static AdmissionDecision deny(String reason) {
        return new AdmissionDecision(false, reason);
    }
}
