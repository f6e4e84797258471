package com.playfactory.provisioning;

/**
 * Gate consulted immediately before every provisioning attempt.
 *
 * <p>Implementations must be free of side effects: a decision reserves nothing, and an
 * "allowed" answer only covers the attempt that asked for it.
 */
@FunctionalInterface
public interface AdmissionController {

    AdmissionDecision canAdmit();
}
