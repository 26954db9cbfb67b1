package com.mike.leadscout.email.provider;

/**
 * Third-party deliverability check of a single address.
 */
public interface EmailVerificationProvider {

    String name();

    boolean isEnabled();

    /**
     * @return the verdict, or null when the provider returned nothing usable
     */
    VerificationVerdict verify(String email);
}
