package com.mike.leadscout.email.provider;

/**
 * Contact address found in a domain registration record.
 *
 * @param role registrant, administrative, technical or registry
 */
public record DomainContact(String email, String role) {
}
