package com.mike.leadscout.quality;

public record AddressParts(
        String street,
        String city,
        String state,
        String zip
) {
    public boolean isEmpty() {
        return street == null && city == null && state == null && zip == null;
    }
}
