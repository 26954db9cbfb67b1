package com.mike.leadscout.quality;

import com.mike.leadscout.util.Domains;

/**
 * Normalized identity fields of a listing, computed once per listing before pairwise matching.
 */
public record BusinessSignature(
        String name,
        String phone,
        String domain,
        String address
) {
    public static BusinessSignature of(RawListing listing) {
        return of(listing.getName(), listing.getPhone(), listing.getWebsite(), listing.getAddress());
    }

    public static BusinessSignature of(String name, String phone, String website, String address) {
        String normalizedName = BusinessNormalizer.normalizeName(name);
        String domain = Domains.extractDomain(website);
        if (FieldValidator.isSocialHost(domain)) {
            domain = null;
        }
        return new BusinessSignature(
                normalizedName == null || normalizedName.isEmpty() ? null : normalizedName,
                BusinessNormalizer.normalizePhone(phone),
                domain,
                address == null || address.isBlank() ? null : address
        );
    }
}
