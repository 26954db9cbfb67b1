package com.mike.leadscout.email.extract;

import lombok.extern.slf4j.Slf4j;

/**
 * Decodes Cloudflare's {@code data-cfemail} hex: the first byte is the XOR key for the rest.
 */
@Slf4j
public final class CloudflareEmailDecoder {

    private CloudflareEmailDecoder() {
    }

    public static String decode(String cfemail) {
        if (cfemail == null || cfemail.length() < 4 || cfemail.length() % 2 != 0) return null;
        try {
            int key = Integer.parseInt(cfemail.substring(0, 2), 16);
            StringBuilder email = new StringBuilder();

            for (int n = 2; n < cfemail.length(); n += 2) {
                int c = Integer.parseInt(cfemail.substring(n, n + 2), 16) ^ key;
                email.append((char) c);
            }
            return email.toString();
        } catch (NumberFormatException e) {
            log.debug("CloudflareEmailDecoder: not hex: '{}'", cfemail);
            return null;
        }
    }
}
