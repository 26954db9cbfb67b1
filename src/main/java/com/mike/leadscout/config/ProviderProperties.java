package com.mike.leadscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "leadscout.providers")
public class ProviderProperties {

    private Endpoint hunter = new Endpoint("https://api.hunter.io/v2");
    private Endpoint apollo = new Endpoint("https://api.apollo.io/v1");
    private Endpoint zerobounce = new Endpoint("https://api.zerobounce.net/v2");
    private Endpoint neverbounce = new Endpoint("https://api.neverbounce.com/v4");
    private Endpoint whoisxml = new Endpoint("https://www.whoisxmlapi.com/whoisserver");

    @Data
    public static class Endpoint {
        /**
         * Blank key = provider disabled.
         */
        private String apiKey = "";
        private String baseUrl;

        public Endpoint() {
        }

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
