package com.mike.leadscout.email.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.leadscout.config.ProviderProperties;
import com.mike.leadscout.resilience.HttpErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Domain registration lookup. Contacts are returned in record order:
 * registrant, administrative, technical, then the top-level contact email.
 */
@Component
@Slf4j
public class WhoisXmlClient {

    public static final String NAME = "whoisxml";

    private static final String[] CONTACT_NODES = {"registrant", "administrativeContact", "technicalContact"};

    private final ProviderProperties.Endpoint props;
    private final RestClient restClient;

    public WhoisXmlClient(ProviderProperties providers) {
        this.props = providers.getWhoisxml();
        this.restClient = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .build();
    }

    public boolean isEnabled() {
        return props.isConfigured();
    }

    public List<DomainContact> lookup(String domain) {
        JsonNode response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/WhoisService")
                        .queryParam("apiKey", props.getApiKey())
                        .queryParam("domainName", domain)
                        .queryParam("outputFormat", "JSON")
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(NAME))
                .body(JsonNode.class);

        if (response == null) return List.of();
        return parse(response);
    }

    static List<DomainContact> parse(JsonNode response) {
        JsonNode record = response.path("WhoisRecord");
        Set<String> seen = new LinkedHashSet<>();
        List<DomainContact> contacts = new ArrayList<>();

        for (JsonNode root : List.of(record, record.path("registryData"))) {
            for (String node : CONTACT_NODES) {
                add(contacts, seen, root.path(node).path("email").asText(null), node);
            }
            add(contacts, seen, root.path("contactEmail").asText(null), "contact");
        }
        log.debug("WhoisXmlClient: parsed {} contacts", contacts.size());
        return contacts;
    }

    private static void add(List<DomainContact> out, Set<String> seen, String email, String role) {
        if (email == null || email.isBlank()) return;
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (seen.add(normalized)) {
            out.add(new DomainContact(normalized, role));
        }
    }
}
