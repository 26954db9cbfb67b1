package com.mike.leadscout.email.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.leadscout.config.ProviderProperties;
import com.mike.leadscout.resilience.HttpErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Apollo people search restricted to the business domain.
 */
@Component
@Slf4j
public class ApolloClient implements ContactIntelligenceProvider {

    public static final String NAME = "apollo";

    static final double VERIFIED_CONFIDENCE = 0.95;
    static final double UNVERIFIED_CONFIDENCE = 0.85;

    private final ProviderProperties.Endpoint props;
    private final RestClient restClient;

    public ApolloClient(ProviderProperties providers) {
        this.props = providers.getApollo();
        this.restClient = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public List<ProviderHit> search(String domain) {
        JsonNode response = restClient.post()
                .uri("/mixed_people/search")
                .header("X-Api-Key", props.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("q_organization_domains", domain, "page", 1, "per_page", 10))
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(NAME))
                .body(JsonNode.class);

        List<ProviderHit> hits = new ArrayList<>();
        if (response == null) return hits;

        for (JsonNode person : response.path("people")) {
            String email = person.path("email").asText(null);
            if (email == null || email.isBlank() || email.startsWith("email_not_unlocked")) continue;
            if (!email.toLowerCase(Locale.ROOT).endsWith("@" + domain)) continue;
            boolean verified = "verified".equalsIgnoreCase(person.path("email_status").asText(""));
            hits.add(new ProviderHit(email.toLowerCase(Locale.ROOT),
                    verified ? VERIFIED_CONFIDENCE : UNVERIFIED_CONFIDENCE, NAME, verified));
        }
        log.info("ApolloClient: {} -> {} addresses", domain, hits.size());
        return hits;
    }
}
