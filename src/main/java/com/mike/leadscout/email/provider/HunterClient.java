package com.mike.leadscout.email.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.leadscout.config.ProviderProperties;
import com.mike.leadscout.resilience.HttpErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Hunter domain search (addresses known for a domain) and single-address verifier.
 */
@Component
@Slf4j
public class HunterClient implements ContactIntelligenceProvider, EmailVerificationProvider {

    public static final String NAME = "hunter";

    private final ProviderProperties.Endpoint props;
    private final RestClient restClient;

    public HunterClient(ProviderProperties providers) {
        this.props = providers.getHunter();
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
        JsonNode response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/domain-search")
                        .queryParam("domain", domain)
                        .queryParam("limit", 10)
                        .queryParam("api_key", props.getApiKey())
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(NAME))
                .body(JsonNode.class);

        List<ProviderHit> generic = new ArrayList<>();
        List<ProviderHit> personal = new ArrayList<>();
        if (response == null) return generic;

        for (JsonNode e : response.path("data").path("emails")) {
            String email = e.path("value").asText(null);
            if (email == null || email.isBlank()) continue;
            double confidence = e.path("confidence").asDouble(0) / 100.0;
            boolean verified = "valid".equalsIgnoreCase(e.path("verification").path("status").asText(""));
            ProviderHit hit = new ProviderHit(email.toLowerCase(Locale.ROOT), confidence, NAME, verified);
            if ("generic".equalsIgnoreCase(e.path("type").asText(""))) {
                generic.add(hit);
            } else {
                personal.add(hit);
            }
        }
        List<ProviderHit> hits = new ArrayList<>(generic);
        hits.addAll(personal);
        log.info("HunterClient: {} -> {} addresses", domain, hits.size());
        return hits;
    }

    @Override
    public VerificationVerdict verify(String email) {
        JsonNode response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/email-verifier")
                        .queryParam("email", email)
                        .queryParam("api_key", props.getApiKey())
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(NAME))
                .body(JsonNode.class);

        if (response == null || response.path("data").isMissingNode()) return null;

        JsonNode data = response.path("data");
        String status = data.path("status").asText("unknown").toLowerCase(Locale.ROOT);
        double confidence = data.path("score").asDouble(0) / 100.0;

        VerificationVerdict.Status mapped = VerificationVerdict.Status.UNKNOWN;
        if ("valid".equals(status)) {
            mapped = VerificationVerdict.Status.VALID;
        } else if ("accept_all".equals(status)) {
            mapped = VerificationVerdict.Status.CATCH_ALL;
        } else if ("invalid".equals(status) || "disposable".equals(status)) {
            mapped = VerificationVerdict.Status.INVALID;
        }
        return new VerificationVerdict(email, mapped, confidence, NAME);
    }
}
