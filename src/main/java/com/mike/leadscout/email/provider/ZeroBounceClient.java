package com.mike.leadscout.email.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.leadscout.config.ProviderProperties;
import com.mike.leadscout.resilience.HttpErrors;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Locale;

@Component
public class ZeroBounceClient implements EmailVerificationProvider {

    public static final String NAME = "zerobounce";

    private final ProviderProperties.Endpoint props;
    private final RestClient restClient;

    public ZeroBounceClient(ProviderProperties providers) {
        this.props = providers.getZerobounce();
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
    public VerificationVerdict verify(String email) {
        JsonNode response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/validate")
                        .queryParam("api_key", props.getApiKey())
                        .queryParam("email", email)
                        .queryParam("ip_address", "")
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(NAME))
                .body(JsonNode.class);

        if (response == null || !response.hasNonNull("status")) return null;
        return map(email, response.path("status").asText());
    }

    static VerificationVerdict map(String email, String rawStatus) {
        String status = rawStatus == null ? "" : rawStatus.toLowerCase(Locale.ROOT);
        if ("valid".equals(status)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.VALID, 0.98, NAME);
        }
        if ("catch-all".equals(status)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.CATCH_ALL, 0.70, NAME);
        }
        if ("invalid".equals(status) || "spamtrap".equals(status) || "abuse".equals(status) || "do_not_mail".equals(status)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.INVALID, 0.05, NAME);
        }
        return new VerificationVerdict(email, VerificationVerdict.Status.UNKNOWN, 0.55, NAME);
    }
}
