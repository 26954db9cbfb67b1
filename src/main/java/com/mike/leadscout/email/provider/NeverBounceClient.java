package com.mike.leadscout.email.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.leadscout.config.ProviderProperties;
import com.mike.leadscout.resilience.HttpErrors;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Locale;

@Component
public class NeverBounceClient implements EmailVerificationProvider {

    public static final String NAME = "neverbounce";

    private final ProviderProperties.Endpoint props;
    private final RestClient restClient;

    public NeverBounceClient(ProviderProperties providers) {
        this.props = providers.getNeverbounce();
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
                        .path("/single/check")
                        .queryParam("key", props.getApiKey())
                        .queryParam("email", email)
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpErrors.raise(NAME))
                .body(JsonNode.class);

        if (response == null || !"success".equalsIgnoreCase(response.path("status").asText())) return null;
        return map(email, response.path("result").asText());
    }

    static VerificationVerdict map(String email, String rawResult) {
        String result = rawResult == null ? "" : rawResult.toLowerCase(Locale.ROOT);
        if ("valid".equals(result)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.VALID, 0.98, NAME);
        }
        if ("catchall".equals(result)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.CATCH_ALL, 0.70, NAME);
        }
        if ("invalid".equals(result)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.INVALID, 0.05, NAME);
        }
        if ("disposable".equals(result)) {
            return new VerificationVerdict(email, VerificationVerdict.Status.INVALID, 0.10, NAME);
        }
        return new VerificationVerdict(email, VerificationVerdict.Status.UNKNOWN, 0.60, NAME);
    }
}
