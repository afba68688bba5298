package mirror.email.app.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mirror.email.app.config.MirrorProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Refresh-token grant against Google's token endpoint.
 */
@Slf4j
@Component
public class GoogleOAuthTokenClient implements OAuthTokenClient {
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String tokenEndpoint;
    private final String clientId;
    private final String clientSecret;

    public GoogleOAuthTokenClient(RestTemplateBuilder restTemplateBuilder,
                                  MirrorProperties properties,
                                  @Value("${spring.security.oauth2.client.registration.google.client-id:}") String clientId,
                                  @Value("${spring.security.oauth2.client.registration.google.client-secret:}") String clientSecret) {
        properties.validateTokenCallBudget();
        validateClientCredentials(clientId, clientSecret);
        MirrorProperties.Provider provider = properties.getProvider();
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(provider.getConnectTimeout())
            .setReadTimeout(provider.getReadTimeout())
            .build();
        this.objectMapper = new ObjectMapper();
        this.tokenEndpoint = provider.getTokenEndpoint();
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    private static void validateClientCredentials(String clientId, String clientSecret) {
        if (clientId == null || clientId.isEmpty() || clientId.startsWith("${")) {
            throw new IllegalStateException("Google OAuth client-id is not configured. Please set spring.security.oauth2.client.registration.google.client-id");
        }
        if (clientSecret == null || clientSecret.isEmpty() || clientSecret.startsWith("${")) {
            throw new IllegalStateException("Google OAuth client-secret is not configured. Please set spring.security.oauth2.client.registration.google.client-secret");
        }
    }

    @Override
    public ProviderResult<TokenGrant> refresh(String refreshToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(tokenEndpoint, new HttpEntity<>(body, headers), String.class);
            return parseGrant(response.getBody());
        } catch (HttpStatusCodeException e) {
            return classify(e);
        } catch (ResourceAccessException e) {
            log.warn("Token endpoint unreachable: {}", e.getMessage());
            return ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, "Token endpoint unreachable: " + e.getMessage());
        } catch (RestClientException e) {
            log.warn("Token refresh call failed: {}", e.getMessage());
            return ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, "Token refresh call failed: " + e.getMessage());
        }
    }

    private ProviderResult<TokenGrant> parseGrant(String responseBody) {
        if (responseBody == null) {
            return ProviderResult.failure(ErrorKind.MALFORMED_RESPONSE, "Token endpoint returned an empty body");
        }
        try {
            JsonNode json = objectMapper.readTree(responseBody);
            if (!json.hasNonNull("access_token")) {
                return ProviderResult.failure(ErrorKind.MALFORMED_RESPONSE, "Token refresh response missing access_token");
            }
            long expiresIn = json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : DEFAULT_EXPIRES_IN_SECONDS;
            String rotatedRefreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
            String scope = json.hasNonNull("scope") ? json.get("scope").asText() : null;
            return ProviderResult.ok(new TokenGrant(json.get("access_token").asText(), rotatedRefreshToken, expiresIn, scope));
        } catch (JsonProcessingException e) {
            return ProviderResult.failure(ErrorKind.MALFORMED_RESPONSE, "Token refresh response is not JSON: " + e.getOriginalMessage());
        }
    }

    private ProviderResult<TokenGrant> classify(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        String error = errorCode(e.getResponseBodyAsString());
        String message = "Token endpoint answered " + status + (error != null ? " (" + error + ")" : "");
        if (status == 429) {
            return ProviderResult.failure(ErrorKind.RATE_LIMITED, message);
        }
        if (status >= 500) {
            return ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, message);
        }
        // invalid_grant, invalid_client, unauthorized_client: none of them heal by retrying
        return ProviderResult.failure(ErrorKind.INVALID_GRANT, message);
    }

    private String errorCode(String responseBody) {
        if (responseBody == null || responseBody.isEmpty()) {
            return null;
        }
        try {
            JsonNode json = objectMapper.readTree(responseBody);
            return json.hasNonNull("error") ? json.get("error").asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
