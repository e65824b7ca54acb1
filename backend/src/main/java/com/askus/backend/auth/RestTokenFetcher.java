package com.askus.backend.auth;

import com.askus.backend.util.ExternalCallException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts a client-credentials grant to a token endpoint.
 */
public class RestTokenFetcher implements TokenFetcher {

    private final RestClient rest;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;

    public RestTokenFetcher(RestClient rest, String tokenUrl, String clientId, String clientSecret, String scope) {
        this.rest = rest;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.scope = scope;
    }

    @Override
    public IssuedToken fetch() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        if (scope != null && !scope.isBlank()) form.add("scope", scope);

        JsonNode node;
        try {
            node = rest.post()
                    .uri(tokenUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ExternalCallException("oauth", "token request failed: " + e.getMessage(), e);
        }

        if (node == null) throw new ExternalCallException("oauth", "empty token response");
        return new IssuedToken(node.path("access_token").asText(null), node.path("expires_in").asLong(0));
    }
}
