package edu.harvard.hms.dbmi.avillach.uploader.upload.api.rest;

import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiConnectionException;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSession;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSettings;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.SampleServiceApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST implementation of the sample service. Logs in with the OAuth2 password grant and hands
 * out sessions that send the bearer token on every request.
 */
public class SampleServiceRestClient implements SampleServiceApi {
    private static final Logger log = LoggerFactory.getLogger(SampleServiceRestClient.class);

    static final String TOKEN_PATH = "/api/oauth/token";

    private final WebClient.Builder webClientBuilder;

    public SampleServiceRestClient(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
    }

    @Override
    public ApiSession connect(ApiSettings settings) throws ApiConnectionException {
        log.info("Requesting access token from {} for {}", settings.baseUrl(), settings.username());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "password");
        form.add("client_id", settings.clientId());
        if (settings.clientSecret() != null) {
            form.add("client_secret", settings.clientSecret());
        }
        form.add("username", settings.username());
        form.add("password", settings.password());

        WebClient anonymous = webClientBuilder.clone().baseUrl(settings.baseUrl()).build();
        TokenResponse token = RestCalls.block(anonymous.post()
                .uri(TOKEN_PATH)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(TokenResponse.class),
            settings.timeout(), "requesting an access token");

        if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
            throw new ApiConnectionException("Sample service at " + settings.baseUrl() + " returned no access token");
        }

        WebClient authorized = webClientBuilder.clone()
            .baseUrl(settings.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token.accessToken())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
        log.info("Connected to {}", settings.baseUrl());
        return new RestApiSession(authorized, settings.timeout());
    }
}
