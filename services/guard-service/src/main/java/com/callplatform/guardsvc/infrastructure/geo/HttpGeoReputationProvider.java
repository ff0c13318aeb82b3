package com.callplatform.guardsvc.infrastructure.geo;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * GeoIP insights client (MaxMind web-service JSON layout) behind a circuit breaker.
 */
@Component
public class HttpGeoReputationProvider implements GeoReputationProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpGeoReputationProvider.class);

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String baseUrl;
    private final String accountId;
    private final String licenseKey;

    public HttpGeoReputationProvider(
            RestTemplate guardRestTemplate,
            CircuitBreakerRegistry circuitBreakerRegistry,
            @Value("${app.platform.geoip.base-url:https://geoip.maxmind.com/geoip/v2.1}") String baseUrl,
            @Value("${app.platform.geoip.account-id:}") String accountId,
            @Value("${app.platform.geoip.license-key:}") String licenseKey) {
        this.restTemplate = guardRestTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("geoProvider");
        this.baseUrl = baseUrl;
        this.accountId = accountId;
        this.licenseKey = licenseKey;
    }

    @Override
    public GeoLookupResult lookup(String ipAddress) {
        if (accountId.isBlank() || licenseKey.isBlank()) {
            throw new GeoLookupException("GeoIP credentials are not configured");
        }
        try {
            JsonNode body = circuitBreaker.executeSupplier(() -> fetchInsights(ipAddress));
            if (body == null || body.isMissingNode()) {
                throw new GeoLookupException("Empty GeoIP response");
            }
            return parse(ipAddress, body);
        } catch (CallNotPermittedException e) {
            throw new GeoLookupException("GeoIP circuit open", e);
        } catch (RestClientException e) {
            log.debug("GeoIP lookup failed: {}", e.getMessage());
            throw new GeoLookupException("GeoIP lookup failed: " + e.getMessage(), e);
        }
    }

    private JsonNode fetchInsights(String ipAddress) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(accountId, licenseKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        ResponseEntity<JsonNode> response = restTemplate.exchange(
                baseUrl + "/insights/{ip}", HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class, ipAddress);
        return response.getBody();
    }

    static GeoLookupResult parse(String ipAddress, JsonNode body) {
        JsonNode country = body.path("country");
        JsonNode traits = body.path("traits");
        JsonNode location = body.path("location");
        return new GeoLookupResult(
                ipAddress,
                textOrNull(country.path("names").path("en")),
                textOrNull(country.path("iso_code")),
                textOrNull(body.path("city").path("names").path("en")),
                traits.hasNonNull("risk_score") ? traits.get("risk_score").asDouble() : null,
                traits.path("is_anonymous_proxy").asBoolean(false) || traits.path("is_anonymous").asBoolean(false),
                traits.path("is_tor_exit_node").asBoolean(false),
                traits.path("is_anonymous_vpn").asBoolean(false),
                traits.path("is_satellite_provider").asBoolean(false),
                textOrNull(traits.path("user_type")),
                location.hasNonNull("accuracy_radius") ? location.get("accuracy_radius").asInt() : null);
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
