package com.callplatform.guardsvc.infrastructure.geo;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpGeoReputationProviderTest {

    private static final String BASE_URL = "http://geo.test/v2.1";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private HttpGeoReputationProvider provider(String accountId, String licenseKey) {
        return new HttpGeoReputationProvider(
                restTemplate, CircuitBreakerRegistry.ofDefaults(), BASE_URL, accountId, licenseKey);
    }

    @Test
    void mapsInsightsResponse() {
        server.expect(requestTo(BASE_URL + "/insights/81.2.69.142"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Basic YWNjdDpzZWNyZXQ="))
                .andRespond(withSuccess("""
                        {
                          "country": {"iso_code": "GB", "names": {"en": "United Kingdom"}},
                          "city": {"names": {"en": "London"}},
                          "location": {"accuracy_radius": 100},
                          "traits": {
                            "risk_score": 3.5,
                            "is_anonymous": true,
                            "is_tor_exit_node": true,
                            "user_type": "hosting"
                          }
                        }
                        """, MediaType.APPLICATION_JSON));

        GeoLookupResult result = provider("acct", "secret").lookup("81.2.69.142");

        server.verify();
        assertThat(result.country()).isEqualTo("United Kingdom");
        assertThat(result.countryCode()).isEqualTo("GB");
        assertThat(result.city()).isEqualTo("London");
        assertThat(result.providerRisk()).isEqualTo(3.5);
        assertThat(result.anonymousProxy()).isTrue();
        assertThat(result.torExitNode()).isTrue();
        assertThat(result.anonymousVpn()).isFalse();
        assertThat(result.userType()).isEqualTo("hosting");
        assertThat(result.accuracyRadiusKm()).isEqualTo(100);
    }

    @Test
    void sparseResponseLeavesFieldsEmpty() {
        server.expect(requestTo(BASE_URL + "/insights/8.8.8.8"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        GeoLookupResult result = provider("acct", "secret").lookup("8.8.8.8");

        assertThat(result.ipAddress()).isEqualTo("8.8.8.8");
        assertThat(result.countryCode()).isNull();
        assertThat(result.providerRisk()).isNull();
        assertThat(result.accuracyRadiusKm()).isNull();
        assertThat(result.torExitNode()).isFalse();
    }

    @Test
    void serverErrorBecomesLookupFailure() {
        server.expect(requestTo(BASE_URL + "/insights/8.8.8.8")).andRespond(withServerError());

        assertThatThrownBy(() -> provider("acct", "secret").lookup("8.8.8.8"))
                .isInstanceOf(GeoLookupException.class)
                .hasMessageStartingWith("GeoIP lookup failed");
    }

    @Test
    void missingCredentialsFailWithoutCalling() {
        assertThatThrownBy(() -> provider("", "").lookup("8.8.8.8"))
                .isInstanceOf(GeoLookupException.class)
                .hasMessageContaining("not configured");

        server.verify();
    }
}
