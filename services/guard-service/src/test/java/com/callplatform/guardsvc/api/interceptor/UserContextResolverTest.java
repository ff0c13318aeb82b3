package com.callplatform.guardsvc.api.interceptor;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.model.UserRole;
import com.callplatform.guardsvc.domain.ratelimit.IdentifierResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UserContextResolverTest {

    private static final String PROXY = "10.0.0.5";
    private static final String CLIENT_SOCKET = "203.0.113.77";

    private UserContextResolver resolver;

    @BeforeEach
    void setUp() {
        GuardProperties properties = new GuardProperties();
        properties.getOrchestration().setTrustedProxies(List.of("10.0.0.0/24", "127.0.0.1"));
        resolver = new UserContextResolver(properties);
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    private static MockHttpServletRequest requestFrom(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/catalog/items");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    @Nested
    @DisplayName("Untrusted peer")
    class UntrustedPeer {

        @Test
        void forwardingHeadersAreIgnored() {
            MockHttpServletRequest request = requestFrom(CLIENT_SOCKET);
            request.addHeader("X-NF-Client-Connection-IP", "10.77.0.1");
            request.addHeader("CF-Connecting-IP", "10.77.0.2");
            request.addHeader("X-Forwarded-For", "10.77.0.3");
            request.addHeader("X-Real-IP", "10.77.0.4");

            assertThat(resolver.resolve(request).ipAddress()).isEqualTo(CLIENT_SOCKET);
        }

        @Test
        void rotatingHeadersKeepOneIdentity() {
            Set<String> identifiers = new HashSet<>();
            for (int i = 0; i < 40; i++) {
                MockHttpServletRequest request = requestFrom(CLIENT_SOCKET);
                request.addHeader("X-NF-Client-Connection-IP", "10.77.0." + i);
                identifiers.add(IdentifierResolver.DEFAULT.resolve(resolver.resolve(request)));
            }

            assertThat(identifiers).containsExactly("ip:" + CLIENT_SOCKET);
        }
    }

    @Nested
    @DisplayName("Trusted proxy")
    class TrustedProxy {

        @Test
        void headersFollowPrecedenceOrder() {
            MockHttpServletRequest request = requestFrom(PROXY);
            request.addHeader("X-Forwarded-For", "198.51.100.3");
            request.addHeader("CF-Connecting-IP", "198.51.100.2");

            assertThat(resolver.resolve(request).ipAddress()).isEqualTo("198.51.100.2");

            request.addHeader("X-NF-Client-Connection-IP", "198.51.100.1");

            assertThat(resolver.resolve(request).ipAddress()).isEqualTo("198.51.100.1");
        }

        @Test
        void forwardedForTakesRightmostUntrustedHop() {
            MockHttpServletRequest request = requestFrom(PROXY);
            request.addHeader("X-Forwarded-For", "1.2.3.4, 198.51.100.9, 10.0.0.7");

            assertThat(resolver.resolve(request).ipAddress()).isEqualTo("198.51.100.9");
        }

        @Test
        void invalidHeaderValuesFallThrough() {
            MockHttpServletRequest request = requestFrom(PROXY);
            request.addHeader("CF-Connecting-IP", "not-an-ip");
            request.addHeader("X-Real-IP", "198.51.100.4");

            assertThat(resolver.resolve(request).ipAddress()).isEqualTo("198.51.100.4");
        }

        @Test
        void withoutHeadersTheProxyAddressIsUsed() {
            assertThat(resolver.resolve(requestFrom(PROXY)).ipAddress()).isEqualTo(PROXY);
        }

        @Test
        void cidrAndExactEntriesAreHonoured() {
            assertThat(resolver.isTrustedProxy("10.0.0.254")).isTrue();
            assertThat(resolver.isTrustedProxy("10.0.1.1")).isFalse();
            assertThat(resolver.isTrustedProxy("127.0.0.1")).isTrue();
            assertThat(resolver.isTrustedProxy(CLIENT_SOCKET)).isFalse();
        }

        @Test
        void nothingIsTrustedByDefault() {
            UserContextResolver defaults = new UserContextResolver(new GuardProperties());
            MockHttpServletRequest request = requestFrom("127.0.0.1");
            request.addHeader("X-Forwarded-For", "198.51.100.3");

            assertThat(defaults.resolve(request).ipAddress()).isEqualTo("127.0.0.1");
        }
    }

    @Nested
    @DisplayName("Principal")
    class Principal {

        @Test
        void anonymousCallerIsKeyedOnIp() {
            SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                    "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));
            MockHttpServletRequest request = requestFrom(CLIENT_SOCKET);
            request.addHeader("User-Agent", "Mozilla/5.0");

            UserContext context = resolver.resolve(request);

            assertThat(context.authenticated()).isFalse();
            assertThat(context.role()).isEqualTo(UserRole.ANONYMOUS);
            assertThat(context.userAgent()).isEqualTo("Mozilla/5.0");
            assertThat(IdentifierResolver.DEFAULT.resolve(context)).isEqualTo("ip:" + CLIENT_SOCKET);
        }

        @Test
        void authenticatedCallerGetsHighestKnownRole() {
            SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                    "user-42", null, AuthorityUtils.createAuthorityList("ROLE_BUYER", "ROLE_SUPPLIER", "ROLE_AUDITOR")));

            UserContext context = resolver.resolve(requestFrom(CLIENT_SOCKET));

            assertThat(context.authenticated()).isTrue();
            assertThat(context.role()).isEqualTo(UserRole.SUPPLIER);
            assertThat(IdentifierResolver.DEFAULT.resolve(context)).isEqualTo("user:user-42");
        }

        @Test
        void authenticatedCallerWithoutKnownRoleIsBuyer() {
            SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                    "user-7", null, AuthorityUtils.createAuthorityList("ROLE_AUDITOR")));

            assertThat(resolver.resolve(requestFrom(CLIENT_SOCKET)).role()).isEqualTo(UserRole.BUYER);
        }
    }
}
