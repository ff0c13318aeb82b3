package com.callplatform.guardsvc.config;

import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.callplatform.guardsvc.domain.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for every guard engine, bound from {@code app.guard.*}. Defaults mirror production.
 */
@Data
@ConfigurationProperties(prefix = "app.guard")
public class GuardProperties {

    private RateLimit rateLimit = new RateLimit();
    private Geo geo = new Geo();
    private Behavior behavior = new Behavior();
    private Captcha captcha = new Captcha();
    private Bypass bypass = new Bypass();
    private Ddos ddos = new Ddos();
    private Blocking blocking = new Blocking();
    private Orchestration orchestration = new Orchestration();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tier {
        private String name;
        private long windowMs;
        private int maxRequests;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EndpointTier {
        private String path;
        /** Null for overrides that apply to every role. */
        private UserRole role;
        private String name;
        private long windowMs;
        private int maxRequests;
    }

    @Data
    public static class RateLimit {
        private Tier globalDefault = new Tier("default", 60_000, 60);
        private Map<UserRole, Tier> roles = defaultRoleTiers();
        private List<EndpointTier> sensitiveEndpoints = new ArrayList<>(List.of(
                new EndpointTier("/auth/login", null, "auth-login", 15 * 60_000, 5),
                new EndpointTier("/auth/register", null, "auth-register", 60 * 60_000, 3),
                new EndpointTier("/auth/forgot-password", null, "auth-password-reset", 60 * 60_000, 3),
                new EndpointTier("/auth/reset-password", null, "auth-password-reset", 60 * 60_000, 3)
        ));
        private List<EndpointTier> endpointOverrides = new ArrayList<>();
        private Duration suspiciousIpTtl = Duration.ofHours(24);

        private static Map<UserRole, Tier> defaultRoleTiers() {
            Map<UserRole, Tier> tiers = new EnumMap<>(UserRole.class);
            tiers.put(UserRole.ANONYMOUS, new Tier("anonymous", 60_000, 10));
            tiers.put(UserRole.BUYER, new Tier("buyer", 60_000, 120));
            tiers.put(UserRole.SUPPLIER, new Tier("supplier", 60_000, 180));
            tiers.put(UserRole.ADMIN, new Tier("admin", 60_000, 300));
            return tiers;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GeoRule {
        private String id;
        private String type = "block";
        private List<String> countries = new ArrayList<>();
        private ThreatLevel maxThreatLevel;
        private int priority;
        private boolean enabled = true;
    }

    @Data
    public static class Geo {
        private Duration cacheTtl = Duration.ofHours(24);
        private Duration highThreatCacheTtl = Duration.ofHours(1);
        private Duration localCacheTtl = Duration.ofMinutes(5);
        private Duration rulesCacheTtl = Duration.ofSeconds(60);
        private List<String> highRiskCountries = new ArrayList<>(List.of("CN", "RU", "KP", "IR"));
        private List<GeoRule> defaultRules = new ArrayList<>();
    }

    @Data
    public static class Behavior {
        private Duration retention = Duration.ofHours(1);
        private int maxEvents = 1000;
        private Duration burstWindow = Duration.ofSeconds(30);
        private int burstThreshold = 30;
        private int regularMinSamples = 10;
        private double regularCvThreshold = 0.1;
        private int errorMinSamples = 20;
        private double errorRateThreshold = 0.7;
        private int scanDistinctEndpoints = 20;
        private List<String> authEndpoints = new ArrayList<>(List.of(
                "/auth/login", "/auth/signin", "/auth/token", "/login"));
        private int credentialFailureThreshold = 5;
        private int sessionIpThreshold = 3;
        private Duration scoreTtl = Duration.ofMinutes(5);
        private Duration suspiciousIpTtl = Duration.ofHours(24);
        private Weights weights = new Weights();
    }

    @Data
    public static class Weights {
        private double burstActivity = 0.30;
        private double regularIntervals = 0.30;
        private double errorRate = 0.25;
        private double endpointScanning = 0.25;
        private double credentialStuffing = 0.40;
        private double sessionAnomalies = 0.20;
    }

    @Data
    public static class Captcha {
        private Duration challengeTtl = Duration.ofMinutes(10);
        private int maxAttempts = 3;
        private int scoreThreshold = 60;
        private int requestRateThreshold = 30;
        private List<UserRole> trustedRoles = new ArrayList<>(List.of(UserRole.ADMIN));
        private Duration verifiedPassTtl = Duration.ofMinutes(15);
        private Duration failureWindow = Duration.ofHours(1);
        private int failureThreshold = 3;
        /** Challenges one IP may request per issue window. */
        private int issueLimit = 10;
        private Duration issueWindow = Duration.ofMinutes(10);
        private String siteKey = "";
    }

    @Data
    public static class Bypass {
        private List<String> honeypotHeaders = new ArrayList<>(List.of(
                "x-bypass-rate-limit", "x-rate-limit-bypass", "x-ratelimit-bypass",
                "x-skip-rate-limit", "x-admin-override", "x-debug-bypass"));
        private int ipRotationThreshold = 5;
        private int userAgentRotationThreshold = 10;
        private Duration trackingWindow = Duration.ofHours(1);
        private double honeypotPenalty = 5.0;
        private double headerInconsistencyPenalty = 3.0;
        private double ipRotationPenalty = 2.0;
        private double userAgentRotationPenalty = 1.5;
        private Duration auditRetention = Duration.ofDays(7);
        private int maxReportedAttempts = 500;
    }

    @Data
    public static class Ddos {
        private boolean enabled = false;
        private int lowThreshold = 100;
        private int mediumThreshold = 200;
        private int highThreshold = 500;
        private int criticalThreshold = 1000;
        private int lowAndSlowRequests = 2000;
        private int lowAndSlowMaxUniqueIps = 10;
    }

    @Data
    public static class Blocking {
        private Duration temporaryDuration = Duration.ofHours(24);
        private int autoBlockThreshold = 85;
    }

    @Data
    public static class Orchestration {
        private List<String> skipMethods = new ArrayList<>(List.of("OPTIONS"));
        private List<String> skipPaths = new ArrayList<>(List.of("/actuator", "/api/v1/captcha", "/v3/api-docs", "/swagger-ui"));
        private boolean geoBlockingEnabled = true;
        private boolean bypassProtectionEnabled = true;
        private boolean behavioralAnalysisEnabled = true;
        private int captchaTotalRequestsThreshold = 50;
        /** Rethrow malformed-input errors instead of failing open. */
        private boolean strictInput = false;
        /**
         * Addresses or IPv4 CIDR blocks of the edge proxies allowed to name the client in
         * forwarding headers. Requests from any other peer are keyed on the socket address.
         */
        private List<String> trustedProxies = new ArrayList<>();
    }
}
