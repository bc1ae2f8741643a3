package com.vcfops.service.core.config;

import com.vcfops.core.model.IntervalType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code vcf-operations} configuration tree.
 *
 * <pre>{@code
 * vcf-operations:
 *   auth-scheme: Bearer
 *   http:
 *     read-timeout: 30s
 *   instances:
 *     - name: vcfo-1
 *       base-url: https://vcfo-1.example.com
 *       major-version: 9
 *       related-instance-names: [vcfa-1]
 *       authentication:
 *         username: admin
 *         password: secret
 * }</pre>
 *
 * <p>The first entry of {@code instances} is the default instance.
 */
@Component
@ConfigurationProperties(prefix = "vcf-operations")
public class VcfOperationsProperties {
    private boolean enabled = true;
    private String authScheme = "Bearer";
    private Http http = new Http();
    private List<Interval> intervals = defaultIntervals();
    private IntervalType fallbackIntervalType = IntervalType.DAYS;
    private Map<String, KindProfile> kindProfiles = defaultKindProfiles();
    private List<Instance> instances = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAuthScheme() {
        return authScheme;
    }

    public void setAuthScheme(String authScheme) {
        this.authScheme = authScheme;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public List<Interval> getIntervals() {
        return intervals;
    }

    public void setIntervals(List<Interval> intervals) {
        this.intervals = intervals;
    }

    public IntervalType getFallbackIntervalType() {
        return fallbackIntervalType;
    }

    public void setFallbackIntervalType(IntervalType fallbackIntervalType) {
        this.fallbackIntervalType = fallbackIntervalType;
    }

    public Map<String, KindProfile> getKindProfiles() {
        return kindProfiles;
    }

    public void setKindProfiles(Map<String, KindProfile> kindProfiles) {
        this.kindProfiles = kindProfiles;
    }

    public List<Instance> getInstances() {
        return instances;
    }

    public void setInstances(List<Instance> instances) {
        this.instances = instances;
    }

    static List<Interval> defaultIntervals() {
        List<Interval> out = new ArrayList<>();
        out.add(new Interval(Duration.ofHours(6), 5, IntervalType.MINUTES));
        out.add(new Interval(Duration.ofHours(24), 15, IntervalType.MINUTES));
        out.add(new Interval(Duration.ofDays(7), null, IntervalType.HOURS));
        return out;
    }

    static Map<String, KindProfile> defaultKindProfiles() {
        Map<String, KindProfile> out = new LinkedHashMap<>();
        out.put("project", new KindProfile(List.of("VCFAutomation"), List.of("ProjectAssignment")));
        out.put("cluster", new KindProfile(List.of("VMWARE"), List.of("ClusterComputeResource")));
        out.put("supervisor-namespace", new KindProfile(List.of("VMWARE"), List.of("ResourcePool")));
        out.put("vm", new KindProfile(List.of("VMWARE"), List.of("VirtualMachine")));
        return out;
    }

    public static class Http {
        /** {@code okhttp} or {@code jdk}. */
        private String client = "okhttp";

        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ofSeconds(60);

        public String getClient() {
            return client;
        }

        public void setClient(String client) {
            this.client = client;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }
    }

    /** One row of the span-to-granularity table; spans up to and including {@code maxSpan} match. */
    public static class Interval {
        private Duration maxSpan;
        private Integer quantifier;
        private IntervalType type;

        public Interval() {}

        public Interval(Duration maxSpan, Integer quantifier, IntervalType type) {
            this.maxSpan = maxSpan;
            this.quantifier = quantifier;
            this.type = type;
        }

        public Duration getMaxSpan() {
            return maxSpan;
        }

        public void setMaxSpan(Duration maxSpan) {
            this.maxSpan = maxSpan;
        }

        public Integer getQuantifier() {
            return quantifier;
        }

        public void setQuantifier(Integer quantifier) {
            this.quantifier = quantifier;
        }

        public IntervalType getType() {
            return type;
        }

        public void setType(IntervalType type) {
            this.type = type;
        }
    }

    public static class KindProfile {
        private List<String> adapterKinds = new ArrayList<>();
        private List<String> resourceKinds = new ArrayList<>();

        public KindProfile() {}

        public KindProfile(List<String> adapterKinds, List<String> resourceKinds) {
            this.adapterKinds = new ArrayList<>(adapterKinds);
            this.resourceKinds = new ArrayList<>(resourceKinds);
        }

        public List<String> getAdapterKinds() {
            return adapterKinds;
        }

        public void setAdapterKinds(List<String> adapterKinds) {
            this.adapterKinds = adapterKinds;
        }

        public List<String> getResourceKinds() {
            return resourceKinds;
        }

        public void setResourceKinds(List<String> resourceKinds) {
            this.resourceKinds = resourceKinds;
        }
    }

    public static class Instance {
        private String name;
        private String baseUrl;
        private Integer majorVersion;
        private List<String> relatedInstanceNames = new ArrayList<>();
        private Authentication authentication;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Integer getMajorVersion() {
            return majorVersion;
        }

        public void setMajorVersion(Integer majorVersion) {
            this.majorVersion = majorVersion;
        }

        public List<String> getRelatedInstanceNames() {
            return relatedInstanceNames;
        }

        public void setRelatedInstanceNames(List<String> relatedInstanceNames) {
            this.relatedInstanceNames = relatedInstanceNames;
        }

        public Authentication getAuthentication() {
            return authentication;
        }

        public void setAuthentication(Authentication authentication) {
            this.authentication = authentication;
        }
    }

    public static class Authentication {
        private String username;
        private String password;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
