package com.machina.provisioning.provider.digitalocean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ProviderException;
import com.machina.provisioning.exception.ProviderUnavailableException;
import com.machina.provisioning.exception.ValidationException;
import com.machina.provisioning.provider.AbstractProviderAdapter;
import com.machina.provisioning.provider.CredentialValidation;
import com.machina.provisioning.provider.FirewallRule;
import com.machina.provisioning.provider.ImageOption;
import com.machina.provisioning.provider.ObservedResource;
import com.machina.provisioning.provider.RegionOption;
import com.machina.provisioning.provider.ResourceSpec;
import com.machina.provisioning.provider.SizeOption;
import com.machina.provisioning.provider.credentials.DigitalOceanCredentials;
import com.machina.provisioning.provider.credentials.ProviderCredentials;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * DigitalOcean droplets through the v2 REST API.
 *
 * Resilience Strategy:
 * - Retry + circuit breaker on {@link ProviderUnavailableException} only (5xx, timeouts)
 * - 4xx responses surface as {@link ProviderException} with the upstream status and are not retried
 * - Rejected tokens (401/403) on validation are a normal invalid result
 */
@Component
@Slf4j
public class DigitalOceanAdapter extends AbstractProviderAdapter {

    static final String TERRAFORM_MODULE = "digitalocean";
    private static final int PAGE_SIZE = 200;

    /**
     * Droplet status → normalized machine status. Anything not listed maps to ERROR.
     */
    static final Map<String, MachineStatus> STATUS_TABLE = Map.of(
        "new", MachineStatus.PROVISIONING,
        "active", MachineStatus.RUNNING,
        "off", MachineStatus.STOPPED,
        "archive", MachineStatus.TERMINATED
    );

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;

    public DigitalOceanAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        @Value("${digitalocean.api-base-url:https://api.digitalocean.com}") String apiBaseUrl
    ) {
        super(ProviderType.DIGITALOCEAN, REGIONS, SIZES, IMAGES);
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
    }

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public MachineStatus mapStatus(String providerStatus) {
        return normalizeStatus(providerStatus);
    }

    public static MachineStatus normalizeStatus(String dropletStatus) {
        if (dropletStatus == null) {
            return MachineStatus.ERROR;
        }
        return STATUS_TABLE.getOrDefault(dropletStatus.toLowerCase(), MachineStatus.ERROR);
    }

    /**
     * Test endpoint: GET /v2/account. 401/403 means the token is invalid or expired.
     */
    @Override
    @Retry(name = "providerApi")
    @CircuitBreaker(name = "providerApi", fallbackMethod = "validateFallback")
    public CredentialValidation validateCredentials(ProviderCredentials credentials) {
        String token = token(credentials);
        try {
            JsonNode body = get(token, "/v2/account");
            String status = body.path("account").path("status").asText("active");
            log.info("DigitalOcean credential check succeeded (account status: {})", status);
            return CredentialValidation.valid("Connected successfully to DigitalOcean");
        } catch (ProviderException e) {
            if (e.getStatusCode() == HttpStatus.UNAUTHORIZED.value()
                || e.getStatusCode() == HttpStatus.FORBIDDEN.value()) {
                log.warn("DigitalOcean rejected credentials: status={}", e.getStatusCode());
                return CredentialValidation.invalid("DigitalOcean API token is invalid or expired");
            }
            throw e;
        }
    }

    @Override
    @Retry(name = "providerApi")
    @CircuitBreaker(name = "providerApi")
    public ObservedResource createResource(ProviderCredentials credentials, ResourceSpec spec) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", spec.name());
        body.put("region", spec.region());
        body.put("size", spec.size());
        body.put("image", spec.image());
        body.put("ssh_keys", spec.sshKeyIds());
        body.put("tags", formatTags(spec.tags()));
        if (spec.userData() != null && !spec.userData().isBlank()) {
            body.put("user_data", spec.userData());
        }
        JsonNode response = exchange(token(credentials), HttpMethod.POST, "/v2/droplets", body);
        log.info("Created droplet for machine {}", spec.machineId());
        return toObserved(response.path("droplet"));
    }

    @Override
    @Retry(name = "providerApi")
    @CircuitBreaker(name = "providerApi")
    public void destroyResource(ProviderCredentials credentials, String resourceId) {
        try {
            exchange(token(credentials), HttpMethod.DELETE, "/v2/droplets/" + resourceId, null);
            log.info("Destroyed droplet {}", resourceId);
        } catch (ProviderException e) {
            if (e.getStatusCode() != HttpStatus.NOT_FOUND.value()) {
                throw e;
            }
            log.info("Droplet {} already gone", resourceId);
        }
    }

    @Override
    @Retry(name = "providerApi")
    @CircuitBreaker(name = "providerApi", fallbackMethod = "describeFallback")
    public Optional<ObservedResource> describeResource(ProviderCredentials credentials, String resourceId) {
        try {
            JsonNode body = get(token(credentials), "/v2/droplets/" + resourceId);
            return Optional.of(toObserved(body.path("droplet")));
        } catch (ProviderException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    @Retry(name = "providerApi")
    @CircuitBreaker(name = "providerApi", fallbackMethod = "describeAllFallback")
    public Map<String, ObservedResource> describeResources(ProviderCredentials credentials) {
        String token = token(credentials);
        Map<String, ObservedResource> result = new HashMap<>();
        int page = 1;
        while (true) {
            JsonNode body = get(token, "/v2/droplets?per_page=" + PAGE_SIZE + "&page=" + page);
            for (JsonNode droplet : body.path("droplets")) {
                ObservedResource observed = toObserved(droplet);
                result.put(observed.resourceId(), observed);
            }
            if (body.path("links").path("pages").path("next").isMissingNode()) {
                return result;
            }
            page++;
        }
    }

    @Override
    @Retry(name = "providerApi")
    @CircuitBreaker(name = "providerApi", fallbackMethod = "rebootFallback")
    public void rebootResource(ProviderCredentials credentials, String resourceId) {
        exchange(token(credentials), HttpMethod.POST, "/v2/droplets/" + resourceId + "/actions",
            Map.of("type", "reboot"));
        log.info("Reboot requested for droplet {}", resourceId);
    }

    @Override
    public String terraformModule() {
        return TERRAFORM_MODULE;
    }

    @Override
    public Map<String, Object> terraformVariables(ProviderCredentials credentials, ResourceSpec spec) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("do_token", token(credentials));
        vars.put("name", spec.name());
        vars.put("machine_id", spec.machineId().toString());
        vars.put("region", spec.region());
        vars.put("size", spec.size());
        vars.put("image", spec.image());
        vars.put("ssh_keys", spec.sshKeyIds());
        vars.put("tags", formatTags(spec.tags()));
        vars.put("user_data", spec.userData() == null ? "" : spec.userData());
        vars.put("firewall_enabled", spec.firewallEnabled());

        List<Map<String, Object>> rules = new ArrayList<>();
        for (FirewallRule rule : spec.effectiveFirewallRules()) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("protocol", rule.protocol());
            r.put("port_range", rule.portRange());
            r.put("source_addresses", rule.sourceAddresses());
            rules.add(r);
        }
        vars.put("firewall_inbound_rules", rules);
        return vars;
    }

    private CredentialValidation validateFallback(ProviderCredentials credentials, CallNotPermittedException ex) {
        throw circuitOpen(ex);
    }

    private Optional<ObservedResource> describeFallback(
        ProviderCredentials credentials, String resourceId, CallNotPermittedException ex) {
        throw circuitOpen(ex);
    }

    private Map<String, ObservedResource> describeAllFallback(
        ProviderCredentials credentials, CallNotPermittedException ex) {
        throw circuitOpen(ex);
    }

    private void rebootFallback(ProviderCredentials credentials, String resourceId, CallNotPermittedException ex) {
        throw circuitOpen(ex);
    }

    private ProviderUnavailableException circuitOpen(CallNotPermittedException ex) {
        log.warn("DigitalOcean circuit breaker open, failing fast");
        return new ProviderUnavailableException("DigitalOcean API temporarily unavailable", 0, ex);
    }

    private static List<String> formatTags(Map<String, String> tags) {
        List<String> formatted = new ArrayList<>();
        tags.forEach((k, v) -> formatted.add(k + ":" + v));
        formatted.sort(String::compareTo);
        return formatted;
    }

    private ObservedResource toObserved(JsonNode droplet) {
        String publicIp = null;
        String privateIp = null;
        for (JsonNode network : droplet.path("networks").path("v4")) {
            String type = network.path("type").asText();
            if ("public".equals(type) && publicIp == null) {
                publicIp = network.path("ip_address").asText(null);
            } else if ("private".equals(type) && privateIp == null) {
                privateIp = network.path("ip_address").asText(null);
            }
        }
        String rawStatus = droplet.path("status").asText(null);
        return new ObservedResource(
            droplet.path("id").asText(),
            normalizeStatus(rawStatus),
            rawStatus,
            publicIp,
            privateIp,
            droplet.path("region").path("slug").asText(null),
            droplet.path("size_slug").asText(null)
        );
    }

    private String token(ProviderCredentials credentials) {
        if (!(credentials instanceof DigitalOceanCredentials doCredentials)) {
            throw new ValidationException("DigitalOcean requires DigitalOcean credentials", "credentials");
        }
        return doCredentials.apiToken();
    }

    private JsonNode get(String token, String path) {
        return exchange(token, HttpMethod.GET, path, null);
    }

    private JsonNode exchange(String token, HttpMethod method, String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Object> request = new HttpEntity<>(body, headers);

        ResponseEntity<String> response = call(method, path,
            () -> restTemplate.exchange(apiBaseUrl + path, method, request, String.class));
        String payload = response.getBody();
        if (payload == null || payload.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unreadable DigitalOcean response for " + method + " " + stripQuery(path),
                response.getStatusCode().value(), e);
        }
    }

    private ResponseEntity<String> call(HttpMethod method, String path, Supplier<ResponseEntity<String>> request) {
        String endpoint = method + " " + stripQuery(path);
        try {
            return request.get();
        } catch (HttpClientErrorException e) {
            log.warn("DigitalOcean {} failed: status={}", endpoint, e.getStatusCode().value());
            throw new ProviderException("DigitalOcean " + endpoint + " failed with " + e.getStatusCode().value(),
                e.getStatusCode().value(), e);
        } catch (HttpServerErrorException e) {
            log.error("DigitalOcean {} server error: status={}", endpoint, e.getStatusCode().value());
            throw new ProviderUnavailableException(
                "DigitalOcean " + endpoint + " failed with " + e.getStatusCode().value(),
                e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.error("DigitalOcean {} timeout or connection error: {}", endpoint, e.getMessage());
            throw new ProviderUnavailableException("DigitalOcean " + endpoint + " unreachable", 0, e);
        }
    }

    private static String stripQuery(String path) {
        int q = path.indexOf('?');
        return q < 0 ? path : path.substring(0, q);
    }

    private static final List<RegionOption> REGIONS = List.of(
        new RegionOption("nyc1", "New York 1"),
        new RegionOption("nyc3", "New York 3"),
        new RegionOption("sfo3", "San Francisco 3"),
        new RegionOption("ams3", "Amsterdam 3"),
        new RegionOption("sgp1", "Singapore 1"),
        new RegionOption("lon1", "London 1"),
        new RegionOption("fra1", "Frankfurt 1"),
        new RegionOption("tor1", "Toronto 1"),
        new RegionOption("blr1", "Bangalore 1")
    );

    private static final List<SizeOption> SIZES = List.of(
        SizeOption.monthly("s-1vcpu-1gb", "Basic 1GB", 1, 1024, 25, 6),
        SizeOption.monthly("s-1vcpu-2gb", "Basic 2GB", 1, 2048, 50, 12),
        SizeOption.monthly("s-2vcpu-4gb", "Basic 4GB", 2, 4096, 80, 24),
        SizeOption.monthly("s-4vcpu-8gb", "Basic 8GB", 4, 8192, 160, 48),
        SizeOption.monthly("s-8vcpu-16gb", "Basic 16GB", 8, 16384, 320, 96),
        SizeOption.monthly("c-2", "CPU-Optimized 2 vCPU", 2, 4096, 25, 42),
        SizeOption.monthly("c-4", "CPU-Optimized 4 vCPU", 4, 8192, 50, 84),
        SizeOption.monthly("m-2vcpu-16gb", "Memory-Optimized 16GB", 2, 16384, 50, 84)
    );

    private static final List<ImageOption> IMAGES = List.of(
        ImageOption.base("ubuntu-22-04-x64", "Ubuntu 22.04 (LTS) x64", "Ubuntu", "22.04"),
        ImageOption.base("ubuntu-24-04-x64", "Ubuntu 24.04 (LTS) x64", "Ubuntu", "24.04"),
        ImageOption.base("debian-12-x64", "Debian 12 x64", "Debian", "12"),
        ImageOption.base("centos-stream-9-x64", "CentOS Stream 9 x64", "CentOS", "Stream 9"),
        ImageOption.base("fedora-39-x64", "Fedora 39 x64", "Fedora", "39"),
        ImageOption.base("rockylinux-9-x64", "Rocky Linux 9 x64", "Rocky Linux", "9")
    );
}
