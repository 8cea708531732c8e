package com.machina.provisioning.provider.digitalocean;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.exception.ProviderException;
import com.machina.provisioning.exception.ProviderUnavailableException;
import com.machina.provisioning.provider.CredentialValidation;
import com.machina.provisioning.provider.FirewallRule;
import com.machina.provisioning.provider.ObservedResource;
import com.machina.provisioning.provider.ResourceSpec;
import com.machina.provisioning.provider.credentials.DigitalOceanCredentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DigitalOceanAdapterTest {

    private static final String BASE = "https://do.test";
    private static final DigitalOceanCredentials CREDENTIALS = new DigitalOceanCredentials("dop_v1_abc");

    private MockRestServiceServer server;
    private DigitalOceanAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        adapter = new DigitalOceanAdapter(restTemplate, new ObjectMapper(), BASE + "/");
    }

    @Test
    void validTokenIsAccepted() {
        server.expect(requestTo(BASE + "/v2/account"))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header("Authorization", "Bearer dop_v1_abc"))
            .andRespond(withSuccess("{\"account\":{\"status\":\"active\"}}", MediaType.APPLICATION_JSON));

        CredentialValidation result = adapter.validateCredentials(CREDENTIALS);

        assertThat(result.valid()).isTrue();
        server.verify();
    }

    @Test
    void rejectedTokenIsAnInvalidResult() {
        server.expect(requestTo(BASE + "/v2/account"))
            .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        CredentialValidation result = adapter.validateCredentials(CREDENTIALS);

        assertThat(result.valid()).isFalse();
        assertThat(result.message()).contains("invalid or expired");
    }

    @Test
    void serverErrorIsUnavailable() {
        server.expect(requestTo(BASE + "/v2/account"))
            .andRespond(withServerError());

        assertThatThrownBy(() -> adapter.validateCredentials(CREDENTIALS))
            .isInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void describeResourcesFollowsPagination() {
        server.expect(requestTo(BASE + "/v2/droplets?per_page=200&page=1"))
            .andRespond(withSuccess("""
                {"droplets": [%s], "links": {"pages": {"next": "%s/v2/droplets?page=2"}}}
                """.formatted(droplet(1, "active", "203.0.113.1"), BASE), MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v2/droplets?per_page=200&page=2"))
            .andRespond(withSuccess("""
                {"droplets": [%s], "links": {}}
                """.formatted(droplet(2, "off", "203.0.113.2")), MediaType.APPLICATION_JSON));

        Map<String, ObservedResource> resources = adapter.describeResources(CREDENTIALS);

        assertThat(resources).containsOnlyKeys("1", "2");
        assertThat(resources.get("1").status()).isEqualTo(MachineStatus.RUNNING);
        assertThat(resources.get("1").publicIp()).isEqualTo("203.0.113.1");
        assertThat(resources.get("1").privateIp()).isEqualTo("10.0.0.1");
        assertThat(resources.get("2").status()).isEqualTo(MachineStatus.STOPPED);
        assertThat(resources.get("2").region()).isEqualTo("nyc1");
        server.verify();
    }

    @Test
    void missingDropletIsEmpty() {
        server.expect(requestTo(BASE + "/v2/droplets/404"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        Optional<ObservedResource> resource = adapter.describeResource(CREDENTIALS, "404");

        assertThat(resource).isEmpty();
    }

    @Test
    void destroyOfMissingDropletSucceeds() {
        server.expect(requestTo(BASE + "/v2/droplets/77"))
            .andExpect(method(HttpMethod.DELETE))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        adapter.destroyResource(CREDENTIALS, "77");

        server.verify();
    }

    @Test
    void createPostsDropletWithFormattedTags() {
        server.expect(requestTo(BASE + "/v2/droplets"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer dop_v1_abc"))
            .andExpect(jsonPath("$.name").value("web-1"))
            .andExpect(jsonPath("$.size").value("s-1vcpu-1gb"))
            .andExpect(jsonPath("$.ssh_keys[0]").value("ab:cd:ef"))
            .andExpect(jsonPath("$.tags.length()").value(2))
            .andExpect(jsonPath("$.tags[0]").value("env:prod"))
            .andExpect(jsonPath("$.tags[1]").value("team:core"))
            .andExpect(jsonPath("$.user_data").doesNotExist())
            .andRespond(withSuccess("{\"droplet\": " + droplet(501, "new", "203.0.113.50") + "}",
                MediaType.APPLICATION_JSON));

        ObservedResource created = adapter.createResource(CREDENTIALS, ResourceSpec.builder()
            .machineId(UUID.randomUUID())
            .name("web-1")
            .region("nyc1")
            .size("s-1vcpu-1gb")
            .image("ubuntu-22-04-x64")
            .sshKeyIds(List.of("ab:cd:ef"))
            .tags(Map.of("team", "core", "env", "prod"))
            .userData("   ")
            .build());

        assertThat(created.resourceId()).isEqualTo("501");
        assertThat(created.status()).isEqualTo(MachineStatus.PROVISIONING);
        server.verify();
    }

    @Test
    void createSendsUserDataWhenPresent() {
        server.expect(requestTo(BASE + "/v2/droplets"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.user_data").value("#cloud-config\npackages: [nginx]"))
            .andExpect(jsonPath("$.tags").isEmpty())
            .andRespond(withSuccess("{\"droplet\": " + droplet(502, "new", "203.0.113.51") + "}",
                MediaType.APPLICATION_JSON));

        adapter.createResource(CREDENTIALS, ResourceSpec.builder()
            .machineId(UUID.randomUUID())
            .name("web-2")
            .region("nyc1")
            .size("s-1vcpu-1gb")
            .image("ubuntu-22-04-x64")
            .userData("#cloud-config\npackages: [nginx]")
            .build());

        server.verify();
    }

    @Test
    void rebootPostsAction() {
        server.expect(requestTo(BASE + "/v2/droplets/77/actions"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.type").value("reboot"))
            .andRespond(withSuccess("{\"action\":{\"status\":\"in-progress\"}}", MediaType.APPLICATION_JSON));

        adapter.rebootResource(CREDENTIALS, "77");

        server.verify();
    }

    @Test
    void clientErrorKeepsUpstreamStatus() {
        server.expect(requestTo(BASE + "/v2/droplets/77/actions"))
            .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

        assertThatThrownBy(() -> adapter.rebootResource(CREDENTIALS, "77"))
            .isInstanceOf(ProviderException.class)
            .satisfies(e -> assertThat(((ProviderException) e).getStatusCode()).isEqualTo(422));
    }

    @Test
    void statusTableNormalizesUnknownToError() {
        assertThat(DigitalOceanAdapter.normalizeStatus("new")).isEqualTo(MachineStatus.PROVISIONING);
        assertThat(DigitalOceanAdapter.normalizeStatus("ACTIVE")).isEqualTo(MachineStatus.RUNNING);
        assertThat(DigitalOceanAdapter.normalizeStatus("archive")).isEqualTo(MachineStatus.TERMINATED);
        assertThat(DigitalOceanAdapter.normalizeStatus("migrating")).isEqualTo(MachineStatus.ERROR);
        assertThat(DigitalOceanAdapter.normalizeStatus(null)).isEqualTo(MachineStatus.ERROR);
    }

    @Test
    void terraformVariablesDefaultToSshOnlyFirewall() {
        UUID machineId = UUID.randomUUID();
        ResourceSpec spec = ResourceSpec.builder()
            .machineId(machineId)
            .name("web-1")
            .region("nyc1")
            .size("s-1vcpu-1gb")
            .image("ubuntu-22-04-x64")
            .tags(Map.of("team", "core", "env", "prod"))
            .firewallEnabled(true)
            .build();

        Map<String, Object> vars = adapter.terraformVariables(CREDENTIALS, spec);

        assertThat(vars).containsEntry("do_token", "dop_v1_abc")
            .containsEntry("machine_id", machineId.toString())
            .containsEntry("tags", List.of("env:prod", "team:core"))
            .containsEntry("user_data", "")
            .containsEntry("firewall_enabled", true);
        assertThat((List<?>) vars.get("firewall_inbound_rules")).singleElement()
            .satisfies(rule -> assertThat((Map<String, Object>) rule).containsEntry("port_range",
                FirewallRule.SSH_FROM_ANYWHERE.portRange()));
    }

    private static String droplet(int id, String status, String publicIp) {
        return """
            {"id": %d, "status": "%s", "size_slug": "s-1vcpu-1gb", "region": {"slug": "nyc1"},
             "networks": {"v4": [
               {"type": "private", "ip_address": "10.0.0.%d"},
               {"type": "public", "ip_address": "%s"}
             ]}}
            """.formatted(id, status, id, publicIp);
    }
}
