package com.machina.provisioning.controller;

import com.machina.provisioning.dto.request.CreateProviderAccountRequest;
import com.machina.provisioning.dto.response.ProviderAccountResponse;
import com.machina.provisioning.dto.response.ProviderTypeResponse;
import com.machina.provisioning.entity.CredentialStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ConflictException;
import com.machina.provisioning.exception.GlobalExceptionHandler;
import com.machina.provisioning.exception.InvalidCredentialsException;
import com.machina.provisioning.exception.UnsupportedProviderException;
import com.machina.provisioning.provider.ImageOption;
import com.machina.provisioning.provider.ProviderOptions;
import com.machina.provisioning.provider.RegionOption;
import com.machina.provisioning.service.ProviderAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ProviderControllerTest {

    private static final UsernamePasswordAuthenticationToken USER = new UsernamePasswordAuthenticationToken(
        42L, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));

    @Mock
    private ProviderAccountService providerAccountService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ProviderController(providerAccountService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void listsProviderTypesWithSupportFlag() throws Exception {
        when(providerAccountService.listProviderTypes()).thenReturn(List.of(
            new ProviderTypeResponse(ProviderType.DIGITALOCEAN, "DigitalOcean", true),
            new ProviderTypeResponse(ProviderType.AWS, "Amazon Web Services", false)));

        mockMvc.perform(get("/api/providers").principal(USER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].type").value("digitalocean"))
            .andExpect(jsonPath("$.data[0].supported").value(true))
            .andExpect(jsonPath("$.data[1].display_name").value("Amazon Web Services"))
            .andExpect(jsonPath("$.data[1].supported").value(false));
    }

    @Test
    void optionsForKnownProvider() throws Exception {
        when(providerAccountService.getOptions(ProviderType.DIGITALOCEAN)).thenReturn(new ProviderOptions(
            ProviderType.DIGITALOCEAN,
            List.of(new RegionOption("nyc1", "New York 1")),
            List.of(),
            List.<ImageOption>of()));

        mockMvc.perform(get("/api/providers/digitalocean/options").principal(USER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.regions[0].slug").value("nyc1"));
    }

    @Test
    void optionsForUnknownProviderIsValidationError() throws Exception {
        mockMvc.perform(get("/api/providers/mainframe/options").principal(USER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void optionsForUnsupportedProviderIs501() throws Exception {
        when(providerAccountService.getOptions(ProviderType.AWS))
            .thenThrow(new UnsupportedProviderException(ProviderType.AWS, "list options"));

        mockMvc.perform(get("/api/providers/aws/options").principal(USER))
            .andExpect(status().isNotImplemented())
            .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_PROVIDER"));
    }

    @Test
    void createAccountNeverEchoesCredentials() throws Exception {
        UUID accountId = UUID.randomUUID();
        when(providerAccountService.createAccount(any(CreateProviderAccountRequest.class), eq(42L)))
            .thenReturn(new ProviderAccountResponse(accountId, ProviderType.DIGITALOCEAN, "Main",
                CredentialStatus.VALID, Instant.now(), Instant.now(), Instant.now()));

        mockMvc.perform(post("/api/providers/accounts")
                .principal(USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"provider_type": "digitalocean", "label": "Main",
                     "credentials": {"api_token": "dop_v1_secret_token_value"}}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.provider_account_id").value(accountId.toString()))
            .andExpect(jsonPath("$.data.credential_status").value("valid"))
            .andExpect(content().string(not(containsString("dop_v1_secret_token_value"))));
    }

    @Test
    void createAccountWithRejectedCredentials() throws Exception {
        when(providerAccountService.createAccount(any(CreateProviderAccountRequest.class), eq(42L)))
            .thenThrow(new InvalidCredentialsException("Token rejected by provider"));

        mockMvc.perform(post("/api/providers/accounts")
                .principal(USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"provider_type": "digitalocean", "label": "Main", "credentials": {"api_token": "bad-token-123"}}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void createAccountWithoutCredentialsIsValidationError() throws Exception {
        mockMvc.perform(post("/api/providers/accounts")
                .principal(USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"provider_type": "digitalocean", "label": "Main", "credentials": {}}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.field").value("credentials"));
    }

    @Test
    void deleteInUseAccountIsConflict() throws Exception {
        UUID accountId = UUID.randomUUID();
        doThrow(new ConflictException("Provider account is still used by machines"))
            .when(providerAccountService).deleteAccount(accountId, 42L);

        mockMvc.perform(delete("/api/providers/accounts/{id}", accountId).principal(USER))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error.code").value("CONFLICT"));
    }

    @Test
    void deleteUnusedAccountReturnsNoContent() throws Exception {
        UUID accountId = UUID.randomUUID();

        mockMvc.perform(delete("/api/providers/accounts/{id}", accountId).principal(USER))
            .andExpect(status().isNoContent());

        verify(providerAccountService).deleteAccount(accountId, 42L);
    }
}
