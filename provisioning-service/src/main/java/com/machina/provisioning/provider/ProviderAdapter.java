package com.machina.provisioning.provider;

import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.provider.credentials.ProviderCredentials;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One capability surface per cloud provider.
 *
 * Implementations are pure with respect to local state: they never write machines,
 * deployments or credential status.
 */
public interface ProviderAdapter {

    ProviderType providerType();

    /**
     * Whether lifecycle operations are implemented. Unsupported adapters still serve their catalog.
     */
    boolean isSupported();

    List<RegionOption> listRegions();

    List<SizeOption> listSizes();

    List<ImageOption> listImages();

    default ProviderOptions options() {
        return new ProviderOptions(providerType(), listRegions(), listSizes(), listImages());
    }

    /**
     * Check the credentials against the provider. Rejected credentials are a normal
     * result, not an exception; only transport or upstream failures throw.
     */
    CredentialValidation validateCredentials(ProviderCredentials credentials);

    ObservedResource createResource(ProviderCredentials credentials, ResourceSpec spec);

    /**
     * Destroy a resource. A resource that is already gone counts as destroyed.
     */
    void destroyResource(ProviderCredentials credentials, String resourceId);

    /**
     * Observed state of one resource; empty when the provider no longer knows it.
     */
    Optional<ObservedResource> describeResource(ProviderCredentials credentials, String resourceId);

    /**
     * Observed state of every resource visible to the credentials, keyed by resource id.
     */
    Map<String, ObservedResource> describeResources(ProviderCredentials credentials);

    void rebootResource(ProviderCredentials credentials, String resourceId);

    /**
     * Normalize a raw provider status, as reported by the Terraform module's status output.
     */
    MachineStatus mapStatus(String providerStatus);

    /**
     * Name of the Terraform module directory under the module root.
     */
    String terraformModule();

    /**
     * Input variables for {@link #terraformModule()}. The variable names are the module's stable contract.
     */
    Map<String, Object> terraformVariables(ProviderCredentials credentials, ResourceSpec spec);
}
