package com.machina.provisioning.provider;

import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.UnsupportedProviderException;
import com.machina.provisioning.provider.credentials.ProviderCredentials;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Serves a static catalog and reports every lifecycle operation as unsupported.
 * Fully implemented providers override the operations they support.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    private final ProviderType providerType;
    private final List<RegionOption> regions;
    private final List<SizeOption> sizes;
    private final List<ImageOption> images;

    protected AbstractProviderAdapter(
        ProviderType providerType,
        List<RegionOption> regions,
        List<SizeOption> sizes,
        List<ImageOption> images
    ) {
        this.providerType = providerType;
        this.regions = List.copyOf(regions);
        this.sizes = List.copyOf(sizes);
        this.images = List.copyOf(images);
    }

    @Override
    public ProviderType providerType() {
        return providerType;
    }

    @Override
    public boolean isSupported() {
        return false;
    }

    @Override
    public List<RegionOption> listRegions() {
        return regions;
    }

    @Override
    public List<SizeOption> listSizes() {
        return sizes;
    }

    @Override
    public List<ImageOption> listImages() {
        return images;
    }

    @Override
    public CredentialValidation validateCredentials(ProviderCredentials credentials) {
        throw unsupported("credential validation");
    }

    @Override
    public ObservedResource createResource(ProviderCredentials credentials, ResourceSpec spec) {
        throw unsupported("resource creation");
    }

    @Override
    public void destroyResource(ProviderCredentials credentials, String resourceId) {
        throw unsupported("resource destruction");
    }

    @Override
    public Optional<ObservedResource> describeResource(ProviderCredentials credentials, String resourceId) {
        throw unsupported("resource inspection");
    }

    @Override
    public Map<String, ObservedResource> describeResources(ProviderCredentials credentials) {
        throw unsupported("resource inspection");
    }

    @Override
    public void rebootResource(ProviderCredentials credentials, String resourceId) {
        throw unsupported("reboot");
    }

    @Override
    public MachineStatus mapStatus(String providerStatus) {
        return MachineStatus.ERROR;
    }

    @Override
    public String terraformModule() {
        throw unsupported("Terraform provisioning");
    }

    @Override
    public Map<String, Object> terraformVariables(ProviderCredentials credentials, ResourceSpec spec) {
        throw unsupported("Terraform provisioning");
    }

    protected UnsupportedProviderException unsupported(String operation) {
        return new UnsupportedProviderException(providerType, operation);
    }
}
