package com.machina.provisioning.provider.stub;

import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.provider.AbstractProviderAdapter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bring-your-own servers have no catalog and no provider API.
 */
@Component
public class BareMetalAdapter extends AbstractProviderAdapter {

    public BareMetalAdapter() {
        super(ProviderType.BAREMETAL, List.of(), List.of(), List.of());
    }
}
