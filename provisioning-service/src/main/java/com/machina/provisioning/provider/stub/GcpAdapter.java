package com.machina.provisioning.provider.stub;

import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.provider.AbstractProviderAdapter;
import com.machina.provisioning.provider.ImageOption;
import com.machina.provisioning.provider.RegionOption;
import com.machina.provisioning.provider.SizeOption;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GcpAdapter extends AbstractProviderAdapter {

    public GcpAdapter() {
        super(
            ProviderType.GCP,
            List.of(
                new RegionOption("us-central1", "US Central (Iowa)", true,
                    List.of("us-central1-a", "us-central1-b", "us-central1-c", "us-central1-f")),
                new RegionOption("us-east1", "US East (South Carolina)", true,
                    List.of("us-east1-b", "us-east1-c", "us-east1-d"))
            ),
            List.of(
                new SizeOption("e2-micro", "e2-micro", 2, 1024, 10, null, null, true),
                new SizeOption("e2-small", "e2-small", 2, 2048, 10, null, null, true)
            ),
            List.of(ImageOption.base("ubuntu-2204-jammy", "Ubuntu 22.04 LTS", "Ubuntu", "22.04"))
        );
    }
}
