package com.machina.provisioning.provider.stub;

import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.provider.AbstractProviderAdapter;
import com.machina.provisioning.provider.ImageOption;
import com.machina.provisioning.provider.RegionOption;
import com.machina.provisioning.provider.SizeOption;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HetznerAdapter extends AbstractProviderAdapter {

    public HetznerAdapter() {
        super(
            ProviderType.HETZNER,
            List.of(
                new RegionOption("fsn1", "Falkenstein"),
                new RegionOption("nbg1", "Nuremberg"),
                new RegionOption("hel1", "Helsinki")
            ),
            List.of(
                SizeOption.monthly("cx11", "CX11", 1, 2048, 20, 3.29),
                SizeOption.monthly("cx21", "CX21", 2, 4096, 40, 5.83)
            ),
            List.of(ImageOption.base("ubuntu-22.04", "Ubuntu 22.04", "Ubuntu", "22.04"))
        );
    }
}
