package com.machina.provisioning.provider.stub;

import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.provider.AbstractProviderAdapter;
import com.machina.provisioning.provider.ImageOption;
import com.machina.provisioning.provider.RegionOption;
import com.machina.provisioning.provider.SizeOption;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Catalog only; EC2 lifecycle is not implemented.
 */
@Component
public class AwsAdapter extends AbstractProviderAdapter {

    public AwsAdapter() {
        super(
            ProviderType.AWS,
            List.of(
                new RegionOption("us-east-1", "US East (N. Virginia)", true,
                    List.of("us-east-1a", "us-east-1b", "us-east-1c", "us-east-1d", "us-east-1e", "us-east-1f")),
                new RegionOption("us-east-2", "US East (Ohio)", true, List.of("us-east-2a", "us-east-2b", "us-east-2c")),
                new RegionOption("us-west-1", "US West (N. California)", true, List.of("us-west-1a", "us-west-1b")),
                new RegionOption("us-west-2", "US West (Oregon)", true,
                    List.of("us-west-2a", "us-west-2b", "us-west-2c", "us-west-2d")),
                new RegionOption("eu-west-1", "EU (Ireland)", true, List.of("eu-west-1a", "eu-west-1b", "eu-west-1c")),
                new RegionOption("eu-central-1", "EU (Frankfurt)", true,
                    List.of("eu-central-1a", "eu-central-1b", "eu-central-1c")),
                new RegionOption("ap-northeast-1", "Asia Pacific (Tokyo)", true,
                    List.of("ap-northeast-1a", "ap-northeast-1c", "ap-northeast-1d"))
            ),
            List.of(
                SizeOption.hourly("t3.micro", "t3.micro (2 vCPU, 1GB)", 2, 1024, 8, 0.0104),
                SizeOption.hourly("t3.small", "t3.small (2 vCPU, 2GB)", 2, 2048, 8, 0.0208),
                SizeOption.hourly("t3.medium", "t3.medium (2 vCPU, 4GB)", 2, 4096, 8, 0.0416),
                SizeOption.hourly("t3.large", "t3.large (2 vCPU, 8GB)", 2, 8192, 8, 0.0832),
                SizeOption.hourly("m5.large", "m5.large (2 vCPU, 8GB)", 2, 8192, 8, 0.096),
                SizeOption.hourly("c5.large", "c5.large (2 vCPU, 4GB)", 2, 4096, 8, 0.085)
            ),
            List.of(
                ImageOption.base("ami-0c55b159cbfafe1f0", "Amazon Linux 2023", "Amazon Linux", "2023"),
                ImageOption.base("ami-ubuntu-22-04", "Ubuntu 22.04 LTS", "Ubuntu", "22.04"),
                ImageOption.base("ami-ubuntu-24-04", "Ubuntu 24.04 LTS", "Ubuntu", "24.04"),
                ImageOption.base("ami-debian-12", "Debian 12", "Debian", "12")
            )
        );
    }
}
