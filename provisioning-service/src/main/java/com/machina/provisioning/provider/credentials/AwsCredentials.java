package com.machina.provisioning.provider.credentials;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ValidationException;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AwsCredentials(
    String accessKeyId,
    String secretAccessKey,
    String region,
    String assumeRoleArn
) implements ProviderCredentials {

    private static final String DEFAULT_REGION = "us-east-1";

    @Override
    public ProviderType providerType() {
        return ProviderType.AWS;
    }

    @Override
    public AwsCredentials validated() {
        if (accessKeyId == null || accessKeyId.isBlank()) {
            throw new ValidationException("access_key_id is required for AWS", "credentials.access_key_id");
        }
        if (secretAccessKey == null || secretAccessKey.isBlank()) {
            throw new ValidationException("secret_access_key is required for AWS", "credentials.secret_access_key");
        }
        return new AwsCredentials(
            accessKeyId.trim(),
            secretAccessKey.trim(),
            region == null || region.isBlank() ? DEFAULT_REGION : region.trim(),
            assumeRoleArn
        );
    }

    @Override
    public String toString() {
        return "AwsCredentials[accessKeyId=" + ProviderCredentials.mask(accessKeyId)
            + ", region=" + region + "]";
    }
}
