package com.machina.provisioning.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SizeOption(
    String slug,
    String name,
    int vcpus,
    int memoryMb,
    int diskGb,
    Double priceMonthly,
    Double priceHourly,
    boolean available
) {

    public static SizeOption monthly(String slug, String name, int vcpus, int memoryMb, int diskGb, double price) {
        return new SizeOption(slug, name, vcpus, memoryMb, diskGb, price, null, true);
    }

    public static SizeOption hourly(String slug, String name, int vcpus, int memoryMb, int diskGb, double price) {
        return new SizeOption(slug, name, vcpus, memoryMb, diskGb, null, price, true);
    }
}
