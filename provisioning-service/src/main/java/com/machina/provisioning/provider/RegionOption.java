package com.machina.provisioning.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RegionOption(String slug, String name, boolean available, List<String> zones) {

    public RegionOption(String slug, String name) {
        this(slug, name, true, List.of());
    }
}
