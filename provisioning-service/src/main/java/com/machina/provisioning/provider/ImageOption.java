package com.machina.provisioning.provider;

public record ImageOption(
    String slug,
    String name,
    String distribution,
    String version,
    String type,
    boolean available
) {

    public static ImageOption base(String slug, String name, String distribution, String version) {
        return new ImageOption(slug, name, distribution, version, "base", true);
    }
}
