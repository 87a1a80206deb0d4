package io.simmy.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebToolsConfig(
    @JsonAlias({"max_chars"}) int maxChars,
    @JsonAlias({"allow_private_addresses"}) boolean allowPrivateAddresses
) {

    public static WebToolsConfig defaults() {
        return new WebToolsConfig(15_000, false);
    }
}
