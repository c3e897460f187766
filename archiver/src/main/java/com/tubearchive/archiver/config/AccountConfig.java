package com.tubearchive.archiver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A playlist-source account. The token path points at a previously
 * authorized credential file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountConfig(
        @JsonProperty("token") String token
) {
}
