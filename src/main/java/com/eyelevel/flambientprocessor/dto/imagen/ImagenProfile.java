package com.eyelevel.flambientprocessor.dto.imagen;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An editing profile (a trained editing style) available to the account.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImagenProfile(
        @JsonProperty("profile_key")
        String key,

        @JsonProperty("profile_name")
        String name,

        @JsonProperty("profile_type")
        String profileType,

        @JsonProperty("image_type")
        String imageType,

        @JsonProperty("photography_type")
        String photographyType
) {
}
