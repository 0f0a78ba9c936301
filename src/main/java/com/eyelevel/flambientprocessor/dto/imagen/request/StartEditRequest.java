package com.eyelevel.flambientprocessor.dto.imagen.request;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body that submits a project for AI editing with a given profile. Unset optional values
 * are left out of the body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StartEditRequest(
        @JsonProperty("profile_key")
        String profileKey,

        @JsonProperty("crop")
        boolean crop,

        @JsonProperty("portrait_crop")
        boolean portraitCrop,

        @JsonProperty("headshot_crop")
        boolean headshotCrop,

        @JsonProperty("crop_aspect_ratio")
        String cropAspectRatio,

        @JsonProperty("hdr_merge")
        boolean hdrMerge,

        @JsonProperty("straighten")
        boolean straighten,

        @JsonProperty("subject_mask")
        boolean subjectMask,

        @JsonProperty("photography_type")
        String photographyType,

        @JsonProperty("callback_url")
        String callbackUrl,

        @JsonProperty("smooth_skin")
        boolean smoothSkin,

        @JsonProperty("perspective_correction")
        boolean perspectiveCorrection,

        @JsonProperty("window_pull")
        boolean windowPull,

        @JsonProperty("sky_replacement")
        boolean skyReplacement,

        @JsonProperty("sky_replacement_template_id")
        Integer skyReplacementTemplateId,

        @JsonProperty("hdr_output_compression")
        String hdrOutputCompression
) {

    public static StartEditRequest of(String profileKey, EditOptions options) {
        PhotographyType type = options.getPhotographyType();
        return new StartEditRequest(profileKey, options.isCrop(), options.isPortraitCrop(), options.isHeadshotCrop(),
                                    options.getCropAspectRatio(), options.isHdrMerge(), options.isStraighten(),
                                    options.isSubjectMask(), type == null ? null : type.name(),
                                    options.getCallbackUrl(), options.isSmoothSkin(),
                                    options.isPerspectiveCorrection(), options.isWindowPull(),
                                    options.isSkyReplacement(), options.getSkyReplacementTemplateId(),
                                    options.getHdrOutputCompression());
    }
}
