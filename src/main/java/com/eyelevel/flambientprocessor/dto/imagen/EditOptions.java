package com.eyelevel.flambientprocessor.dto.imagen;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The AI edit toggles chosen for a job, usually from a configured preset. Stored with the job so a
 * resumed run reissues the same edit.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EditOptions {

    @Builder.Default
    boolean crop = false;
    @Builder.Default
    boolean portraitCrop = false;
    @Builder.Default
    boolean headshotCrop = false;
    String cropAspectRatio;
    @Builder.Default
    boolean hdrMerge = false;
    @Builder.Default
    boolean straighten = false;
    @Builder.Default
    boolean subjectMask = false;
    PhotographyType photographyType;
    String callbackUrl;
    @Builder.Default
    boolean smoothSkin = false;
    @Builder.Default
    boolean perspectiveCorrection = false;
    @Builder.Default
    boolean windowPull = true;
    @Builder.Default
    boolean skyReplacement = false;
    Integer skyReplacementTemplateId;
    @Builder.Default
    String hdrOutputCompression = "LOSSY";

    public static EditOptions defaults() {
        return EditOptions.builder().build();
    }
}
