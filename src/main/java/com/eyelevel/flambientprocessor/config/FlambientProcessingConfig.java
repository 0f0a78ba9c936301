package com.eyelevel.flambientprocessor.config;

import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.eyelevel.flambientprocessor.dto.imagen.PhotographyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. Every group carries working defaults so the tool runs with an empty
 * configuration apart from the remote API key.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class FlambientProcessingConfig {

    public static final String FLAMBIENT_REAL_ESTATE = "flambient_real_estate";

    private Exif exif = new Exif();
    private ImageMagick imagemagick = new ImageMagick();
    private Imagen imagen = new Imagen();
    private Workflow workflow = new Workflow();

    @Data
    public static class RetryConfig {
        private int attempts = 3;
        private long delayMs = 1000;
        private double multiplier = 2.0;
        private long maxDelayMs = 30_000;
    }

    @Data
    public static class Exif {
        private String binary = "exiftool";
        private long timeoutMinutes = 5;
        private List<String> extensions = List.of("jpg", "JPG");
    }

    @Data
    public static class ImageMagick {
        private String binary = "magick";
        private String levelLow = "40%";
        private String levelHigh = "140%";
        private double gamma = 1.0;
        private String outputPrefix = "flambient";
        private boolean enableDarkenExport = false;
        private String darkenSuffix = "_tmp";
        private long timeoutMinutes = 30;
    }

    @Data
    public static class Imagen {
        private String defaultProfileKey = "309406";
        private long pollIntervalSeconds = 30;
        private int pollMaxAttempts = 240;
        private long exportPollIntervalSeconds = 10;
        private int exportPollMaxAttempts = 180;
        private long exportLinkRetryDelaySeconds = 10;
        private int transferConcurrency = 3;
        private long transferTimeoutSeconds = 300;
        private long requestTimeoutSeconds = 30;
        /**
         * Remote progress (percent) between two persisted checkpoints while the edit runs.
         */
        private int processingCheckpointStep = 10;
        private RetryConfig retry = new RetryConfig();
        /**
         * Preset applied when {@code --preset} is not given.
         */
        private String defaultPreset = FLAMBIENT_REAL_ESTATE;
        private Map<String, EditPreset> presets = new LinkedHashMap<>(Map.of(FLAMBIENT_REAL_ESTATE,
                                                                             EditPreset.flambientRealEstate()));
    }

    /**
     * A named set of edit toggles. Unset toggles take the same defaults as {@link EditOptions}.
     */
    @Data
    public static class EditPreset {
        private String name;
        private String description;
        private PhotographyType photographyType;
        private boolean crop;
        private boolean portraitCrop;
        private boolean headshotCrop;
        private String cropAspectRatio;
        private boolean hdrMerge;
        private boolean straighten;
        private boolean subjectMask;
        private String callbackUrl;
        private boolean smoothSkin;
        private boolean perspectiveCorrection;
        private boolean windowPull = true;
        private boolean skyReplacement;
        private Integer skyReplacementTemplateId;
        private String hdrOutputCompression = "LOSSY";

        static EditPreset flambientRealEstate() {
            EditPreset preset = new EditPreset();
            preset.setName("Flambient Real Estate (Window Pull)");
            preset.setDescription("Optimized for flambient blended images with window detail recovery");
            preset.setPhotographyType(PhotographyType.REAL_ESTATE);
            return preset;
        }

        public EditOptions toEditOptions() {
            return EditOptions.builder()
                              .crop(crop)
                              .portraitCrop(portraitCrop)
                              .headshotCrop(headshotCrop)
                              .cropAspectRatio(cropAspectRatio)
                              .hdrMerge(hdrMerge)
                              .straighten(straighten)
                              .subjectMask(subjectMask)
                              .photographyType(photographyType)
                              .callbackUrl(callbackUrl)
                              .smoothSkin(smoothSkin)
                              .perspectiveCorrection(perspectiveCorrection)
                              .windowPull(windowPull)
                              .skyReplacement(skyReplacement)
                              .skyReplacementTemplateId(skyReplacementTemplateId)
                              .hdrOutputCompression(hdrOutputCompression)
                              .build();
        }
    }

    @Data
    public static class Workflow {
        /**
         * Extensions (case-insensitive) picked up as job input when no pattern is given.
         */
        private List<String> imagePatterns = List.of("jpg", "jpeg", "cr2", "cr3", "nef", "arw", "dng", "raf");
        private int recentJobLimit = 20;
    }
}
