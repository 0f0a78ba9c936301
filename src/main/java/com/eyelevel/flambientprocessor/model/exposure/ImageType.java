package com.eyelevel.flambientprocessor.model.exposure;

/**
 * The lighting role of an exposure.
 */
public enum ImageType {
    AMBIENT,
    FLASH,
    /**
     * The composite produced from one ambient/flash group.
     */
    BLENDED
}
