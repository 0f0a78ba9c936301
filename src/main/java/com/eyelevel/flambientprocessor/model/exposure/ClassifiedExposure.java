package com.eyelevel.flambientprocessor.model.exposure;

public record ClassifiedExposure(ExposureRecord record, ImageType type) {

    public String filename() {
        return record.filename();
    }
}
