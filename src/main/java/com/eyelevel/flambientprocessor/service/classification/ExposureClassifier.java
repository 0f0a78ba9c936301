package com.eyelevel.flambientprocessor.service.classification;

import com.eyelevel.flambientprocessor.model.exposure.ClassificationRule;
import com.eyelevel.flambientprocessor.model.exposure.ClassifiedExposure;
import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import com.eyelevel.flambientprocessor.model.exposure.ImageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Labels each exposure ambient or flash by exact equality of one raw EXIF value.
 *
 * <p>No normalization is applied: {@code "16"} and {@code "16.0"} are different values. An exposure
 * without the field is treated as flash.
 */
@Slf4j
@Component
public class ExposureClassifier {

    public List<ClassifiedExposure> classify(List<ExposureRecord> records, ClassificationRule rule) {
        String field = rule.exifField();
        List<ClassifiedExposure> classified = records.stream()
                                                     .map(record -> new ClassifiedExposure(record,
                                                                                           typeOf(record, field,
                                                                                                  rule.ambientValue())))
                                                     .toList();
        long ambient = classified.stream().filter(c -> c.type() == ImageType.AMBIENT).count();
        log.info("Classified {} exposures on {}={}: {} ambient, {} flash", classified.size(), field,
                 rule.ambientValue(), ambient, classified.size() - ambient);
        return classified;
    }

    ImageType typeOf(ExposureRecord record, String field, String ambientValue) {
        return record.rawValue(field)
                     .filter(ambientValue::equals)
                     .map(value -> ImageType.AMBIENT)
                     .orElse(ImageType.FLASH);
    }
}
