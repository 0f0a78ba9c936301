package com.eyelevel.flambientprocessor.service.classification;

import com.eyelevel.flambientprocessor.model.exposure.ClassifiedExposure;
import com.eyelevel.flambientprocessor.model.exposure.ExposureGroup;
import com.eyelevel.flambientprocessor.model.exposure.GroupStatistics;
import com.eyelevel.flambientprocessor.model.exposure.ImageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits classified exposures, already in capture order, into ambient-then-flash groups.
 *
 * <p>A group opens on the first exposure and on every flash-to-ambient transition; every other
 * transition continues the current group.
 */
@Slf4j
@Component
public class ExposureGrouper {

    public List<ExposureGroup> group(List<ClassifiedExposure> exposures) {
        List<ExposureGroup> groups = new ArrayList<>();
        List<String> ambient = new ArrayList<>();
        List<String> flash = new ArrayList<>();
        ImageType previous = null;

        for (ClassifiedExposure exposure : exposures) {
            ImageType current = exposure.type();
            if (previous == ImageType.FLASH && current == ImageType.AMBIENT) {
                groups.add(new ExposureGroup(groups.size() + 1, ambient, flash));
                ambient = new ArrayList<>();
                flash = new ArrayList<>();
            }
            if (current == ImageType.AMBIENT) {
                ambient.add(exposure.filename());
            } else {
                flash.add(exposure.filename());
            }
            previous = current;
        }
        if (previous != null) {
            groups.add(new ExposureGroup(groups.size() + 1, ambient, flash));
        }

        groups.stream()
              .filter(group -> !group.hasBoth())
              .forEach(group -> log.warn("[group-{}] has {} ambient and {} flash exposures and will not be blended",
                                         group.paddedNumber(), group.ambientFiles().size(),
                                         group.flashFiles().size()));
        return groups;
    }

    public GroupStatistics statistics(List<ExposureGroup> groups) {
        int totalAmbient = 0;
        int totalFlash = 0;
        int both = 0;
        int ambientOnly = 0;
        int flashOnly = 0;
        for (ExposureGroup group : groups) {
            totalAmbient += group.ambientFiles().size();
            totalFlash += group.flashFiles().size();
            if (group.hasBoth()) {
                both++;
            } else if (group.hasAmbient()) {
                ambientOnly++;
            } else {
                flashOnly++;
            }
        }
        return new GroupStatistics(groups.size(), totalAmbient, totalFlash, both, ambientOnly, flashOnly);
    }
}
