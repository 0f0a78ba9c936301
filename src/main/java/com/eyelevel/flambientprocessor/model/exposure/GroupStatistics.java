package com.eyelevel.flambientprocessor.model.exposure;

public record GroupStatistics(int totalGroups, int totalAmbient, int totalFlash, int groupsWithBoth,
                              int groupsAmbientOnly, int groupsFlashOnly) {
}
