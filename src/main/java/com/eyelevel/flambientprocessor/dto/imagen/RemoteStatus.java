package com.eyelevel.flambientprocessor.dto.imagen;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;
import java.util.Set;

/**
 * One observation of a remote edit or export: status text, percent progress, and an optional message.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteStatus(String status, Integer progress, String message) {

    private static final Set<String> COMPLETE_STATUSES = Set.of("completed", "done", "finished");
    private static final Set<String> FAILED_STATUSES = Set.of("failed", "error");

    public RemoteStatus {
        status = status == null ? "unknown" : status;
        progress = progress == null ? 0 : progress;
    }

    public boolean isComplete() {
        return COMPLETE_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }

    public boolean isFailed() {
        return FAILED_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }
}
