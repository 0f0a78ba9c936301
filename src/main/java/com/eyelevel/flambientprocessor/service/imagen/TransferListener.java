package com.eyelevel.flambientprocessor.service.imagen;

/**
 * Receives per-file transfer outcomes, always on the calling thread and in submission order.
 */
public interface TransferListener {

    TransferListener NONE = new TransferListener() {
    };

    default void onSuccess(String filename, int completed, int total) {
    }

    default void onFailure(String filename, Throwable error) {
    }
}
