package com.eyelevel.flambientprocessor.service.imagen;

import com.eyelevel.flambientprocessor.common.apiclient.imagen.ImagenApiClient;
import com.eyelevel.flambientprocessor.dto.imagen.DownloadLink;
import com.eyelevel.flambientprocessor.dto.imagen.DownloadResult;
import com.eyelevel.flambientprocessor.dto.imagen.UploadLink;
import com.eyelevel.flambientprocessor.dto.imagen.UploadResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Moves batches of files to and from signed URLs on a bounded worker pool.
 *
 * <p>Transfers run concurrently, but their outcomes are collected in submission order on the
 * calling thread, so listeners observe a monotonic sequence and may persist progress safely.
 */
@Slf4j
@Service
public class ImagenTransferService {

    private final ImagenApiClient apiClient;
    private final Executor transferExecutor;

    public ImagenTransferService(ImagenApiClient apiClient,
                                 @Qualifier("transferTaskExecutor") Executor transferExecutor) {
        this.apiClient = apiClient;
        this.transferExecutor = transferExecutor;
    }

    /**
     * Uploads {@code files} into the remote project. A file without a matching upload link counts
     * as failed.
     */
    public UploadResult upload(String projectId, List<Path> files, TransferListener listener) {
        List<String> filenames = files.stream().map(file -> FilenameUtils.getName(file.toString())).toList();
        Map<String, UploadLink> links = apiClient.getUploadLinks(projectId, filenames)
                                                 .stream()
                                                 .collect(Collectors.toMap(UploadLink::filename, Function.identity(),
                                                                           (first, second) -> first));

        Map<String, CompletableFuture<Void>> inFlight = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            String filename = filenames.get(i);
            UploadLink link = links.get(filename);
            Path file = files.get(i);
            if (link == null) {
                inFlight.put(filename, CompletableFuture.failedFuture(
                        new IllegalStateException("No upload link for " + filename)));
            } else {
                inFlight.put(filename, CompletableFuture.runAsync(() -> apiClient.uploadFile(link, file),
                                                                  transferExecutor));
            }
        }

        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        inFlight.forEach((filename, future) -> {
            try {
                future.join();
                succeeded.add(filename);
                listener.onSuccess(filename, succeeded.size(), files.size());
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                log.error("[{}] Upload failed for {}: {}", projectId, filename, cause.getMessage());
                failed.add(filename);
                listener.onFailure(filename, cause);
            }
        });
        log.info("[{}] Uploaded {}/{} files", projectId, succeeded.size(), files.size());
        return new UploadResult(files.size(), succeeded, failed);
    }

    /**
     * Downloads every link into {@code destinationDirectory}.
     */
    public DownloadResult download(List<DownloadLink> links, Path destinationDirectory, TransferListener listener) {
        List<CompletableFuture<Path>> inFlight = links.stream()
                                                      .map(link -> CompletableFuture.supplyAsync(
                                                              () -> apiClient.downloadFile(link, destinationDirectory),
                                                              transferExecutor))
                                                      .toList();

        List<Path> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < links.size(); i++) {
            String filename = links.get(i).filename();
            try {
                succeeded.add(inFlight.get(i).join());
                listener.onSuccess(filename, succeeded.size(), links.size());
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                log.error("Download failed for {}: {}", filename, cause.getMessage());
                failed.add(filename);
                listener.onFailure(filename, cause);
            }
        }
        return new DownloadResult(links.size(), succeeded, failed);
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() == null ? e : e.getCause();
    }
}
