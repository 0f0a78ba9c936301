package com.eyelevel.flambientprocessor.common.apiclient.imagen.retry;

import com.eyelevel.flambientprocessor.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs each failed attempt of a remote API call, labelled with the operation name the client stores
 * under {@link RetryContext#NAME}.
 */
@Slf4j
@Component("imagenApiRetryListener")
public class ImagenApiRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        boolean willRetry = throwable instanceof ApiException apiException && apiException.isTransient();
        log.warn("[{}] Remote call failed on attempt {}{}. Error: {}", operationName(context),
                 context.getRetryCount(), willRetry ? ", retrying" : "", throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("[{}] Remote call gave up after {} attempts", operationName(context), context.getRetryCount());
        }
    }

    private static Object operationName(RetryContext context) {
        Object name = context.getAttribute(RetryContext.NAME);
        return name == null ? "imagen-api" : name;
    }
}
