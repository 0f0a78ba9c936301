package com.eyelevel.flambientprocessor.common.apiclient.imagen.retry;

import com.eyelevel.flambientprocessor.exception.apiclient.ApiException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries only {@link ApiException}s that report themselves transient (rate limiting, gateway
 * errors, connection failures and timeouts), up to a fixed number of attempts.
 */
public class TransientApiExceptionRetryPolicy extends SimpleRetryPolicy {

    public TransientApiExceptionRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last != null && !(last instanceof ApiException apiException && apiException.isTransient())) {
            return false;
        }
        return super.canRetry(context);
    }
}
