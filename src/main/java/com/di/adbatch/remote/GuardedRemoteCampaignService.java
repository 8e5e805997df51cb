package com.di.adbatch.remote;

import com.di.adbatch.exception.ErrorCategory;
import com.di.adbatch.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorates a session so that a configure call can never hang the run or blow it up.
 *
 * <ul>
 *   <li>the call runs on a dedicated thread and is abandoned after {@code timeout};</li>
 *   <li>a timeout or any exception becomes {@link ConfigureResult#fatalFailure(String)},
 *       labelled with its {@link ErrorCategory};</li>
 *   <li>an interrupt of the calling thread cancels the call, restores the interrupt flag
 *       and returns a fatal result. Callers check the flag to tell this apart from a
 *       real failure.</li>
 * </ul>
 */
@Slf4j
public class GuardedRemoteCampaignService implements RemoteCampaignSession {

    private final RemoteCampaignSession delegate;
    private final Duration              timeout;
    private final ThreadFactory         threadFactory;
    private ExecutorService             executor;

    public GuardedRemoteCampaignService(RemoteCampaignSession delegate, Duration timeout, int workerId) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("remote timeout must be positive, got " + timeout);
        }
        this.delegate = delegate;
        this.timeout  = timeout;
        AtomicInteger callThreadNo = new AtomicInteger();
        this.threadFactory = r -> {
            var t = new Thread(r, "remote-call-w" + workerId + "-" + callThreadNo.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newSingleThreadExecutor(threadFactory);
    }

    @Override
    public ConfigureResult configure(ConfigureRequest request) {
        Future<ConfigureResult> future = executor.submit(MdcPropagation.wrapCallable(() -> delegate.configure(request)));
        try {
            ConfigureResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ConfigureResult.fatalFailure("[" + ErrorCategory.APPLICATION_ERROR + "] remote returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            replaceCallThread();
            log.error("[REMOTE] {} {} timed out after {}", request.getCampaignSetName(), request.getVariant(), timeout);
            return ConfigureResult.fatalFailure("[" + ErrorCategory.TIMEOUT_ERROR + "] remote call timed out after "
                    + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ErrorCategory category = ErrorCategory.categorize(cause);
            log.error("[REMOTE] {} {} failed [{}]: {}", request.getCampaignSetName(), request.getVariant(),
                      category, cause.toString(), cause);
            return ConfigureResult.fatalFailure("[" + category + "] " + describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("[REMOTE] {} {} interrupted while waiting for the remote call",
                     request.getCampaignSetName(), request.getVariant());
            return ConfigureResult.fatalFailure("interrupted");
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        delegate.close();
    }

    /**
     * The timed-out call may ignore its interrupt and keep the thread; later calls get a new one.
     */
    private void replaceCallThread() {
        executor.shutdownNow();
        executor = Executors.newSingleThreadExecutor(threadFactory);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
}
