package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.Exception.ReportAbortedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Applies the optional run timeout. A run that is cut short surfaces as
 * {@link ReportAbortedException}, never as one of the input errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportExecutionService {

    private final ExecutorService reportExecutor;
    private final ReportProperties properties;

    public <T> T execute(Supplier<T> run) {
        Duration timeout = properties.getExecution().getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return run.get();
        }

        Callable<T> task = run::get;
        Future<T> future = reportExecutor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Report run exceeded {} and was aborted", timeout);
            throw new ReportAbortedException("Report run exceeded the time limit of " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReportAbortedException("Report run was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Report run failed", cause);
        }
    }
}
