package loganalyzer.engine.analysis;

import loganalyzer.engine.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds every classify call of a delegate by a timeout. An expired call is
 * abandoned (its thread is interrupted) and reported as a retryable failure.
 */
public final class TimeLimitedAnalysisClient implements AnalysisClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedAnalysisClient.class);

    private final AnalysisClient delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedAnalysisClient(AnalysisClient delegate, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    @Override
    public List<Finding> classify(AnalysisRequest request) throws AnalysisException, InterruptedException {
        Future<List<Finding>> future = executor.submit(() -> delegate.classify(request));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Analysis of job {} batch {} timed out after {}ms",
                    request.jobId(), request.batchNumber(), timeout.toMillis());
            throw AnalysisException.timeout(timeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisException ae) {
                throw ae;
            }
            if (cause instanceof InterruptedException) {
                throw new AnalysisException("Analysis call was interrupted", true, cause);
            }
            throw new AnalysisException("Analysis call failed: " + cause, true, cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "analysis-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
