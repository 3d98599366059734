package com.drugbox.recognition.ocr;

import com.drugbox.recognition.core.model.ExtractedText;
import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the recognition service for one region with a per-call timeout and bounded,
 * exponentially backed-off retries, then scores the text.
 */
public class TextExtractor {
    private static final Logger log = LoggerFactory.getLogger(TextExtractor.class);

    private final TextRecognitionService service;
    private final RetryConfig retryConfig;
    private final Duration callTimeout;
    private final TextQualityScorer scorer;
    private final ExecutorService callExecutor;
    private final MetricsService metrics;

    /**
     * @param callExecutor runs the service calls so they can be abandoned on timeout
     */
    public TextExtractor(TextRecognitionService service, RetryConfig retryConfig, Duration callTimeout,
                         TextQualityScorer scorer, ExecutorService callExecutor, MetricsService metrics) {
        this.service = Objects.requireNonNull(service, "service is required");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig is required");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * @throws ExtractionFailureException once retries are exhausted or the input is rejected
     */
    public ExtractedText extract(Region region) {
        TextRecognitionException last = null;
        for (int attempt = 1; attempt <= retryConfig.maxAttempts(); attempt++) {
            if (attempt > 1) {
                metrics.incrementOcrRetry();
                sleep(retryConfig.backoffBefore(attempt), region.id());
            }
            try {
                RecognizedText recognized = call(region);
                double quality = scorer.score(recognized.text());
                log.debug("ocr.extracted regionId={} attempt={} chars={} quality={}",
                        region.id(), attempt, recognized.text().length(), quality);
                return new ExtractedText(region.id(), recognized.text(), quality, recognized.confidence());
            } catch (TextRecognitionException e) {
                last = e;
                log.warn("ocr.attempt.failed regionId={} attempt={} kind={} error={}",
                        region.id(), attempt, e.getKind(), e.getMessage());
                if (!e.isRetryable()) {
                    throw failure(region.id(), e, attempt);
                }
            }
        }
        throw failure(region.id(), last, retryConfig.maxAttempts());
    }

    private RecognizedText call(Region region) {
        CompletableFuture<RecognizedText> future = CompletableFuture
                .supplyAsync(() -> service.recognize(region.crop()), callExecutor)
                .orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            RecognizedText result = future.join();
            if (result == null) {
                throw new TextRecognitionException(TextRecognitionException.Kind.SERVICE_UNAVAILABLE,
                        "Service returned no result");
            }
            return result;
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                future.cancel(true);
                throw new TextRecognitionException(TextRecognitionException.Kind.TIMEOUT,
                        "No response within " + callTimeout.toMillis() + " ms", cause);
            }
            if (cause instanceof TextRecognitionException tre) {
                throw tre;
            }
            throw new TextRecognitionException(TextRecognitionException.Kind.SERVICE_UNAVAILABLE,
                    String.valueOf(cause != null ? cause.getMessage() : e.getMessage()), cause);
        }
    }

    private static ExtractionFailureException failure(String regionId, TextRecognitionException cause, int attempts) {
        FailureKind kind = cause != null && cause.getKind() == TextRecognitionException.Kind.TIMEOUT
                ? FailureKind.TIMEOUT : FailureKind.EXTRACTION;
        String message = "Text extraction failed after " + attempts + " attempt(s)"
                + (cause != null ? ": " + cause.getMessage() : "");
        return new ExtractionFailureException(regionId, kind, attempts, message, cause);
    }

    private static void sleep(Duration backoff, String regionId) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException(regionId, FailureKind.EXTRACTION, 0,
                    "Interrupted while backing off", e);
        }
    }
}
