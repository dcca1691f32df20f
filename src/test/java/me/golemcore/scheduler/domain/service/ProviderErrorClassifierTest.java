package me.golemcore.scheduler.domain.service;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import me.golemcore.scheduler.domain.exception.ProviderTerminalException;
import me.golemcore.scheduler.domain.exception.ProviderTransientException;
import me.golemcore.scheduler.domain.exception.QuotaExceededException;
import me.golemcore.scheduler.domain.exception.SchedulerErrorKind;
import me.golemcore.scheduler.domain.exception.SchedulerException;
import me.golemcore.scheduler.domain.model.QuotaDimension;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorClassifierTest {

    @Test
    void shouldClassifyRateLimitAsTransient() {
        SchedulerException error = ProviderErrorClassifier.toSchedulerException(new RateLimitException("slow down"));

        ProviderTransientException transientError = assertInstanceOf(ProviderTransientException.class, error);
        assertEquals(ProviderErrorClassifier.RATE_LIMIT, transientError.getReasonCode());
        assertTrue(error.isRetryable());
    }

    @Test
    void shouldClassifyAuthenticationAsTerminal() {
        SchedulerException error = ProviderErrorClassifier
                .toSchedulerException(new AuthenticationException("invalid key"));

        assertInstanceOf(ProviderTerminalException.class, error);
        assertEquals(SchedulerErrorKind.PROVIDER_TERMINAL, error.getKind());
        assertFalse(error.isRetryable());
    }

    @Test
    void shouldClassifyHttpStatusCodes() {
        assertEquals(ProviderErrorClassifier.RATE_LIMIT, ProviderErrorClassifier.classifyHttpStatus(429));
        assertEquals(ProviderErrorClassifier.AUTHENTICATION, ProviderErrorClassifier.classifyHttpStatus(401));
        assertEquals(ProviderErrorClassifier.TIMEOUT, ProviderErrorClassifier.classifyHttpStatus(504));
        assertEquals(ProviderErrorClassifier.INTERNAL_SERVER, ProviderErrorClassifier.classifyHttpStatus(503));
        assertEquals(ProviderErrorClassifier.INVALID_REQUEST, ProviderErrorClassifier.classifyHttpStatus(400));
        assertEquals(ProviderErrorClassifier.HTTP_ERROR, ProviderErrorClassifier.classifyHttpStatus(null));
    }

    @Test
    void shouldReadStatusFromHttpException() {
        assertEquals(ProviderErrorClassifier.INTERNAL_SERVER,
                ProviderErrorClassifier.classify(new HttpException(502, "bad gateway")));
        assertEquals(ProviderErrorClassifier.INVALID_REQUEST,
                ProviderErrorClassifier.classify(new HttpException(422, "unprocessable")));
    }

    @Test
    void shouldUnwrapCompletionAndExecutionExceptions() {
        SchedulerException error = ProviderErrorClassifier.toSchedulerException(
                new CompletionException(new ExecutionException(new SocketTimeoutException("read timed out"))));

        assertInstanceOf(ProviderTransientException.class, error);
        assertEquals(ProviderErrorClassifier.TIMEOUT, ((ProviderTransientException) error).getReasonCode());
    }

    @Test
    void shouldReturnSchedulerExceptionsUnchanged() {
        QuotaExceededException quota = new QuotaExceededException("acme", QuotaDimension.DAILY_TOKENS, "r-1");

        assertSame(quota, ProviderErrorClassifier.toSchedulerException(new CompletionException(quota)));
    }

    @Test
    void shouldTreatIoFailuresAsNetwork() {
        assertEquals(ProviderErrorClassifier.NETWORK,
                ProviderErrorClassifier.classify(new IllegalStateException("wrapped", new IOException("reset"))));
        assertEquals(ProviderErrorClassifier.NETWORK,
                ProviderErrorClassifier.classify(new RuntimeException("Connection refused by host")));
    }

    @Test
    void shouldDetectContextLengthFromMessage() {
        SchedulerException error = ProviderErrorClassifier.toSchedulerException(
                new RuntimeException("This model's maximum context length is 128000 tokens"));

        assertEquals(SchedulerErrorKind.PROVIDER_TERMINAL, error.getKind());
    }

    @Test
    void shouldTreatCancellationAsAborted() {
        assertEquals(ProviderErrorClassifier.ABORTED, ProviderErrorClassifier.classify(new CancellationException()));
    }

    @Test
    void shouldTreatUnknownFailuresAsTerminal() {
        assertEquals(ProviderErrorClassifier.UNKNOWN, ProviderErrorClassifier.classify(new RuntimeException("?")));
        assertFalse(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.UNKNOWN));
        assertInstanceOf(ProviderTerminalException.class,
                ProviderErrorClassifier.toSchedulerException(new RuntimeException("?")));
    }
}
