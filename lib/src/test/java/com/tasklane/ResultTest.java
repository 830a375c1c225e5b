package com.tasklane;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void successCarriesItsValue() {
        Result<String> result = Result.success("value");

        assertTrue(result.isSuccess());
        assertEquals("value", result.getOrThrow());
        assertEquals("value", result.getOrElse("other"));
        assertTrue(result.failureCause().isEmpty());
        assertEquals(5, result.map(String::length).getOrThrow());
    }

    @Test
    void failureRethrowsUncheckedErrorsAsIs() {
        IllegalStateException error = new IllegalStateException("bad");
        Result<String> result = Result.failure(error);

        assertSame(error, assertThrows(IllegalStateException.class, result::getOrThrow));
        assertEquals("other", result.getOrElse("other"));
    }

    @Test
    void failureWrapsCheckedErrors() {
        IOException error = new IOException("io");
        Result<String> result = Result.failure(error);

        ActorException thrown = assertThrows(ActorException.class, result::getOrThrow);
        assertSame(error, thrown.getCause());
    }

    @Test
    void mapCapturesExceptions() {
        Result<Integer> mapped = Result.success("x").map(s -> {
            throw new IllegalArgumentException("mapping failed");
        });

        assertFalse(mapped.isSuccess());
        assertInstanceOf(IllegalArgumentException.class, mapped.failureCause().orElseThrow());
    }

    @Test
    void callbacksMatchTheVariant() {
        AtomicReference<Object> seen = new AtomicReference<>();

        Result.success("v").ifSuccess(seen::set);
        assertEquals("v", seen.get());

        RuntimeException error = new RuntimeException();
        Result.<String>failure(error).ifFailure(seen::set);
        assertSame(error, seen.get());
    }

    @Test
    void sendErrorIsExtractedFromFailedSends() {
        Result<Void> failed = Result.failure(new SendException(SendError.QUEUE_FULL, "a"));

        assertEquals(SendError.QUEUE_FULL, SendException.errorOf(failed).orElseThrow());
        assertTrue(SendException.errorOf(Result.success(null)).isEmpty());
        assertTrue(SendException.errorOf(Result.failure(new RuntimeException())).isEmpty());
    }
}
