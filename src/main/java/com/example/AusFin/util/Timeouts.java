package com.example.AusFin.util;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs a blocking external call on boundedElastic and waits at most {@code timeout} for it.
 * Errors, including the timeout itself, surface as unchecked exceptions from {@link #callWithin}.
 */
public final class Timeouts {

    private Timeouts() {
    }

    public static <T> T callWithin(Duration timeout, Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .block();
    }
}
