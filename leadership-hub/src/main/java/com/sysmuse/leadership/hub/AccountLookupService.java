package com.sysmuse.leadership.hub;

import com.sysmuse.util.LoggingUtil;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves many emails against an {@link AccountDirectory} on a bounded worker pool.
 *
 * <p>Each lookup is retried with exponential backoff while the failure looks transient;
 * any other failure, or the last failed attempt, maps that email to empty. Errors
 * never reach the caller.</p>
 */
public class AccountLookupService {

    public static final int DEFAULT_MAX_WORKERS = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 500L;

    private static final List<String> TRANSIENT_INDICATORS = Arrays.asList(
            "failed to resolve",
            "connection refused",
            "connection reset",
            "connection timeout",
            "read timeout",
            "rate limit",
            "429",
            "502",
            "503",
            "504");

    private final AccountDirectory directory;
    private final int maxWorkers;
    private final int maxRetries;
    private final long initialBackoffMillis;

    public AccountLookupService(AccountDirectory directory) {
        this(directory, DEFAULT_MAX_WORKERS, DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_BACKOFF_MILLIS);
    }

    public AccountLookupService(AccountDirectory directory, int maxWorkers, int maxRetries,
                                long initialBackoffMillis) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + maxWorkers);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.directory = directory;
        this.maxWorkers = maxWorkers;
        this.maxRetries = maxRetries;
        this.initialBackoffMillis = initialBackoffMillis;
    }

    /**
     * Look up every email concurrently. The result has one entry per distinct email,
     * in input order.
     */
    public Map<String, Optional<String>> lookupAll(List<String> emails) {
        Map<String, Optional<String>> results = new LinkedHashMap<>();
        if (emails == null || emails.isEmpty()) {
            return results;
        }

        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(emails));
        int workers = Math.min(maxWorkers, distinct.size());
        LoggingUtil.info("Looking up " + distinct.size() + " email(s) with " + workers
                + " worker(s) and " + maxRetries + " max retries");

        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "account-lookup-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, Future<Optional<String>>> futures = new LinkedHashMap<>();
            for (String email : distinct) {
                futures.put(email, executor.submit(() -> lookupWithRetry(email)));
            }
            for (Map.Entry<String, Future<Optional<String>>> entry : futures.entrySet()) {
                results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }
        } finally {
            executor.shutdownNow();
        }

        long found = results.values().stream().filter(Optional::isPresent).count();
        LoggingUtil.info("Lookup complete: " + found + "/" + distinct.size() + " accounts found");
        return results;
    }

    private Optional<String> await(String email, Future<Optional<String>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LoggingUtil.warn("Interrupted while looking up " + email);
            return Optional.empty();
        } catch (ExecutionException e) {
            LoggingUtil.error("Unexpected error looking up " + email, e.getCause());
            return Optional.empty();
        }
    }

    /**
     * One email with up to {@code maxRetries} retries on transient failures.
     */
    Optional<String> lookupWithRetry(String email) {
        long backoff = initialBackoffMillis;
        for (int attempt = 0; ; attempt++) {
            try {
                Optional<String> id = directory.lookupByEmail(email);
                if (id.isPresent()) {
                    LoggingUtil.debug("Found account for " + email);
                } else {
                    LoggingUtil.debug("No account for " + email);
                }
                return id;
            } catch (AccountLookupException e) {
                if (attempt >= maxRetries || !isTransient(e)) {
                    LoggingUtil.error("Failed to look up " + email + " after " + (attempt + 1)
                            + " attempt(s): " + e.getMessage());
                    return Optional.empty();
                }
                LoggingUtil.warn("Transient error on attempt " + (attempt + 1) + "/" + (maxRetries + 1)
                        + " for " + email + ": " + e.getMessage() + ". Retrying in " + backoff + "ms");
                try {
                    sleepBeforeRetry(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
                backoff *= 2;
            }
        }
    }

    protected void sleepBeforeRetry(long backoffMillis) throws InterruptedException {
        Thread.sleep(backoffMillis);
    }

    /**
     * Name resolution, connect/read timeouts, resets and 429/502/503/504 responses,
     * judged from the status code, the cause chain, or the message text.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof AccountLookupException && ((AccountLookupException) error).hasStatusCode()) {
            int code = ((AccountLookupException) error).getStatusCode();
            if (code == 429 || code == 502 || code == 503 || code == 504) {
                return true;
            }
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException || t instanceof ConnectException
                    || t instanceof SocketTimeoutException || t instanceof SocketException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String indicator : TRANSIENT_INDICATORS) {
                    if (lower.contains(indicator)) {
                        return true;
                    }
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
