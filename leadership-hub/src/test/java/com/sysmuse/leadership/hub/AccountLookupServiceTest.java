package com.sysmuse.leadership.hub;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class AccountLookupServiceTest {

    /**
     * Directory that fails a scripted number of times per email before answering.
     */
    private static class ScriptedDirectory implements AccountDirectory {
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        private final Map<String, Integer> failuresBeforeSuccess = new ConcurrentHashMap<>();
        private final Map<String, AccountLookupException> failures = new ConcurrentHashMap<>();
        private final Map<String, String> ids = new ConcurrentHashMap<>();

        ScriptedDirectory id(String email, String id) {
            ids.put(email, id);
            return this;
        }

        ScriptedDirectory fail(String email, int times, AccountLookupException error) {
            failuresBeforeSuccess.put(email, times);
            failures.put(email, error);
            return this;
        }

        int calls(String email) {
            AtomicInteger count = calls.get(email);
            return count == null ? 0 : count.get();
        }

        @Override
        public Optional<String> lookupByEmail(String email) throws AccountLookupException {
            int call = calls.computeIfAbsent(email, k -> new AtomicInteger()).incrementAndGet();
            Integer failTimes = failuresBeforeSuccess.get(email);
            if (failTimes != null && call <= failTimes) {
                throw failures.get(email);
            }
            return Optional.ofNullable(ids.get(email));
        }
    }

    private static class RecordingLookupService extends AccountLookupService {
        final List<Long> backoffs = new CopyOnWriteArrayList<>();

        RecordingLookupService(AccountDirectory directory, int maxWorkers, int maxRetries) {
            super(directory, maxWorkers, maxRetries, 500L);
        }

        @Override
        protected void sleepBeforeRetry(long backoffMillis) {
            backoffs.add(backoffMillis);
        }
    }

    @Test
    public void testResultsFollowInputOrder() {
        ScriptedDirectory directory = new ScriptedDirectory()
                .id("a@bars.org", "UA")
                .id("c@bars.org", "UC");
        AccountLookupService service = new RecordingLookupService(directory, 3, 3);

        Map<String, Optional<String>> results = service.lookupAll(
                Arrays.asList("c@bars.org", "b@bars.org", "a@bars.org", "c@bars.org"));

        assertEquals(Arrays.asList("c@bars.org", "b@bars.org", "a@bars.org"), new ArrayList<>(results.keySet()));
        assertEquals(Optional.of("UC"), results.get("c@bars.org"));
        assertEquals(Optional.empty(), results.get("b@bars.org"));
        assertEquals(Optional.of("UA"), results.get("a@bars.org"));
        assertEquals(1, directory.calls("c@bars.org"), "duplicates are looked up once");
    }

    @Test
    public void testEmptyInput() {
        AccountLookupService service = new RecordingLookupService(new ScriptedDirectory(), 2, 3);
        assertTrue(service.lookupAll(Collections.emptyList()).isEmpty());
        assertTrue(service.lookupAll(null).isEmpty());
    }

    @Test
    public void testTransientFailureIsRetriedWithDoublingBackoff() {
        ScriptedDirectory directory = new ScriptedDirectory()
                .id("a@bars.org", "UA")
                .fail("a@bars.org", 2, new AccountLookupException("rate limited", 429));
        RecordingLookupService service = new RecordingLookupService(directory, 1, 3);

        Map<String, Optional<String>> results = service.lookupAll(Collections.singletonList("a@bars.org"));

        assertEquals(Optional.of("UA"), results.get("a@bars.org"));
        assertEquals(3, directory.calls("a@bars.org"));
        assertEquals(Arrays.asList(500L, 1000L), service.backoffs);
    }

    @Test
    public void testGivesUpAfterMaxRetries() {
        ScriptedDirectory directory = new ScriptedDirectory()
                .id("a@bars.org", "UA")
                .fail("a@bars.org", 10, new AccountLookupException("upstream", 503));
        RecordingLookupService service = new RecordingLookupService(directory, 1, 3);

        Map<String, Optional<String>> results = service.lookupAll(Collections.singletonList("a@bars.org"));

        assertEquals(Optional.empty(), results.get("a@bars.org"));
        assertEquals(4, directory.calls("a@bars.org"), "one attempt plus three retries");
        assertEquals(Arrays.asList(500L, 1000L, 2000L), service.backoffs);
    }

    @Test
    public void testPermanentFailureIsNotRetried() {
        ScriptedDirectory directory = new ScriptedDirectory()
                .fail("a@bars.org", 10, new AccountLookupException("invalid_auth", 401))
                .id("b@bars.org", "UB");
        RecordingLookupService service = new RecordingLookupService(directory, 2, 3);

        Map<String, Optional<String>> results = service.lookupAll(Arrays.asList("a@bars.org", "b@bars.org"));

        assertEquals(Optional.empty(), results.get("a@bars.org"));
        assertEquals(Optional.of("UB"), results.get("b@bars.org"));
        assertEquals(1, directory.calls("a@bars.org"));
        assertTrue(service.backoffs.isEmpty());
    }

    @Test
    public void testWorkerPoolIsBounded() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AccountDirectory slow = email -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return Optional.of("U-" + email);
        };
        AccountLookupService service = new AccountLookupService(slow, 2, 0, 1L);

        List<String> emails = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            emails.add("user" + i + "@bars.org");
        }
        Map<String, Optional<String>> results = service.lookupAll(emails);

        assertEquals(8, results.size());
        assertEquals(Optional.of("U-user7@bars.org"), results.get("user7@bars.org"));
        assertTrue(maxActive.get() <= 2, "at most two lookups at a time, saw " + maxActive.get());
    }

    @Test
    public void testTransientClassification() {
        assertTrue(AccountLookupService.isTransient(new AccountLookupException("slow down", 429)));
        assertTrue(AccountLookupService.isTransient(new AccountLookupException("bad gateway", 502)));
        assertTrue(AccountLookupService.isTransient(new AccountLookupException("timeout", 504)));
        assertTrue(AccountLookupService.isTransient(
                new AccountLookupException("lookup failed", new UnknownHostException("slack.com"))));
        assertTrue(AccountLookupService.isTransient(
                new AccountLookupException("lookup failed", new SocketTimeoutException("Read timed out"))));
        assertTrue(AccountLookupService.isTransient(new AccountLookupException("Connection reset by peer")));
        assertTrue(AccountLookupService.isTransient(new AccountLookupException("Failed to resolve 'slack.com'")));

        assertFalse(AccountLookupService.isTransient(new AccountLookupException("users_not_found", 404)));
        assertFalse(AccountLookupService.isTransient(new AccountLookupException("invalid_auth")));
    }

    @Test
    public void testRejectsBadPoolSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new AccountLookupService(new ScriptedDirectory(), 0, 3, 500L));
        assertThrows(IllegalArgumentException.class,
                () -> new AccountLookupService(new ScriptedDirectory(), 1, -1, 500L));
    }
}
