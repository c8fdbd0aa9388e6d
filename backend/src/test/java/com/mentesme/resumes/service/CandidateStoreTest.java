package com.mentesme.resumes.service;

import com.mentesme.resumes.model.Candidate;
import com.mentesme.resumes.model.CandidateFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static com.mentesme.resumes.CandidateFixtures.draft;
import static org.junit.jupiter.api.Assertions.*;

class CandidateStoreTest {

    private CandidateStore store;

    @BeforeEach
    void setUp() {
        store = new CandidateStore();
    }

    @Test
    void allocatesIdsStartingAtOne() {
        Candidate first = store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));
        Candidate second = store.allocateAndInsert(draft("Bob Brown", 2021, 1.0, "Go"));

        assertEquals(1L, first.id());
        assertEquals(2L, second.id());
        assertEquals(2, store.count());
    }

    @Test
    void stampsCreatedAtFromClock() {
        Clock fixed = Clock.fixed(Instant.parse("2026-02-15T20:46:55Z"), ZoneOffset.UTC);
        CandidateStore clocked = new CandidateStore(fixed);

        Candidate candidate = clocked.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));

        assertEquals(LocalDateTime.of(2026, 2, 15, 20, 46, 55), candidate.createdAt());
    }

    @Test
    void idsAreNeverReusedAfterDelete() {
        store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));
        Candidate second = store.allocateAndInsert(draft("Bob Brown", 2021, 1.0, "Go"));
        store.delete(second.id());

        Candidate third = store.allocateAndInsert(draft("Carol Clark", 2019, 6.0, "Rust"));

        assertEquals(3L, third.id());
    }

    @Test
    void concurrentInsertsYieldContiguousUniqueIds() throws Exception {
        int threads = 16;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                Callable<List<Long>> task = () -> {
                    start.await();
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(store.allocateAndInsert(draft("Worker " + worker, 2020, 1.0, "Java")).id());
                    }
                    return ids;
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            List<Long> all = new ArrayList<>();
            for (Future<List<Long>> f : futures) {
                all.addAll(f.get(30, TimeUnit.SECONDS));
            }

            int total = threads * perThread;
            Set<Long> unique = new TreeSet<>(all);
            Set<Long> expected = LongStream.rangeClosed(1, total).boxed().collect(Collectors.toSet());
            assertEquals(total, all.size());
            assertEquals(expected, unique, "ids must be exactly 1..N without gaps or duplicates");
            assertEquals(total, store.count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void listReturnsInsertionOrder() {
        store.allocateAndInsert(draft("Carol Clark", 2019, 6.0, "Rust"));
        store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));
        store.allocateAndInsert(draft("Bob Brown", 2021, 1.0, "Go"));

        List<String> names = store.list(CandidateFilter.none()).stream().map(Candidate::fullName).toList();

        assertEquals(List.of("Carol Clark", "Alice Adams", "Bob Brown"), names);
    }

    @Test
    void listAppliesFilter() {
        store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Python", "Docker"));
        store.allocateAndInsert(draft("Bob Brown", 2021, 1.0, "Go"));

        List<Candidate> result = store.list(new CandidateFilter("docker", null, null, null));

        assertEquals(1, result.size());
        assertEquals("Alice Adams", result.get(0).fullName());
    }

    @Test
    void getAndDeleteMissingIdReturnEmpty() {
        store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));

        assertTrue(store.get(999).isEmpty());
        assertTrue(store.delete(999).isEmpty());
        assertEquals(1, store.count());
    }

    @Test
    void deleteRemovesAndReturnsRecord() {
        Candidate alice = store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));

        Candidate removed = store.delete(alice.id()).orElseThrow();

        assertEquals(alice, removed);
        assertTrue(store.get(alice.id()).isEmpty());
        assertEquals(0, store.count());
    }

    @Test
    void clearResetsRecordsAndIds() {
        store.allocateAndInsert(draft("Alice Adams", 2020, 3.5, "Java"));
        store.allocateAndInsert(draft("Bob Brown", 2021, 1.0, "Go"));

        store.clear();

        assertEquals(0, store.count());
        assertEquals(1L, store.allocateAndInsert(draft("Carol Clark", 2019, 6.0, "Rust")).id());
    }
}
