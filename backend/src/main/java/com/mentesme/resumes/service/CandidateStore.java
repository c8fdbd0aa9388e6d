package com.mentesme.resumes.service;

import com.mentesme.resumes.model.Candidate;
import com.mentesme.resumes.model.CandidateDraft;
import com.mentesme.resumes.model.CandidateFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory candidate records. Contents are lost on restart.
 *
 * <p>One lock guards both the map and the id counter, so id allocation and
 * insertion happen atomically. The lock is only held for map work; callers do
 * their file I/O outside of it.
 */
@Repository
public class CandidateStore {

    private static final Logger log = LoggerFactory.getLogger(CandidateStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Candidate> candidates = new LinkedHashMap<>();
    private final Clock clock;
    private long lastId = 0;

    public CandidateStore() {
        this(Clock.systemDefaultZone());
    }

    CandidateStore(Clock clock) {
        this.clock = clock;
    }

    public Candidate allocateAndInsert(CandidateDraft draft) {
        lock.lock();
        try {
            long id = ++lastId;
            Candidate candidate = Candidate.of(id, draft, LocalDateTime.now(clock));
            candidates.put(id, candidate);
            log.info("Candidate stored: ID={}, Name={}", id, candidate.fullName());
            return candidate;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Candidate> get(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(candidates.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return matching candidates in insertion order
     */
    public List<Candidate> list(CandidateFilter filter) {
        lock.lock();
        try {
            return candidates.values().stream()
                    .filter(filter::matches)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Candidate> delete(long id) {
        lock.lock();
        try {
            Candidate removed = candidates.remove(id);
            if (removed != null) {
                log.info("Candidate removed: ID={}, Name={}", id, removed.fullName());
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return candidates.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every record and restart ids at 1.
     */
    public void clear() {
        lock.lock();
        try {
            candidates.clear();
            lastId = 0;
            log.warn("Candidate store cleared");
        } finally {
            lock.unlock();
        }
    }
}
