package com.mentesme.resumes.service;

import com.mentesme.resumes.exception.CandidateException;
import com.mentesme.resumes.model.Candidate;
import com.mentesme.resumes.model.CandidateDraft;
import com.mentesme.resumes.model.CandidateFilter;
import com.mentesme.resumes.model.CandidateStatistics;
import com.mentesme.resumes.model.CandidateSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CandidateService {

    private static final Logger log = LoggerFactory.getLogger(CandidateService.class);

    private final CandidateStore store;
    private final ResumeFileHandler fileHandler;
    private final CandidateValidationService validationService;

    public CandidateService(CandidateStore store,
                            ResumeFileHandler fileHandler,
                            CandidateValidationService validationService) {
        this.store = store;
        this.fileHandler = fileHandler;
        this.validationService = validationService;
    }

    /**
     * Validate the upload and its metadata, write the resume, then store the record.
     * Every check runs before the file is written. If storing the record fails,
     * the written file is removed again.
     */
    public Candidate submit(CandidateSubmission submission, byte[] content, String originalName) {
        log.info("Creating candidate: {}", submission.fullName());
        fileHandler.validateType(originalName);
        fileHandler.validateSize(originalName, content.length);
        CandidateDraft draft = validationService.validate(submission);

        String resumeFilename = fileHandler.save(originalName, content);
        try {
            Candidate candidate = store.allocateAndInsert(draft.withResumeFilename(resumeFilename));
            log.info("Candidate created: ID={}, Name={}", candidate.id(), candidate.fullName());
            return candidate;
        } catch (RuntimeException e) {
            fileHandler.delete(resumeFilename);
            log.error("Cleaned up file after failed candidate creation: {}", resumeFilename);
            throw e;
        }
    }

    public Candidate find(long id) {
        log.debug("Fetching candidate: ID={}", id);
        return store.get(id).orElseThrow(() -> {
            log.warn("Candidate not found: ID={}", id);
            return CandidateException.notFound(id);
        });
    }

    public List<Candidate> query(CandidateFilter filter) {
        validationService.validate(filter);
        List<Candidate> result = store.list(filter);
        log.info("Listed candidates: skill={}, min_exp={}, max_exp={}, grad_year={}, result_count={}",
                filter.skill(), filter.minExperience(), filter.maxExperience(), filter.graduationYear(),
                result.size());
        return result;
    }

    /**
     * Remove the record, then its resume file. A file that is missing or cannot
     * be deleted is logged and does not undo the removal.
     */
    public Candidate remove(long id) {
        log.info("Deleting candidate: ID={}", id);
        Candidate removed = store.delete(id).orElseThrow(() -> {
            log.warn("Candidate not found for deletion: ID={}", id);
            return CandidateException.notFound(id);
        });
        if (!fileHandler.delete(removed.resumeFilename())) {
            log.warn("Resume file of candidate {} could not be removed: {}", id, removed.resumeFilename());
        }
        return removed;
    }

    public CandidateStatistics statistics() {
        return new CandidateStatistics(store.count());
    }
}
