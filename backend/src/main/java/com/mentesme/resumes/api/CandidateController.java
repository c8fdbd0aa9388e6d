package com.mentesme.resumes.api;

import com.mentesme.resumes.model.Candidate;
import com.mentesme.resumes.model.CandidateFilter;
import com.mentesme.resumes.model.CandidateStatistics;
import com.mentesme.resumes.model.CandidateSubmission;
import com.mentesme.resumes.model.DeletionResult;
import com.mentesme.resumes.service.CandidateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/candidates")
public class CandidateController {

    private static final Logger log = LoggerFactory.getLogger(CandidateController.class);

    private final CandidateService candidateService;

    public CandidateController(CandidateService candidateService) {
        this.candidateService = candidateService;
    }

    /**
     * Multipart upload: eight form fields plus the {@code resume} file part.
     * Missing fields are reported together by validation, not one at a time.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Candidate upload(
            @RequestParam(value = "full_name", required = false) String fullName,
            @RequestParam(value = "dob", required = false) String dob,
            @RequestParam(value = "contact_number", required = false) String contactNumber,
            @RequestParam(value = "contact_address", required = false) String contactAddress,
            @RequestParam(value = "education_qualification", required = false) String educationQualification,
            @RequestParam(value = "graduation_year", required = false) Integer graduationYear,
            @RequestParam(value = "years_of_experience", required = false) Double yearsOfExperience,
            @RequestParam(value = "skill_set", required = false) String skillSet,
            @RequestPart("resume") MultipartFile resume
    ) throws IOException {
        log.info("Resume upload request: {} ({}, {} bytes)", fullName, resume.getOriginalFilename(), resume.getSize());
        CandidateSubmission submission = new CandidateSubmission(fullName, dob, contactNumber,
                contactAddress, educationQualification, graduationYear, yearsOfExperience, skillSet);
        return candidateService.submit(submission, resume.getBytes(), resume.getOriginalFilename());
    }

    @GetMapping
    public List<Candidate> list(
            @RequestParam(value = "skill", required = false) String skill,
            @RequestParam(value = "min_experience", required = false) Double minExperience,
            @RequestParam(value = "max_experience", required = false) Double maxExperience,
            @RequestParam(value = "graduation_year", required = false) Integer graduationYear) {
        return candidateService.query(new CandidateFilter(skill, minExperience, maxExperience, graduationYear));
    }

    @GetMapping("/statistics")
    public CandidateStatistics statistics() {
        return candidateService.statistics();
    }

    @GetMapping("/{id}")
    public Candidate get(@PathVariable long id) {
        return candidateService.find(id);
    }

    @DeleteMapping("/{id}")
    public DeletionResult delete(@PathVariable long id) {
        return DeletionResult.of(candidateService.remove(id));
    }
}
