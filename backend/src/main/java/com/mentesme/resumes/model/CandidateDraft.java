package com.mentesme.resumes.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A validated candidate that has not been assigned an id yet.
 */
public record CandidateDraft(
        String fullName,
        LocalDate dob,
        String contactNumber,
        String contactAddress,
        String educationQualification,
        int graduationYear,
        double yearsOfExperience,
        List<String> skillSet,
        String resumeFilename
) {
    public CandidateDraft withResumeFilename(String fileName) {
        return new CandidateDraft(fullName, dob, contactNumber, contactAddress,
                educationQualification, graduationYear, yearsOfExperience, skillSet, fileName);
    }
}
