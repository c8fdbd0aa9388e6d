package com.mentesme.resumes.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record Candidate(
        long id,
        String fullName,
        LocalDate dob,
        String contactNumber,
        String contactAddress,
        String educationQualification,
        int graduationYear,
        double yearsOfExperience,
        List<String> skillSet,
        String resumeFilename,
        LocalDateTime createdAt
) {
    public Candidate {
        skillSet = List.copyOf(skillSet);
    }

    public static Candidate of(long id, CandidateDraft draft, LocalDateTime createdAt) {
        return new Candidate(id, draft.fullName(), draft.dob(), draft.contactNumber(),
                draft.contactAddress(), draft.educationQualification(), draft.graduationYear(),
                draft.yearsOfExperience(), draft.skillSet(), draft.resumeFilename(), createdAt);
    }
}
