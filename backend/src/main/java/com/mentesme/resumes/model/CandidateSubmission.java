package com.mentesme.resumes.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Raw form fields of a resume upload, as the client sent them.
 */
public record CandidateSubmission(
        @NotBlank @Size(min = 2, max = 100) String fullName,
        @NotBlank String dob,
        @NotBlank String contactNumber,
        @NotBlank @Size(min = 10, max = 500) String contactAddress,
        @NotBlank @Size(min = 2, max = 100) String educationQualification,
        @NotNull @Min(1950) @Max(2030) Integer graduationYear,
        @NotNull @DecimalMin("0") @DecimalMax("50") Double yearsOfExperience,
        @NotBlank String skillSet
) {
    public CandidateSubmission trimmed() {
        return new CandidateSubmission(strip(fullName), strip(dob), strip(contactNumber),
                strip(contactAddress), strip(educationQualification), graduationYear,
                yearsOfExperience, skillSet);
    }

    private static String strip(String value) {
        return value != null ? value.strip() : null;
    }
}
