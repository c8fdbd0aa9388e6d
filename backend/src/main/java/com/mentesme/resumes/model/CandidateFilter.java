package com.mentesme.resumes.model;

import java.util.Locale;

/**
 * List filters. A null field places no constraint on the candidate;
 * all present fields must match.
 */
public record CandidateFilter(
        String skill,
        Double minExperience,
        Double maxExperience,
        Integer graduationYear
) {
    public static CandidateFilter none() {
        return new CandidateFilter(null, null, null, null);
    }

    public boolean matches(Candidate candidate) {
        if (skill != null && !skill.isBlank()) {
            String needle = skill.strip().toLowerCase(Locale.ROOT);
            boolean hasSkill = candidate.skillSet().stream()
                    .anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(needle));
            if (!hasSkill) {
                return false;
            }
        }
        if (minExperience != null && candidate.yearsOfExperience() < minExperience) {
            return false;
        }
        if (maxExperience != null && candidate.yearsOfExperience() > maxExperience) {
            return false;
        }
        return graduationYear == null || candidate.graduationYear() == graduationYear;
    }
}
