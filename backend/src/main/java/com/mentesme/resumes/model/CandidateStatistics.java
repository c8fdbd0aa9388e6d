package com.mentesme.resumes.model;

public record CandidateStatistics(int totalCandidates) {
}
