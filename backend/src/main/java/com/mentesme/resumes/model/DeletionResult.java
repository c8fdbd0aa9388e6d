package com.mentesme.resumes.model;

public record DeletionResult(String message, DeletedCandidate deletedCandidate) {

    public record DeletedCandidate(long id, String fullName) {}

    public static DeletionResult of(Candidate candidate) {
        return new DeletionResult("Candidate " + candidate.id() + " deleted successfully",
                new DeletedCandidate(candidate.id(), candidate.fullName()));
    }
}
