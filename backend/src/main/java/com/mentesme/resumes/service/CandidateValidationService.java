package com.mentesme.resumes.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.mentesme.resumes.exception.CandidateException;
import com.mentesme.resumes.model.CandidateDraft;
import com.mentesme.resumes.model.CandidateFilter;
import com.mentesme.resumes.model.CandidateSubmission;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks submitted candidate metadata and list filters before anything is written.
 * All problems are collected and reported together as one ValidationError whose
 * detail lists {@code field} and {@code message} per problem.
 */
@Service
public class CandidateValidationService {

    static final int MIN_GRADUATION_YEAR = 1950;
    static final int MAX_GRADUATION_YEAR = 2030;
    private static final int MIN_BIRTH_YEAR = 1900;
    private static final Pattern PHONE = Pattern.compile("^(\\+\\d{1,3})?\\d{10,12}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s-]");
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private final Validator validator;

    public CandidateValidationService(Validator validator) {
        this.validator = validator;
    }

    /**
     * @return a draft carrying normalised values; its resume file name is still unset
     */
    public CandidateDraft validate(CandidateSubmission submission) {
        CandidateSubmission form = submission.trimmed();
        List<Map<String, String>> errors = new ArrayList<>();

        Set<ConstraintViolation<CandidateSubmission>> violations = validator.validate(form);
        violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<CandidateSubmission> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .forEach(v -> errors.add(error(SNAKE_CASE.translate(v.getPropertyPath().toString()), v.getMessage())));

        LocalDate dob = null;
        if (form.dob() != null && !form.dob().isEmpty()) {
            try {
                dob = LocalDate.parse(form.dob());
                if (!dob.isBefore(LocalDate.now())) {
                    errors.add(error("dob", "Date of birth must be in the past"));
                } else if (dob.getYear() < MIN_BIRTH_YEAR) {
                    errors.add(error("dob", "Date of birth year must be after " + MIN_BIRTH_YEAR));
                }
            } catch (DateTimeParseException e) {
                errors.add(error("dob", "Date of birth must be in YYYY-MM-DD format"));
            }
        }

        String contactNumber = null;
        if (form.contactNumber() != null && !form.contactNumber().isEmpty()) {
            contactNumber = PHONE_SEPARATORS.matcher(form.contactNumber()).replaceAll("");
            if (!PHONE.matcher(contactNumber).matches()) {
                errors.add(error("contact_number",
                        "Contact number must be 10-12 digits, optionally with country code (e.g., +919876543210 or 9876543210)"));
            }
        }

        List<String> skills = parseSkills(form.skillSet());
        if (form.skillSet() != null && !form.skillSet().isBlank() && skills.isEmpty()) {
            errors.add(error("skill_set", "At least one valid skill must be provided"));
        }

        if (!errors.isEmpty()) {
            throw CandidateException.validation("Request validation failed", errors);
        }

        return new CandidateDraft(form.fullName(), dob, contactNumber, form.contactAddress(),
                form.educationQualification(), form.graduationYear(), form.yearsOfExperience(),
                skills, null);
    }

    public void validate(CandidateFilter filter) {
        List<Map<String, String>> errors = new ArrayList<>();
        if (filter.minExperience() != null && filter.minExperience() < 0) {
            errors.add(error("min_experience", "must be greater than or equal to 0"));
        }
        if (filter.maxExperience() != null && filter.maxExperience() < 0) {
            errors.add(error("max_experience", "must be greater than or equal to 0"));
        }
        if (filter.minExperience() != null && filter.maxExperience() != null
                && filter.maxExperience() < filter.minExperience()) {
            errors.add(error("max_experience", "max_experience must be greater than or equal to min_experience"));
        }
        if (filter.graduationYear() != null
                && (filter.graduationYear() < MIN_GRADUATION_YEAR || filter.graduationYear() > MAX_GRADUATION_YEAR)) {
            errors.add(error("graduation_year",
                    "must be between " + MIN_GRADUATION_YEAR + " and " + MAX_GRADUATION_YEAR));
        }
        if (!errors.isEmpty()) {
            throw CandidateException.validation("Invalid query parameters", errors);
        }
    }

    /**
     * Split a comma-separated skill list: trim, drop empty tokens and
     * case-insensitive duplicates, keep the first spelling and the input order.
     */
    public static List<String> parseSkills(String input) {
        if (input == null) {
            return List.of();
        }
        Map<String, String> unique = new LinkedHashMap<>();
        for (String token : input.split(",")) {
            String skill = token.strip();
            if (!skill.isEmpty()) {
                unique.putIfAbsent(skill.toLowerCase(Locale.ROOT), skill);
            }
        }
        return List.copyOf(unique.values());
    }

    private static Map<String, String> error(String field, String message) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("field", field);
        error.put("message", message);
        return error;
    }
}
