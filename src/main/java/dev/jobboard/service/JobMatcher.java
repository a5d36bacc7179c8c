package dev.jobboard.service;

import dev.jobboard.entity.Job;
import dev.jobboard.model.JobSearchCriteria;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Matches jobs against search criteria. Used by job search and job alerts.
 */
@Component
public class JobMatcher {

    /**
     * Split a comma-separated skills parameter, dropping blanks.
     */
    public static List<String> parseSkills(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Check every non-empty criterion against the job.
     *
     * @param job      The job to check
     * @param criteria Filters, any of which may be null
     * @return true when the job satisfies all given filters
     */
    public boolean matches(Job job, JobSearchCriteria criteria) {
        if (job == null) {
            return false;
        }
        if (criteria == null) {
            return true;
        }
        return matchesKeyword(job, criteria.getKeyword())
                && matchesLocation(job, criteria.getLocation())
                && (criteria.getWorkMode() == null || criteria.getWorkMode() == job.getWorkMode())
                && (criteria.getJobType() == null || criteria.getJobType() == job.getJobType())
                && matchesSalary(job, criteria.getMinSalary())
                && matchesExperience(job, criteria.getMaxExperience())
                && matchesSkills(job, criteria.getSkills());
    }

    private boolean matchesKeyword(Job job, String keyword) {
        if (isBlank(keyword)) {
            return true;
        }
        String needle = lower(keyword.trim());
        return lower(job.getTitle()).contains(needle)
                || lower(job.getDescription()).contains(needle)
                || job.getSkills().stream().anyMatch(skill -> lower(skill).equals(needle));
    }

    private boolean matchesLocation(Job job, String location) {
        return isBlank(location) || lower(job.getLocation()).contains(lower(location.trim()));
    }

    /**
     * The top of the range is compared; jobs with no salary at all never match a salary filter.
     */
    private boolean matchesSalary(Job job, Integer minSalary) {
        if (minSalary == null || minSalary <= 0) {
            return true;
        }
        Integer top = job.getSalaryMax() != null ? job.getSalaryMax() : job.getSalaryMin();
        return top != null && top >= minSalary;
    }

    private boolean matchesExperience(Job job, Integer maxExperience) {
        if (maxExperience == null) {
            return true;
        }
        return job.getExperienceRequired() == null || job.getExperienceRequired() <= maxExperience;
    }

    // any-of, case-insensitive
    private boolean matchesSkills(Job job, List<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return true;
        }
        List<String> wanted = skills.stream().filter(Objects::nonNull).map(this::lower).toList();
        return job.getSkills().stream().map(this::lower).anyMatch(wanted::contains);
    }

    private String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
