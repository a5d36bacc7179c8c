package dev.jobboard.service;

import dev.jobboard.config.ProfileCompletionConfig;
import dev.jobboard.entity.JobSeekerProfile;
import dev.jobboard.entity.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Computes how complete a job-seeker profile is, as a percentage.
 */
@Component
@RequiredArgsConstructor
public class ProfileCompletionCalculator {

    private final ProfileCompletionConfig config;

    /**
     * @param profile Profile with its user attached
     * @return Percentage in [0, 100]
     */
    public int calculate(JobSeekerProfile profile) {
        int required = Math.max(0, config.getRequiredWeight());
        int optional = Math.max(0, config.getOptionalWeight());

        int total = 0;
        int earned = 0;

        User user = profile.getUser();
        boolean[] requiredChecks = {
                user != null && hasText(user.getFullName()),
                user != null && hasText(user.getEmail())
        };
        for (boolean check : requiredChecks) {
            total += required;
            earned += check ? required : 0;
        }

        boolean[] optionalChecks = {
                hasText(profile.getPhone()),
                hasText(profile.getHeadline()),
                hasItems(profile.getSkills()),
                profile.getExperienceYears() != null,
                hasItems(profile.getEducation()),
                hasItems(profile.getPreferredLocations()),
                hasText(profile.getResumeUrl())
        };
        for (boolean check : optionalChecks) {
            total += optional;
            earned += check ? optional : 0;
        }

        if (total == 0) {
            return 0;
        }
        int pct = (100 * earned) / total;
        return Math.max(0, Math.min(100, pct));
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private boolean hasItems(Collection<?> values) {
        return values != null && !values.isEmpty();
    }
}
