package com.example.hrportal.client.hr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Row of the job listings table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobListing(
        @JsonProperty("id") long id,
        @JsonProperty("position") String position,
        @JsonProperty("department_id") Long departmentId,
        @JsonProperty("department_name") @Nullable String departmentName,
        @JsonProperty("experience_required") @Nullable String experienceRequired,
        @JsonProperty("skills_required") @Nullable String skillsRequired,
        @JsonProperty("location") @Nullable String location,
        @JsonProperty("employment_type") String employmentType,
        @JsonProperty("salary_range") @Nullable String salaryRange,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("posted_by_name") @Nullable String postedByName,
        @JsonProperty("posted_date") @Nullable LocalDateTime postedDate,
        @JsonProperty("application_deadline") @Nullable LocalDate applicationDeadline,
        @JsonProperty("application_count") @Nullable Integer applicationCount
) {
    private static final int DEADLINE_WARNING_DAYS = 7;

    /**
     * True when the deadline is today or within the next week.
     */
    public boolean isDeadlineApproaching(@NonNull LocalDate today) {
        if (applicationDeadline == null) {
            return false;
        }
        long daysLeft = ChronoUnit.DAYS.between(today, applicationDeadline);
        return daysLeft >= 0 && daysLeft <= DEADLINE_WARNING_DAYS;
    }

    public boolean isDeadlinePassed(@NonNull LocalDate today) {
        return applicationDeadline != null && applicationDeadline.isBefore(today);
    }

    @NonNull
    public String employmentTypeLabel() {
        return EmploymentType.labelFor(employmentType);
    }
}
