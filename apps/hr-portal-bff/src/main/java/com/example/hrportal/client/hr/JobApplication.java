package com.example.hrportal.client.hr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Row of the HR applications table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobApplication(
        @JsonProperty("id") long id,
        @JsonProperty("job_id") long jobId,
        @JsonProperty("job_position") @Nullable String jobPosition,
        @JsonProperty("job_department") @Nullable String jobDepartment,
        @JsonProperty("applicant_name") String applicantName,
        @JsonProperty("applicant_email") String applicantEmail,
        @JsonProperty("applicant_phone") @Nullable String applicantPhone,
        @JsonProperty("source") String source,
        @JsonProperty("referrer_name") @Nullable String referrerName,
        @JsonProperty("status") String status,
        @JsonProperty("screening_score") @Nullable Double screeningScore,
        @JsonProperty("applied_date") @Nullable LocalDateTime appliedDate,
        @JsonProperty("reviewed_date") @Nullable LocalDateTime reviewedDate
) {
    @NonNull
    public Optional<ApplicationStatus> applicationStatus() {
        return ApplicationStatus.fromCode(status);
    }
}
