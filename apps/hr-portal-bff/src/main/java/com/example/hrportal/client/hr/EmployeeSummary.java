package com.example.hrportal.client.hr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

import java.time.LocalDate;

/**
 * Row of the employee directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmployeeSummary(
        @JsonProperty("id") long id,
        @JsonProperty("employee_id") @Nullable String employeeId,
        @JsonProperty("name") String name,
        @JsonProperty("email") String email,
        @JsonProperty("phone") @Nullable String phone,
        @JsonProperty("job_role") @Nullable String jobRole,
        @JsonProperty("department") @Nullable String department,
        @JsonProperty("team") @Nullable String team,
        @JsonProperty("manager") @Nullable String manager,
        @JsonProperty("role") String role,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("hire_date") @Nullable LocalDate hireDate
) {
}
