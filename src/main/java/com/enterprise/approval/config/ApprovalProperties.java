package com.enterprise.approval.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

@Component
@ConfigurationProperties(prefix = "app.approval")
@Validated
@Getter
@Setter
public class ApprovalProperties {

    @Min(1)
    private int rejectCommentMinLength = 10;

    @Positive
    private int maxSteps = 10;

    @Positive
    private int maxSlaHours = 720; // 30 days
}
