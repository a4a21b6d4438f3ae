package com.enterprise.approval.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

@Component
@ConfigurationProperties(prefix = "app.sla")
@Validated
@Getter
@Setter
public class SlaProperties {

    @Positive
    private int warningThresholdHours = 4;

    private Escalation escalation = new Escalation();

    @Getter
    @Setter
    public static class Escalation {

        private boolean enabled = false;

        @Positive
        private long intervalMs = 300000; // 5 minutes
    }
}
