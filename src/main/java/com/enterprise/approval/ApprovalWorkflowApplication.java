package com.enterprise.approval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import lombok.extern.slf4j.Slf4j;

/**
 * Main application class for the Approval Workflow Service.
 *
 * <p>
 * Requests move through a sequence of approval steps copied from a versioned
 * workflow definition when the request is submitted:
 * </p>
 *
 * <ul>
 * <li>Role-based approve, reject, escalate and delegate actions per step</li>
 * <li>Per-step SLA deadlines with warning and overdue queries</li>
 * <li>Append-only audit ledger of every transition</li>
 * <li>JWT-based authentication</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
@EnableScheduling
@Slf4j
public class ApprovalWorkflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApprovalWorkflowApplication.class, args);
        log.info("=================================================");
        log.info("  Approval Workflow Service Started Successfully");
        log.info("=================================================");
        log.info("  Swagger UI: http://localhost:8080/swagger-ui.html");
        log.info("  Health Check: http://localhost:8080/api/v1/health");
        log.info("=================================================");
    }
}
