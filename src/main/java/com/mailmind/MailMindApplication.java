package com.mailmind;

import com.mailmind.pool.InferencePool;
import com.mailmind.priority.AccuracyReport;
import com.mailmind.priority.Priority;
import com.mailmind.priority.PriorityClassifier;
import com.mailmind.spring.EnableMailMind;
import com.mailmind.triage.TriageMessage;
import com.mailmind.triage.TriageOutcome;
import com.mailmind.triage.TriageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application triaging a small inbox against a local Ollama.
 */
@SpringBootApplication
@EnableMailMind
public class MailMindApplication {

    private static final Logger log = LoggerFactory.getLogger(MailMindApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MailMindApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TriageService triageService, PriorityClassifier classifier, InferencePool pool) {
        return args -> {
            log.info("=== MailMind Demo Started ===");
            log.info("Pool stats: {}", pool.stats());

            classifier.setSenderVip("ceo@example.com", true);

            List<TriageMessage> inbox = List.of(
                    new TriageMessage("m-1", "ceo@example.com", "Board meeting moved",
                            "The board meeting is now tomorrow at 9am. Please confirm attendance."),
                    new TriageMessage("m-2", "newsletter@example.com", "Weekly digest",
                            "Top stories this week in gardening."),
                    new TriageMessage("m-3", "ops@example.com", "Production outage",
                            "The payment service is down since 02:10 UTC. Incident call is open."),
                    new TriageMessage("m-4", "friend@example.com", "Lunch?",
                            "Free for lunch on Friday?")
            );

            List<TriageOutcome> outcomes = triageService.triage(inbox,
                    (done, total) -> log.info("Progress: {}/{}", done, total));

            for (TriageOutcome outcome : outcomes) {
                if (outcome.isSuccess()) {
                    log.info("{} {} {} (base {}, confidence {})",
                            outcome.classification().visualIndicator(), outcome.messageId(),
                            outcome.classification().priority(), outcome.classification().basePriority(),
                            outcome.classification().confidence());
                } else {
                    log.warn("{} failed: {} ({})", outcome.messageId(), outcome.status(), outcome.error());
                }
            }

            // The user disagrees with the newsletter classification
            outcomes.stream()
                    .filter(o -> o.isSuccess() && o.messageId().equals("m-2"))
                    .findFirst()
                    .ifPresent(o -> classifier.recordUserOverride("m-2", "newsletter@example.com",
                            o.classification().priority(), o.classification().confidence(),
                            Priority.LOW, "not important"));

            AccuracyReport report = classifier.getClassificationAccuracy(7);
            log.info("Accuracy: {}% (target met: {}, trend: {})",
                    String.format("%.1f", report.accuracyPercentage()), report.targetMet(), report.trend());
            log.info("=== MailMind Demo Completed ===");
        };
    }
}
