package com.mailmind.store;

import com.mailmind.priority.ClassificationEvent;
import com.mailmind.priority.CorrectionEvent;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Process-local classification log. Contents are lost on restart.
 */
public class InMemoryClassificationLog implements ClassificationLog {

    private final ConcurrentLinkedQueue<ClassificationEvent> classifications = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CorrectionEvent> corrections = new ConcurrentLinkedQueue<>();

    @Override
    public void appendClassification(ClassificationEvent event) {
        classifications.add(event);
    }

    @Override
    public void appendCorrection(CorrectionEvent event) {
        corrections.add(event);
    }

    @Override
    public long countClassifications(Instant after, Instant until) {
        return classifications.stream()
                .filter(e -> inRange(e.timestamp(), after, until))
                .count();
    }

    @Override
    public long countCorrections(Instant after, Instant until) {
        return corrections.stream()
                .filter(e -> inRange(e.timestamp(), after, until))
                .count();
    }

    @Override
    public List<CorrectionEvent> correctionsForSender(String sender, Instant after, Instant until) {
        return corrections.stream()
                .filter(e -> e.sender().equals(sender) && inRange(e.timestamp(), after, until))
                .sorted(Comparator.comparing(CorrectionEvent::timestamp))
                .collect(Collectors.toList());
    }

    @Override
    public List<ClassificationEvent> classificationsForSender(String sender, Instant after, Instant until) {
        return classifications.stream()
                .filter(e -> e.sender().equals(sender) && inRange(e.timestamp(), after, until))
                .sorted(Comparator.comparing(ClassificationEvent::timestamp))
                .collect(Collectors.toList());
    }

    private static boolean inRange(Instant timestamp, Instant after, Instant until) {
        return timestamp.isAfter(after) && !timestamp.isAfter(until);
    }
}
