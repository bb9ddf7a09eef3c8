package com.mailmind.triage;

import com.mailmind.dispatch.BatchDispatcher;
import com.mailmind.dispatch.BatchResult;
import com.mailmind.dispatch.ItemResult;
import com.mailmind.dispatch.ItemStatus;
import com.mailmind.dispatch.ProgressListener;
import com.mailmind.dispatch.WorkItem;
import com.mailmind.exception.MailMindException;
import com.mailmind.priority.BaseClassification;
import com.mailmind.priority.EnrichedClassification;
import com.mailmind.priority.MessageRef;
import com.mailmind.priority.PriorityClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies a batch of messages: one prompt per message through the dispatcher,
 * then sender-aware enrichment of each parsed answer.
 */
public class TriageService {

    private static final Logger log = LoggerFactory.getLogger(TriageService.class);

    static final int MAX_BODY_CHARS = 2000;

    private final BatchDispatcher<String, String> dispatcher;
    private final PriorityClassifier classifier;
    private final BaseClassificationParser parser;
    private final Duration itemTimeout;

    public TriageService(BatchDispatcher<String, String> dispatcher, PriorityClassifier classifier,
                         Duration itemTimeout) {
        this(dispatcher, classifier, new BaseClassificationParser(), itemTimeout);
    }

    public TriageService(BatchDispatcher<String, String> dispatcher, PriorityClassifier classifier,
                         BaseClassificationParser parser, Duration itemTimeout) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.itemTimeout = Objects.requireNonNull(itemTimeout, "itemTimeout");
    }

    /**
     * Triage messages. Outcomes are in input order; failed inference calls and
     * messages whose classification could not be recorded produce an outcome
     * without classification.
     */
    public List<TriageOutcome> triage(List<TriageMessage> messages, ProgressListener progress) {
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) {
            return List.of();
        }

        List<WorkItem<String>> items = new ArrayList<>(messages.size());
        for (TriageMessage message : messages) {
            items.add(WorkItem.of(message.messageId(), buildPrompt(message)));
        }

        BatchResult<String> batch = dispatcher.processBatch(items, itemTimeout, progress);

        List<TriageOutcome> outcomes = new ArrayList<>(messages.size());
        int classified = 0;
        for (int i = 0; i < messages.size(); i++) {
            TriageMessage message = messages.get(i);
            ItemResult<String> result = batch.results().get(i);
            if (!result.isSuccess()) {
                outcomes.add(new TriageOutcome(message.messageId(), result.status(), null, result.error()));
                continue;
            }
            BaseClassification base = parser.parse(result.value());
            try {
                EnrichedClassification enriched = classifier.classifyPriority(
                        new MessageRef(message.messageId(), message.sender()), base);
                outcomes.add(new TriageOutcome(message.messageId(), result.status(), enriched, null));
                classified++;
            } catch (MailMindException e) {
                log.warn("Classification of message {} failed: {}", message.messageId(), e.getMessage(), e);
                outcomes.add(new TriageOutcome(message.messageId(), ItemStatus.ERROR, null,
                        "Classification failed: " + e.getMessage()));
            }
        }

        log.info("Triaged {} messages: {} classified, {} failed ({} emails/min)",
                batch.total(), classified, batch.total() - classified, String.format("%.1f", batch.throughput()));
        return outcomes;
    }

    static String buildPrompt(TriageMessage message) {
        String body = message.body();
        if (body.length() > MAX_BODY_CHARS) {
            body = body.substring(0, MAX_BODY_CHARS);
        }
        return "Classify the priority of this email as High, Medium or Low.\n"
                + "Respond only with JSON: {\"priority\": \"High|Medium|Low\", \"confidence\": 0.0-1.0}\n\n"
                + "From: " + message.sender() + "\n"
                + "Subject: " + message.subject() + "\n\n"
                + body;
    }
}
