package com.mailmind.priority;

import com.mailmind.config.ClassifierConfig;
import com.mailmind.exception.ValidationException;
import com.mailmind.store.ClassificationLog;
import com.mailmind.store.PreferenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of PriorityClassifier.
 *
 * <p>Each sender seen by this instance has a {@link SenderState}: a volatile
 * profile snapshot, an atomic email counter and a write lock. Classification only
 * reads the snapshot and bumps the counter, so it never waits on a correction.
 * Corrections and VIP changes for one sender run under that sender's lock and
 * publish a new snapshot after it has been persisted; different senders do not
 * contend.
 *
 * <p>A sender gets a persisted profile on its first correction or VIP change.
 * Email counts of persisted senders are written with every profile write and on
 * {@link #flush()}, which also evicts senders that were never persisted.
 */
public class DefaultPriorityClassifier implements PriorityClassifier {

    private static final Logger log = LoggerFactory.getLogger(DefaultPriorityClassifier.class);

    private final PreferenceStore preferences;
    private final ClassificationLog classificationLog;
    private final ClassifierConfig config;
    private final LearningCurve learningCurve;
    private final Clock clock;
    private final SenderProfileCodec codec = new SenderProfileCodec();
    private final Map<String, SenderState> senders = new ConcurrentHashMap<>();

    public DefaultPriorityClassifier(PreferenceStore preferences, ClassificationLog classificationLog,
                                     ClassifierConfig config) {
        this(preferences, classificationLog, config, Clock.systemUTC());
    }

    public DefaultPriorityClassifier(PreferenceStore preferences, ClassificationLog classificationLog,
                                     ClassifierConfig config, Clock clock) {
        this(preferences, classificationLog, config,
                new DiminishingLearningCurve(config.baseLearningRate()), clock);
    }

    public DefaultPriorityClassifier(PreferenceStore preferences, ClassificationLog classificationLog,
                                     ClassifierConfig config, LearningCurve learningCurve, Clock clock) {
        if (preferences == null || classificationLog == null || config == null
                || learningCurve == null || clock == null) {
            throw new NullPointerException("Classifier collaborators cannot be null");
        }
        this.preferences = preferences;
        this.classificationLog = classificationLog;
        this.config = config;
        this.learningCurve = learningCurve;
        this.clock = clock;

        log.info("PriorityClassifier initialized (upper={}, lower={}, base rate={}, target={}%)",
                config.upperThreshold(), config.lowerThreshold(), config.baseLearningRate(),
                config.accuracyTarget());
    }

    @Override
    public EnrichedClassification classifyPriority(MessageRef message, BaseClassification base) {
        if (message == null) {
            throw new ValidationException("Message cannot be null");
        }
        if (base == null) {
            throw new ValidationException("Base classification cannot be null");
        }

        String senderKey = SenderProfile.keyOf(message.sender());
        SenderState state = stateFor(senderKey);
        state.emailCount.incrementAndGet();
        SenderProfile profile = state.profile;

        int adjustment = adjustmentFor(profile);
        Priority priority = base.priority();
        if (adjustment > 0) {
            priority = priority.upgrade();
        } else if (adjustment < 0) {
            priority = priority.downgrade();
        }

        classificationLog.appendClassification(new ClassificationEvent(
                message.messageId(), senderKey, priority, base.priority(), base.confidence(), clock.instant()));

        log.debug("Priority classification for {}: {} -> {} (importance={}, vip={})",
                message.messageId(), base.priority(), priority,
                String.format("%.2f", profile.importance()), profile.vip());

        return new EnrichedClassification(
                message.messageId(),
                senderKey,
                priority,
                base.confidence(),
                base.priority(),
                profile.importance(),
                profile.vip(),
                adjustment,
                priority.indicator()
        );
    }

    /**
     * +1 for VIP or high-importance senders, -1 for low-importance senders, else 0.
     */
    private int adjustmentFor(SenderProfile profile) {
        if (profile.vip() || profile.importance() > config.upperThreshold()) {
            return 1;
        }
        if (profile.importance() < config.lowerThreshold()) {
            return -1;
        }
        return 0;
    }

    @Override
    public void recordUserOverride(String messageId, String sender, Priority originalPriority,
                                   double originalConfidence, Priority userPriority, String reason) {
        requireText(messageId, "Message id");
        requireText(sender, "Sender");
        if (originalPriority == null || userPriority == null) {
            throw new ValidationException("Original and user priority are required");
        }
        if (Double.isNaN(originalConfidence) || originalConfidence < 0.0 || originalConfidence > 1.0) {
            throw new ValidationException("Original confidence must be within [0, 1], got " + originalConfidence);
        }

        String senderKey = SenderProfile.keyOf(sender);
        SenderState state = lockState(senderKey);
        try {
            Instant now = clock.instant();
            CorrectionEvent event = new CorrectionEvent(messageId, senderKey, originalPriority,
                    originalConfidence, userPriority, reason, CorrectionType.fromReason(reason), now);

            SenderProfile current = state.profile;
            int direction = event.direction();
            double step = direction == 0 ? 0.0 : learningCurve.step(current.correctionCount());
            double importance = clamp(current.importance() + direction * step);

            SenderProfile updated = current.withCorrection(importance, now)
                    .withEmailCount(state.emailCount.get());
            persist(state, updated);
            // Logged only once the profile is stored, so a failed write leaves no correction behind
            classificationLog.appendCorrection(event);

            log.info("Recorded user override for {}: {} -> {} ({}), sender {} importance {} -> {}",
                    messageId, originalPriority, userPriority, event.correctionType(), senderKey,
                    String.format("%.3f", current.importance()), String.format("%.3f", importance));
        } finally {
            state.writeLock.unlock();
        }
    }

    @Override
    public void setSenderVip(String sender, boolean vip) {
        requireText(sender, "Sender");
        String senderKey = SenderProfile.keyOf(sender);
        SenderState state = lockState(senderKey);
        try {
            SenderProfile updated = state.profile.withVip(vip, clock.instant())
                    .withEmailCount(state.emailCount.get());
            persist(state, updated);
            log.info("Set VIP status for {}: {}", senderKey, vip);
        } finally {
            state.writeLock.unlock();
        }
    }

    @Override
    public Optional<SenderProfile> getSenderStats(String sender) {
        requireText(sender, "Sender");
        String senderKey = SenderProfile.keyOf(sender);

        SenderState state = senders.get(senderKey);
        if (state == null) {
            Optional<SenderProfile> stored = loadProfile(senderKey);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            state = register(senderKey, new SenderState(stored.get(), true));
        }
        return Optional.of(state.profile.withEmailCount(state.emailCount.get()));
    }

    @Override
    public AccuracyReport getClassificationAccuracy(int days) {
        if (days <= 0) {
            throw new ValidationException("Accuracy window must be at least one day, got " + days);
        }

        Instant until = clock.instant();
        Duration window = Duration.ofDays(days);
        Instant after = until.minus(window);
        Instant middle = after.plus(window.dividedBy(2));

        long classified = classificationLog.countClassifications(after, until);
        long corrected = classificationLog.countCorrections(after, until);
        double accuracy = accuracy(classified, corrected);

        AccuracyTrend trend = trend(
                classificationLog.countClassifications(after, middle),
                classificationLog.countCorrections(after, middle),
                classificationLog.countClassifications(middle, until),
                classificationLog.countCorrections(middle, until));

        AccuracyReport report = new AccuracyReport(days, classified, corrected, accuracy,
                accuracy >= config.accuracyTarget(), trend);

        log.info("Classification accuracy ({} days): {}% ({} classified, {} corrected, trend: {})",
                days, String.format("%.1f", accuracy), classified, corrected, trend);
        return report;
    }

    private static double accuracy(long classified, long corrected) {
        if (classified == 0) {
            return 0.0;
        }
        // Corrections can outnumber logged classifications after a log reset
        return Math.max(0.0, (classified - corrected) * 100.0 / classified);
    }

    private AccuracyTrend trend(long firstClassified, long firstCorrected,
                                long secondClassified, long secondCorrected) {
        if (firstClassified == 0 || secondClassified == 0) {
            return AccuracyTrend.INSUFFICIENT_DATA;
        }
        double delta = accuracy(secondClassified, secondCorrected) - accuracy(firstClassified, firstCorrected);
        if (delta > config.trendTolerance()) {
            return AccuracyTrend.IMPROVING;
        }
        if (delta < -config.trendTolerance()) {
            return AccuracyTrend.DECLINING;
        }
        return AccuracyTrend.STABLE;
    }

    /**
     * Persist pending email counts of tracked senders and drop untracked senders
     * from memory. Untracked senders have nothing stored, so their in-memory email
     * counts start over the next time they are seen.
     */
    @Override
    public void flush() {
        int written = 0;
        int evicted = 0;
        for (Map.Entry<String, SenderState> entry : senders.entrySet()) {
            SenderState state = entry.getValue();
            if (state.tracked && state.emailCount.get() == state.profile.emailCount()) {
                continue;
            }
            state.writeLock.lock();
            try {
                if (!state.tracked) {
                    state.retired = true;
                    senders.remove(entry.getKey(), state);
                    evicted++;
                    continue;
                }
                long count = state.emailCount.get();
                if (count != state.profile.emailCount()) {
                    persist(state, state.profile.withEmailCount(count));
                    written++;
                }
            } finally {
                state.writeLock.unlock();
            }
        }
        log.debug("Flushed email counts for {} senders, evicted {} untracked senders", written, evicted);
    }

    @Override
    public void close() {
        flush();
        log.info("PriorityClassifier closed ({} senders in memory)", senders.size());
    }

    /**
     * Number of senders currently held in memory.
     */
    public int getCachedSenderCount() {
        return senders.size();
    }

    // Must hold state.writeLock
    private void persist(SenderState state, SenderProfile profile) {
        preferences.set(SenderProfileCodec.preferenceKey(profile.senderKey()), codec.encode(profile));
        state.profile = profile;
        state.tracked = true;
    }

    /**
     * Lock the registered state of a sender. A state retired by {@link #flush()}
     * while we waited for its lock is no longer registered, so look it up again.
     */
    private SenderState lockState(String senderKey) {
        while (true) {
            SenderState state = stateFor(senderKey);
            state.writeLock.lock();
            if (!state.retired) {
                return state;
            }
            state.writeLock.unlock();
        }
    }

    private SenderState stateFor(String senderKey) {
        SenderState state = senders.get(senderKey);
        if (state != null) {
            return state;
        }
        SenderState loaded = loadProfile(senderKey)
                .map(profile -> new SenderState(profile, true))
                .orElseGet(() -> new SenderState(SenderProfile.neutral(senderKey, clock.instant()), false));
        return register(senderKey, loaded);
    }

    private SenderState register(String senderKey, SenderState state) {
        SenderState existing = senders.putIfAbsent(senderKey, state);
        return existing != null ? existing : state;
    }

    private Optional<SenderProfile> loadProfile(String senderKey) {
        return preferences.get(SenderProfileCodec.preferenceKey(senderKey)).map(codec::decode);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " cannot be blank");
        }
    }

    private static final class SenderState {

        final ReentrantLock writeLock = new ReentrantLock();
        final AtomicLong emailCount;
        volatile SenderProfile profile;
        volatile boolean tracked;
        // Set under writeLock when flush() drops the state from the sender map
        volatile boolean retired;

        SenderState(SenderProfile profile, boolean tracked) {
            this.profile = profile;
            this.tracked = tracked;
            this.emailCount = new AtomicLong(profile.emailCount());
        }
    }
}
