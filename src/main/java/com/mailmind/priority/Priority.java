package com.mailmind.priority;

import com.mailmind.exception.ValidationException;

/**
 * Ordinal priority tier, ordered {@code LOW < MEDIUM < HIGH}.
 */
public enum Priority {
    LOW("Low", "🔵"),
    MEDIUM("Medium", "🟡"),
    HIGH("High", "🔴");

    private final String label;
    private final String indicator;

    Priority(String label, String indicator) {
        this.label = label;
        this.indicator = indicator;
    }

    public String label() {
        return label;
    }

    /**
     * Visual tier indicator shown next to the message (blue, yellow, red circle).
     */
    public String indicator() {
        return indicator;
    }

    /**
     * One tier up, capped at HIGH.
     */
    public Priority upgrade() {
        return this == LOW ? MEDIUM : HIGH;
    }

    /**
     * One tier down, floored at LOW.
     */
    public Priority downgrade() {
        return this == HIGH ? MEDIUM : LOW;
    }

    public boolean isAbove(Priority other) {
        return compareTo(other) > 0;
    }

    public boolean isBelow(Priority other) {
        return compareTo(other) < 0;
    }

    /**
     * Parse a tier label such as "High" or "medium".
     *
     * @throws ValidationException if the label is not a known tier
     */
    public static Priority fromLabel(String label) {
        if (label != null) {
            for (Priority priority : values()) {
                if (priority.label.equalsIgnoreCase(label.trim())) {
                    return priority;
                }
            }
        }
        throw new ValidationException("Unknown priority: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
