package com.rah.notification.common.job;

import java.util.Arrays;

/**
 * Job kinds understood by the WhatsApp worker.
 *
 * Each kind maps to its own Kafka topic so that every kind gets an independent
 * consumer and an independent in-flight slot. Failed jobs that exhaust their
 * retries land on the matching dead-letter topic.
 */
public enum JobKind {

    /**
     * Scheduled reminder for an upcoming appointment.
     * Payload: {@link ReminderJobPayload}
     */
    APPOINTMENT_REMINDER("appointment-reminder"),

    /**
     * Immediate text message (booking confirmations and similar).
     * Payload: {@link SendWhatsAppJobPayload}
     */
    SEND_WHATSAPP("send-whatsapp");

    private final String topic;

    JobKind(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }

    public String getDlqTopic() {
        return topic + "-dlq";
    }

    /**
     * Resolve a job kind from its topic name (the name used by producers).
     *
     * @throws IllegalArgumentException if no kind uses the topic
     */
    public static JobKind fromTopic(String topic) {
        return Arrays.stream(values())
            .filter(kind -> kind.topic.equals(topic))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown job topic: " + topic + ". Available: " + Arrays.toString(values())));
    }
}
