package com.rah.notification.common.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a {@code send-whatsapp} job.
 *
 * {@code appointmentId} and {@code eventType} are optional; when both are present
 * the worker records an appointment event of that type after a successful send.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendWhatsAppJobPayload {
    private String phone;
    private String message;
    private String appointmentId;
    private String eventType;
}
