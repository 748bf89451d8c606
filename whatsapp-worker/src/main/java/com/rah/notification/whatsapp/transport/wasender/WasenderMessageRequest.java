package com.rah.notification.whatsapp.transport.wasender;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /send-message}. Only text messages are sent by this worker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WasenderMessageRequest {
    private String to;
    private String text;
}
