package com.rah.notification.whatsapp.service;

import com.rah.notification.whatsapp.model.ComposeFields;
import org.springframework.stereotype.Component;

/**
 * Renders message templates. Placeholders are replaced literally, every occurrence,
 * with no escaping; unknown placeholders are left as they are.
 */
@Component
public class MessageComposer {

    public static final String NAME = "{{name}}";
    public static final String SERVICES = "{{services}}";
    public static final String DATE = "{{date}}";
    public static final String TIME = "{{time}}";

    public String compose(String template, ComposeFields fields) {
        if (template == null) {
            return "";
        }
        return template
            .replace(NAME, nullToEmpty(fields.name()))
            .replace(SERVICES, nullToEmpty(fields.services()))
            .replace(DATE, nullToEmpty(fields.date()))
            .replace(TIME, nullToEmpty(fields.time()));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
