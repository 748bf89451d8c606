package com.rah.notification.whatsapp.service;

import com.rah.notification.whatsapp.model.ComposeFields;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageComposerTest {

    private final MessageComposer composer = new MessageComposer();

    @Test
    void testCompose_ReplacesAllPlaceholders() {
        String message = composer.compose(
            "Olá {{name}}! {{services}} em {{date}} às {{time}}.",
            new ComposeFields("Ana", "Corte", "09/02/2026", "12:00"));

        assertEquals("Olá Ana! Corte em 09/02/2026 às 12:00.", message);
    }

    @Test
    void testCompose_ReplacesEveryOccurrence() {
        String message = composer.compose("{{name}}, {{name}}, {{name}}",
            new ComposeFields("Ana", null, null, null));

        assertEquals("Ana, Ana, Ana", message);
    }

    @Test
    void testCompose_NullFieldsBecomeEmpty() {
        assertEquals("Oi , até ", composer.compose("Oi {{name}}, até {{time}}",
            new ComposeFields(null, null, null, null)));
    }

    @Test
    void testCompose_NoEscapingAndUnknownPlaceholdersKept() {
        String message = composer.compose("{{name}} <b>{{other}}</b>",
            new ComposeFields("$1 & <Ana>", null, null, null));

        assertEquals("$1 & <Ana> <b>{{other}}</b>", message);
    }

    @Test
    void testCompose_NullTemplate_Empty() {
        assertEquals("", composer.compose(null, new ComposeFields("Ana", null, null, null)));
    }
}
