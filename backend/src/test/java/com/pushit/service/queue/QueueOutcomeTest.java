package com.pushit.service.queue;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueOutcomeTest {

    private Locale original;

    @BeforeEach
    void setUp() {
        original = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(original);
    }

    @Test
    void label_IsLowerCaseName() {
        assertEquals("approved", QueueOutcome.APPROVED.label());
        assertEquals("pending", QueueOutcome.PENDING.label());
    }

    @Test
    void label_TurkishDefaultLocale_KeepsDottedI() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        assertEquals("skipped", QueueOutcome.SKIPPED.label());
    }
}
