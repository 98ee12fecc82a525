package me.golemcore.recall.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTitleSupportTest {

    @Test
    void shouldMatchTitlesIgnoringCaseAndPunctuation() {
        assertTrue(EventTitleSupport.isDuplicate("Netflix renewal!", "netflix   RENEWAL"));
    }

    @Test
    void shouldMatchNearlyIdenticalContainment() {
        assertTrue(EventTitleSupport.isDuplicate("Dinner with Priya", "Dinner with Priya."));
        assertTrue(EventTitleSupport.isDuplicate("Goa trip plans", "Goa trip plan"));
    }

    @Test
    void shouldNotMatchShortTitleInsideLongerOne() {
        assertFalse(EventTitleSupport.isDuplicate("Meeting", "Meeting with Nityam at 5pm"));
    }

    @Test
    void shouldNotMatchBlankTitles() {
        assertFalse(EventTitleSupport.isDuplicate(null, "Meeting"));
        assertFalse(EventTitleSupport.isDuplicate("!!", "??"));
    }

    @Test
    void shouldNormalizePunctuationToSpaces() {
        assertEquals("call mom re insurance", EventTitleSupport.normalize("Call  Mom: re-insurance"));
        assertEquals("", EventTitleSupport.normalize(null));
    }
}
