package com.landawn.abacus.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.landawn.abacus.publisher.validation.Translator;

public class PublisherSettingsTest {

    private final PublisherSettings original = PublisherSettings.getDefault();

    @AfterEach
    public void tearDown() {
        PublisherSettings.setDefault(original);
        RequestInfo.unbind();
    }

    @Test
    public void testDefaults() {
        PublisherSettings settings = new PublisherSettings();

        assertTrue(settings.isCheckFieldIntegrity());
        assertFalse(settings.isDevMode());
        assertSame(Translator.IDENTITY, settings.getTranslator());
        assertEquals("127.0.0.1", settings.getDefaultClientIp());
        assertEquals(settings, PublisherSettings.builder().clock(settings.getClock()).build());
    }

    @Test
    public void testSetDefault() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC);
        PublisherSettings settings = PublisherSettings.builder().devMode(true).clock(clock).defaultClientIp("10.0.0.1").build();

        PublisherSettings.setDefault(settings);

        assertSame(settings, PublisherSettings.getDefault());
        assertThrows(IllegalArgumentException.class, () -> PublisherSettings.setDefault(null));
    }

    @Test
    public void testRequestInfo() throws InterruptedException {
        assertNull(RequestInfo.current());

        RequestInfo info = new RequestInfo("10.0.0.7", "curl/8.0", null);
        RequestInfo.bind(info);

        final RequestInfo[] inOtherThread = { info };
        Thread thread = new Thread(() -> inOtherThread[0] = RequestInfo.current());
        thread.start();
        thread.join();

        assertSame(info, RequestInfo.current());
        assertNull(inOtherThread[0]);

        RequestInfo.unbind();
        assertNull(RequestInfo.current());
    }
}
