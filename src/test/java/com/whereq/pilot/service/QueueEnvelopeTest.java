package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import com.whereq.pilot.executor.BatchAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueEnvelopeTest {

    @Mock
    private BatchAdapterFactory adapterFactory;

    @Mock
    private BatchAdapter adapter;

    private PilotProperties properties;
    private QueueEnvelope envelope;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
        properties.setQueueHost("submit01.example.org");
        properties.getQueue().getResources().put("cpu", 1);
        properties.getQueue().getResources().put("memory", 4);

        envelope = new QueueEnvelope();
        ReflectionTestUtils.setField(envelope, "properties", properties);
        ReflectionTestUtils.setField(envelope, "adapterFactory", adapterFactory);
        when(adapterFactory.getAdapter()).thenReturn(adapter);
    }

    @Test
    void testEnvelopeCarriesSite() {
        // Given
        when(adapter.getSite()).thenReturn("NPX");

        // When
        envelope.initialize();

        // Then
        assertEquals("submit01.example.org", envelope.getQueueHost());
        assertEquals("NPX", envelope.getSite());
        assertEquals(Map.of("cpu", 1, "memory", 4, "site", "NPX"), envelope.getResources());
        assertTrue(envelope.getQueryParams().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> envelope.getResources().put("gpu", 2));
    }

    @Test
    void testGpuSite() {
        when(adapter.getSite()).thenReturn("Cluster-GPU");

        envelope.initialize();

        assertEquals(1, envelope.getResources().get("gpu"));
    }

    @Test
    void testCpuSite() {
        properties.getQueue().getResources().put("gpu", 2);
        when(adapter.getSite()).thenReturn("npx-cpu");

        envelope.initialize();

        assertEquals(0, envelope.getResources().get("gpu"));
    }

    @Test
    void testExclusiveSite() {
        properties.getQueue().setExclusive(true);
        when(adapter.getSite()).thenReturn("NPX");

        envelope.initialize();

        assertEquals(Map.of("requirements.site", "NPX"), envelope.getQueryParams());
    }

    @Test
    void testLocalHostNameWhenUnset() {
        properties.setQueueHost(" ");
        when(adapter.getSite()).thenReturn("NPX");

        envelope.initialize();

        assertNotNull(envelope.getQueueHost());
        assertFalse(envelope.getQueueHost().isBlank());
    }
}
