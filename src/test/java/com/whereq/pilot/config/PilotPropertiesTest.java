package com.whereq.pilot.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PilotPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(new PilotProperties()).isEmpty());
    }

    @Test
    void testNestedSettingsAreValidated() {
        // Given
        PilotProperties properties = new PilotProperties();
        properties.getQueue().setConcurrency(0);
        properties.getQueue().setSubmitAttempts(0);
        properties.getRest().setUrl(" ");

        // When
        Set<ConstraintViolation<PilotProperties>> violations = validator.validate(properties);

        // Then
        Set<String> paths = violations.stream()
            .map(violation -> violation.getPropertyPath().toString())
            .collect(Collectors.toSet());
        assertEquals(Set.of("queue.concurrency", "queue.submitAttempts", "rest.url"), paths);
    }
}
