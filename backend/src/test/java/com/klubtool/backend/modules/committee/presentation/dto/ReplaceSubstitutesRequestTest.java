package com.klubtool.backend.modules.committee.presentation.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ReplaceSubstitutesRequestTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void nullAssignmentIsRejected() {
        ReplaceSubstitutesRequest request = new ReplaceSubstitutesRequest(Arrays.asList(
                new SubstituteAssignment(UUID.randomUUID(), UUID.randomUUID()), null));

        Set<ConstraintViolation<ReplaceSubstitutesRequest>> violations = validator.validate(request);

        assertThat(violations).extracting(ConstraintViolation::getMessage).containsExactly("ASSIGNMENT_REQUIRED");
    }

    @Test
    void incompleteAssignmentIsRejected() {
        ReplaceSubstitutesRequest request = new ReplaceSubstitutesRequest(
                List.of(new SubstituteAssignment(UUID.randomUUID(), null)));

        assertThat(validator.validate(request))
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("SUBSTITUTE_REQUIRED");
    }
}
