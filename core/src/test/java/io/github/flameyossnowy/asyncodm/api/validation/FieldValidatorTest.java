package io.github.flameyossnowy.asyncodm.api.validation;

import io.github.flameyossnowy.asyncodm.api.annotations.MaxLength;
import io.github.flameyossnowy.asyncodm.api.annotations.NonNull;
import io.github.flameyossnowy.asyncodm.api.annotations.Range;
import io.github.flameyossnowy.asyncodm.api.annotations.Repository;
import io.github.flameyossnowy.asyncodm.api.exceptions.ValidationException;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldData;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldValidatorTest {
    private ModelInformation information;

    @BeforeEach
    void setup() {
        ModelRegistry.clear();
        ModelRegistry.register(Product.class);
        information = ModelRegistry.get(Product.class);
    }

    @AfterEach
    void cleanup() {
        ModelRegistry.clear();
    }

    @Test
    void required_field_rejects_blank_values() {
        FieldData<?> name = information.getField("name");

        assertEquals(FieldValidator.REQUIRED, violation(name, null).getConstraint());
        assertEquals(FieldValidator.REQUIRED, violation(name, "").getConstraint());
        assertDoesNotThrow(() -> FieldValidator.validate(name, "Lamp"));
    }

    @Test
    void required_list_rejects_empty_list() {
        FieldData<?> labels = information.getField("labels");

        ValidationException e = violation(labels, List.of());
        assertEquals("labels", e.getField());
        assertEquals(FieldValidator.REQUIRED, e.getConstraint());
    }

    @Test
    void optional_field_accepts_null() {
        assertDoesNotThrow(() -> FieldValidator.validate(information.getField("price"), null));
        assertDoesNotThrow(() -> FieldValidator.validate(information.getField("attributes"), Map.of()));
    }

    @Test
    void range_is_inclusive() {
        FieldData<?> price = information.getField("price");

        assertDoesNotThrow(() -> FieldValidator.validate(price, 0.0));
        assertDoesNotThrow(() -> FieldValidator.validate(price, 1000.0));
        assertEquals(FieldValidator.MIN, violation(price, -0.5).getConstraint());
        assertEquals(FieldValidator.MAX, violation(price, 1000.01).getConstraint());
    }

    @Test
    void range_applies_to_every_list_element() {
        FieldData<?> ratings = information.getField("ratings");

        assertDoesNotThrow(() -> FieldValidator.validate(ratings, List.of(1, 5)));
        assertEquals(FieldValidator.MAX, violation(ratings, List.of(3, 6)).getConstraint());
    }

    @Test
    void max_length_checks_strings_and_lists() {
        assertEquals(FieldValidator.MAX_LENGTH, violation(information.getField("name"), "a".repeat(11)).getConstraint());
        assertDoesNotThrow(() -> FieldValidator.validate(information.getField("name"), "a".repeat(10)));
        assertEquals(FieldValidator.MAX_LENGTH, violation(information.getField("labels"), List.of("a", "b", "c")).getConstraint());
    }

    @Test
    void nested_violation_prefixes_the_parent_field() {
        ValidationException nested = violation(information.getField("name"), null).nestedIn("items.0");

        assertEquals("items.0.name", nested.getField());
        assertEquals(FieldValidator.REQUIRED, nested.getConstraint());
    }

    private static ValidationException violation(FieldData<?> field, Object value) {
        return assertThrows(ValidationException.class, () -> FieldValidator.validate(field, value));
    }

    @Repository
    static class Product {
        ObjectId id;

        @NonNull
        @MaxLength(10)
        String name;

        @Range(min = 0, max = 1000)
        Double price;

        @Range(min = 1, max = 5)
        List<Integer> ratings;

        @NonNull
        @MaxLength(2)
        List<String> labels;

        Map<String, String> attributes;
    }
}
