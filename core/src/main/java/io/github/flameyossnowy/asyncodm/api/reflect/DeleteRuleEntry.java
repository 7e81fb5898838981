package io.github.flameyossnowy.asyncodm.api.reflect;

import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;

/**
 * A delete rule registered on a referenced model.
 * @param referencingType the model holding the reference
 * @param field the reference field of {@code referencingType}
 * @param rule what happens to referencing documents when a referenced document is deleted
 */
public record DeleteRuleEntry(Class<?> referencingType, FieldData<?> field, DeleteRule rule) {
}
