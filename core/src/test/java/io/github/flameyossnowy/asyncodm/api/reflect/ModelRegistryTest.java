package io.github.flameyossnowy.asyncodm.api.reflect;

import io.github.flameyossnowy.asyncodm.api.IndexOptions;
import io.github.flameyossnowy.asyncodm.api.Ref;
import io.github.flameyossnowy.asyncodm.api.annotations.Embedded;
import io.github.flameyossnowy.asyncodm.api.annotations.Id;
import io.github.flameyossnowy.asyncodm.api.annotations.Reference;
import io.github.flameyossnowy.asyncodm.api.annotations.Repository;
import io.github.flameyossnowy.asyncodm.api.annotations.Unique;
import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;
import io.github.flameyossnowy.asyncodm.api.exceptions.ModelDefinitionException;
import io.github.flameyossnowy.asyncodm.api.models.Address;
import io.github.flameyossnowy.asyncodm.api.models.Post;
import io.github.flameyossnowy.asyncodm.api.models.User;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    @BeforeEach
    void setup() {
        ModelRegistry.clear();
    }

    @AfterEach
    void cleanup() {
        ModelRegistry.clear();
    }

    @Test
    void register_adds_referenced_and_embedded_models() {
        ModelRegistry.register(Post.class);

        assertNotNull(ModelRegistry.find(Post.class));
        assertNotNull(ModelRegistry.find(User.class));
        assertTrue(ModelRegistry.get(Address.class).isEmbedded());
    }

    @Test
    void register_twice_is_a_no_op() {
        ModelRegistry.register(User.class);
        ModelInformation first = ModelRegistry.get(User.class);

        ModelRegistry.register(User.class);

        assertSame(first, ModelRegistry.get(User.class));
    }

    @Test
    void collection_name_defaults_to_snake_case_of_class_name() {
        ModelRegistry.register(BlogEntry.class, User.class);

        assertEquals("blog_entry", ModelRegistry.get(BlogEntry.class).getCollectionName());
        assertEquals("users", ModelRegistry.get(User.class).getCollectionName());
        assertNull(ModelRegistry.get(Address.class).getCollectionName());
    }

    @Test
    void primary_key_is_stored_as_underscore_id() {
        ModelRegistry.register(Post.class);

        FieldData<?> implicit = ModelRegistry.get(Post.class).getPrimaryKey();
        assertEquals("id", implicit.name());
        assertEquals("_id", implicit.wireName());

        FieldData<?> declared = ModelRegistry.get(User.class).getPrimaryKey();
        assertEquals("email", declared.name());
        assertEquals("_id", declared.wireName());
    }

    @Test
    void fields_are_classified_by_kind() {
        ModelRegistry.register(Post.class);
        ModelInformation post = ModelRegistry.get(Post.class);

        FieldData<?> author = post.getField("author");
        assertEquals(FieldKind.REFERENCE, author.kind());
        assertFalse(author.list());
        assertEquals(User.class, author.valueType());

        FieldData<?> likedBy = post.getField("likedBy");
        assertEquals(FieldKind.REFERENCE, likedBy.kind());
        assertTrue(likedBy.list());

        FieldData<?> tags = post.getField("tags");
        assertEquals(FieldKind.SCALAR, tags.kind());
        assertEquals(String.class, tags.valueType());

        assertEquals(FieldKind.EMBEDDED, ModelRegistry.get(User.class).getField("address").kind());
        assertEquals(List.of(author, likedBy), post.getReferenceFields());
    }

    @Test
    void named_fields_use_their_stored_name() {
        ModelRegistry.register(User.class);
        ModelInformation address = ModelRegistry.get(Address.class);

        assertEquals("zip_code", address.getField("zipCode").wireName());
        assertSame(address.getField("zipCode"), address.getFieldByWireName("zip_code"));
    }

    @Test
    void delete_rules_are_recorded_on_the_referenced_model() {
        ModelRegistry.register(Post.class);

        List<DeleteRuleEntry> rules = ModelRegistry.get(User.class).getDeleteRules();

        assertEquals(2, rules.size());
        assertEquals(Post.class, rules.get(0).referencingType());
        assertEquals("author", rules.get(0).field().name());
        assertEquals(DeleteRule.CASCADE, rules.get(0).rule());
        assertEquals(DeleteRule.PULL, rules.get(1).rule());
        assertTrue(ModelRegistry.get(Post.class).getDeleteRules().isEmpty());
    }

    @Test
    void declared_and_unique_indexes_use_stored_paths() {
        ModelRegistry.register(Post.class, Account.class);

        IndexOptions byTitle = ModelRegistry.get(Post.class).getIndexes().get(0);
        assertEquals("by_title", byTitle.name());
        assertEquals(Map.of("title", 1, "published", -1), byTitle.keys());
        assertFalse(byTitle.unique());

        IndexOptions handle = ModelRegistry.get(Account.class).getIndexes().get(0);
        assertTrue(handle.unique());
        assertEquals(Map.of("handle", 1), handle.keys());
    }

    @Test
    void paths_resolve_to_stored_paths() {
        ModelRegistry.register(Post.class);
        ModelInformation user = ModelRegistry.get(User.class);

        assertEquals("_id", user.resolvePath("pk").wirePath());
        assertEquals("address.zip_code", user.resolvePath("address.zipCode").wirePath());
        assertEquals("tags.0", ModelRegistry.get(Post.class).resolvePath("tags.0").wirePath());
        assertNull(user.resolvePath("nickname"));
        assertNull(user.resolvePath("name.first"));
    }

    @Test
    void self_references_are_allowed() {
        ModelRegistry.register(Category.class);

        assertEquals(Category.class, ModelRegistry.get(Category.class).getField("parent").valueType());
    }

    @Test
    void model_without_primary_key_is_rejected() {
        assertThrows(ModelDefinitionException.class, () -> ModelRegistry.register(NoKey.class));
        assertNull(ModelRegistry.find(NoKey.class));
    }

    @Test
    void embedded_model_cannot_declare_an_id() {
        assertThrows(ModelDefinitionException.class, () -> ModelRegistry.register(EmbeddedWithId.class));
    }

    @Test
    void holding_a_model_directly_is_rejected() {
        assertThrows(ModelDefinitionException.class, () -> ModelRegistry.register(DirectHolder.class));
        assertNull(ModelRegistry.find(User.class));
    }

    @Test
    void pull_requires_a_list_of_references() {
        assertThrows(ModelDefinitionException.class, () -> ModelRegistry.register(PullOnSingle.class));
    }

    @Test
    void failed_registration_leaves_registered_models_untouched() {
        ModelRegistry.register(User.class);

        assertThrows(ModelDefinitionException.class, () -> ModelRegistry.register(Bookmark.class, PullOnSingle.class));

        assertNull(ModelRegistry.find(Bookmark.class));
        assertNull(ModelRegistry.find(PullOnSingle.class));
        assertTrue(ModelRegistry.get(User.class).getDeleteRules().isEmpty());
    }

    @Test
    void sealed_registry_rejects_new_models() {
        ModelRegistry.register(User.class);
        ModelRegistry.seal();

        assertDoesNotThrow(() -> ModelRegistry.register(User.class));
        assertThrows(IllegalStateException.class, () -> ModelRegistry.register(Category.class));
    }

    @Test
    void unregistered_model_lookup_fails() {
        assertThrows(IllegalArgumentException.class, () -> ModelRegistry.get(User.class));
    }

    @Repository
    static class BlogEntry {
        ObjectId id;
        String text;
    }

    @Repository
    static class Account {
        ObjectId id;

        @Unique
        String handle;
    }

    @Repository
    static class Category {
        ObjectId id;
        Ref<Category> parent;
    }

    @Repository
    static class NoKey {
        String name;
    }

    @Embedded
    static class EmbeddedWithId {
        @Id
        String key;
    }

    @Repository
    static class DirectHolder {
        ObjectId id;
        User owner;
    }

    @Repository
    static class Bookmark {
        ObjectId id;

        @Reference(onDelete = DeleteRule.CASCADE)
        Ref<User> owner;
    }

    @Repository
    static class PullOnSingle {
        ObjectId id;

        @Reference(onDelete = DeleteRule.PULL)
        Ref<User> owner;
    }
}
