package io.github.flameyossnowy.asyncodm.mongodb.query;

import com.mongodb.MongoWriteException;
import io.github.flameyossnowy.asyncodm.api.exceptions.DoesNotExistException;
import io.github.flameyossnowy.asyncodm.api.exceptions.MultipleObjectsReturnedException;
import io.github.flameyossnowy.asyncodm.api.exceptions.ValidationException;
import io.github.flameyossnowy.asyncodm.api.options.FilterOption;
import io.github.flameyossnowy.asyncodm.api.options.SortOrder;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.mongodb.MongoOdm;
import io.github.flameyossnowy.asyncodm.mongodb.models.Account;
import io.github.flameyossnowy.asyncodm.mongodb.models.Category;
import io.github.flameyossnowy.asyncodm.mongodb.models.Post;
import io.github.flameyossnowy.asyncodm.mongodb.models.User;
import io.github.flameyossnowy.asyncodm.mongodb.support.InMemoryCollection;
import io.github.flameyossnowy.asyncodm.mongodb.support.InMemoryCollectionProvider;
import io.github.flameyossnowy.asyncodm.mongodb.support.TestModels;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.github.flameyossnowy.asyncodm.mongodb.support.Futures.await;
import static io.github.flameyossnowy.asyncodm.mongodb.support.Futures.failure;
import static org.junit.jupiter.api.Assertions.*;

class QuerySetTest {
    private InMemoryCollectionProvider provider;
    private MongoOdm odm;

    @BeforeEach
    void setup() {
        TestModels.registerAll();
        provider = new InMemoryCollectionProvider();
        odm = MongoOdm.builder().withCollectionProvider(provider).build();

        await(odm.save(new User("a@x.com", "Ann", 20)));
        await(odm.save(new User("b@x.com", "Bob", 30)));
        await(odm.save(new User("c@x.com", "Cid", 40)));
    }

    @AfterEach
    void cleanup() {
        ModelRegistry.clear();
    }

    @Test
    void count_applies_conditions() {
        assertEquals(3L, await(odm.objects(User.class).count()));
        assertEquals(2L, await(odm.objects(User.class).filter("age", ">=", 30).count()));
        assertEquals(1L, await(odm.objects(User.class).filter("age", ">=", 30).limit(1).count()));
    }

    @Test
    void fluent_calls_do_not_touch_storage() {
        QuerySet<User> base = odm.objects(User.class);
        QuerySet<User> refined = base.filter("age", ">", 25).orderBy("age", SortOrder.DESCENDING).limit(1);

        assertTrue(base.spec().filters().isEmpty());
        assertEquals(1, refined.spec().limit());
        assertEquals(0, provider.lookups());
    }

    @Test
    void first_follows_sort_order() {
        User oldest = await(odm.objects(User.class).orderBy("age", SortOrder.DESCENDING).first());

        assertEquals("Cid", oldest.name);
    }

    @Test
    void first_of_empty_result_fails() {
        Throwable e = failure(odm.objects(User.class).filter("age", ">", 100).first());

        assertInstanceOf(DoesNotExistException.class, e);
    }

    @Test
    void get_requires_exactly_one_match() {
        assertEquals("Bob", await(odm.objects(User.class).get("email", "b@x.com")).name);
        assertEquals("Bob", await(odm.objects(User.class).get(Map.of("name", "Bob"))).name);
        assertInstanceOf(MultipleObjectsReturnedException.class, failure(odm.objects(User.class).get(new FilterOption("age", ">", 10))));
        assertInstanceOf(DoesNotExistException.class, failure(odm.objects(User.class).get("email", "z@x.com")));
    }

    @Test
    void get_with_raw_match_narrows_the_existing_raw_filter() {
        QuerySet<User> twenty = odm.objects(User.class).raw(Map.of("age", 20));

        assertInstanceOf(DoesNotExistException.class, failure(twenty.get(Map.of("name", "Bob"))));
        assertEquals("Ann", await(twenty.get(Map.of("name", "Ann"))).name);
        assertEquals(Map.of("age", 20), twenty.spec().rawFilter());
    }

    @Test
    void only_loads_selected_fields_and_the_primary_key() {
        User user = await(odm.objects(User.class).only("name").get("email", "a@x.com"));

        assertEquals("a@x.com", user.email);
        assertEquals("Ann", user.name);
        assertNull(user.age);
    }

    @Test
    void positional_access_honours_sort_skip_and_limit() {
        QuerySet<User> byAge = odm.objects(User.class).orderBy("age", SortOrder.ASCENDING);

        assertEquals("Bob", await(byAge.at(1)).name);
        assertEquals("Cid", await(byAge.skip(1).at(1)).name);
        assertInstanceOf(IndexOutOfBoundsException.class, failure(byAge.at(3)));
        assertInstanceOf(IndexOutOfBoundsException.class, failure(byAge.limit(1).at(1)));

        List<User> slice = await(byAge.slice(1, 5));
        assertEquals(List.of("Bob", "Cid"), names(slice));
        assertTrue(await(byAge.slice(2, 2)).isEmpty());
    }

    @Test
    void iterator_streams_every_result() {
        List<String> seen = new ArrayList<>();
        try (QuerySetCursor<User> cursor = odm.objects(User.class).orderBy("age", SortOrder.ASCENDING).iterator()) {
            await(cursor.forEach(user -> seen.add(user.name)));
        }

        assertEquals(List.of("Ann", "Bob", "Cid"), seen);
    }

    @Test
    void values_returns_stored_documents() {
        List<Document> documents = await(odm.objects(User.class).filter("name", "Ann").values());

        assertEquals(1, documents.size());
        assertEquals("a@x.com", documents.get(0).get("_id"));
        assertEquals(20, documents.get(0).get("age"));
    }

    @Test
    void update_applies_operators_to_matching_documents() {
        long modified = await(odm.objects(User.class).filter("age", "<", 35).update(Map.of("$inc", Map.of("age", 1))));

        assertEquals(2L, modified);
        assertEquals(21, await(odm.objects(User.class).get("email", "a@x.com")).age);
        assertEquals(40, await(odm.objects(User.class).get("email", "c@x.com")).age);
    }

    @Test
    void update_with_limit_touches_only_the_limited_documents() {
        long modified = await(odm.objects(User.class)
            .orderBy("age", SortOrder.DESCENDING)
            .limit(1)
            .update(Map.of("$set", Map.of("name", "Old"))));

        assertEquals(1L, modified);
        assertEquals(List.of("Ann", "Bob", "Old"), names(await(odm.objects(User.class).orderBy("age", SortOrder.ASCENDING).toList())));
    }

    @Test
    void update_with_upsert_inserts_when_nothing_matches() {
        long modified = await(odm.objects(User.class).filter("pk", "d@x.com").update(Map.of("$set", Map.of("name", "Dee")), true));

        assertEquals(1L, modified);
        assertEquals("Dee", await(odm.objects(User.class).get("email", "d@x.com")).name);
    }

    @Test
    void delete_removes_matching_documents() {
        assertEquals(2, await(odm.objects(Category.class).bulkCreate(List.of(new Category("a"), new Category("b")))).size());

        assertEquals(1L, await(odm.objects(Category.class).filter("name", "a").delete()));
        assertEquals(List.of("b"), await(odm.objects(Category.class).toList()).stream().map(category -> category.name).toList());
    }

    @Test
    void bulk_create_writes_generated_keys_back() {
        List<Category> created = await(odm.objects(Category.class).bulkCreate(List.of(new Category("a"), new Category("b"))));

        assertNotNull(created.get(0).id);
        assertNotNull(created.get(1).id);
        assertNotEquals(created.get(0).id, created.get(1).id);
    }

    @Test
    void bulk_create_and_retrieve_keeps_submission_order() {
        List<Category> retrieved = await(odm.objects(Category.class)
            .bulkCreateAndRetrieve(List.of(new Category("z"), new Category("a"), new Category("m"))));

        assertEquals(List.of("z", "a", "m"), retrieved.stream().map(category -> category.name).toList());
    }

    @Test
    void bulk_create_validates_every_instance_before_writing() {
        Throwable e = failure(odm.objects(Category.class).bulkCreate(List.of(new Category("a"), new Category(null))));

        assertInstanceOf(ValidationException.class, e);
        assertTrue(provider.getCollection("category").documents().isEmpty());
    }

    @Test
    void aggregate_runs_after_the_query_stages() {
        List<Document> result = await(odm.objects(User.class).filter("age", ">", 25).aggregate(Map.of("$count", "total")));

        assertEquals(List.of(new Document("total", 2)), result);
    }

    @Test
    void create_indexes_enforces_unique_fields() {
        List<String> names = await(odm.objects(Account.class).createIndexes());
        assertEquals(1, names.size());
        assertEquals(names, await(odm.objects(Account.class).createIndexes()));

        await(odm.save(new Account("h")));
        Throwable e = failure(odm.save(new Account("h")));

        assertInstanceOf(MongoWriteException.class, e);
        assertEquals(11000, ((MongoWriteException) e).getError().getCode());
    }

    @Test
    void created_index_uses_declared_name() {
        assertEquals(List.of("title_views"), await(odm.objects(Post.class).createIndexes()));
        assertEquals(List.of("title_views"), provider.getCollection("post").indexNames());
    }

    @Test
    void list_results_honour_sort_and_skip() {
        List<User> users = await(odm.objects(User.class).orderBy("name", SortOrder.DESCENDING).skip(1).toList());

        assertEquals(List.of("Bob", "Ann"), names(users));
    }

    @Test
    void raw_filter_uses_stored_names() {
        InMemoryCollection collection = provider.getCollection("users");
        collection.add(new Document("_id", "e@x.com").append("name", "Eve").append("address", new Document("zip_code", "1")));

        assertEquals("Eve", await(odm.objects(User.class).raw(Map.of("address.zip_code", "1")).first()).name);
    }

    private static List<String> names(List<User> users) {
        return users.stream().map(user -> user.name).toList();
    }
}
