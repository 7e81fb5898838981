package io.github.flameyossnowy.asyncodm.mongodb;

import com.mongodb.MongoWriteException;
import com.mongodb.reactivestreams.client.MongoClients;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import io.github.flameyossnowy.asyncodm.api.exceptions.DoesNotExistException;
import io.github.flameyossnowy.asyncodm.api.options.SortOrder;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.mongodb.models.Account;
import io.github.flameyossnowy.asyncodm.mongodb.models.Article;
import io.github.flameyossnowy.asyncodm.mongodb.models.Comment;
import io.github.flameyossnowy.asyncodm.mongodb.models.Post;
import io.github.flameyossnowy.asyncodm.mongodb.models.User;
import io.github.flameyossnowy.asyncodm.mongodb.query.QuerySet;
import io.github.flameyossnowy.asyncodm.mongodb.support.TestModels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;

import static io.github.flameyossnowy.asyncodm.mongodb.support.Futures.await;
import static io.github.flameyossnowy.asyncodm.mongodb.support.Futures.failure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the mapper through the reactive driver against an in-process MongoDB server.
 */
class MongoOdmServerTest {
    private MongoServer server;
    private MongoOdm odm;

    @BeforeEach
    void setup() {
        TestModels.registerAll();
        server = new MongoServer(new MemoryBackend());
        InetSocketAddress address = server.bind();

        odm = MongoOdm.builder()
            .withClient(MongoClients.create("mongodb://" + address.getHostString() + ":" + address.getPort()))
            .setDatabase("odm")
            .build();

        await(odm.save(new User("a@x.com", "Ann", 20)));
        await(odm.save(new User("b@x.com", "Bob", 30)));
        await(odm.save(new User("c@x.com", "Cid", 40)));
    }

    @AfterEach
    void cleanup() {
        odm.close();
        server.shutdownNow();
        ModelRegistry.clear();
    }

    @Test
    void queries_run_against_the_server() {
        assertEquals(2L, await(odm.objects(User.class).filter("age", ">=", 30).count()));
        assertEquals("Cid", await(odm.objects(User.class).orderBy("age", SortOrder.DESCENDING).first()).name);
        assertEquals(List.of("Ann", "Bob"), await(odm.objects(User.class).filter("age", "<", 35).orderBy("age", SortOrder.ASCENDING).toList())
            .stream().map(user -> user.name).toList());
    }

    @Test
    void get_with_raw_match_keeps_the_existing_raw_filter() {
        QuerySet<User> twenty = odm.objects(User.class).raw(Map.of("age", 20));

        assertInstanceOf(DoesNotExistException.class, failure(twenty.get(Map.of("name", "Bob"))));
        assertEquals("Ann", await(twenty.get(Map.of("name", "Ann"))).name);
    }

    @Test
    void positional_update_edits_the_matched_comment() {
        User ann = await(odm.objects(User.class).get("email", "a@x.com"));
        Post post = new Post("Hello", ann);
        post.comments = List.of(new Comment("first", null), new Comment("second", null));
        await(odm.save(post));

        long modified = await(odm.objects(Post.class)
            .raw(Map.of("comments.body", "second"))
            .update(Map.of("$set", Map.of("comments.$.body", "edited"))));

        assertEquals(1L, modified);
        Post reloaded = await(odm.objects(Post.class).first());
        assertEquals("first", reloaded.comments.get(0).body);
        assertEquals("edited", reloaded.comments.get(1).body);
    }

    @Test
    void references_resolve_through_the_driver() {
        User bob = await(odm.objects(User.class).get("email", "b@x.com"));
        await(odm.save(new Article("One", bob)));
        await(odm.save(new Article("Two", bob)));

        List<Article> articles = await(odm.objects(Article.class).toList(true));

        assertEquals(2, articles.size());
        for (Article article : articles) {
            assertTrue(article.author.isResolved());
            assertEquals("Bob", article.author.get().name);
        }
    }

    @Test
    void deleting_a_user_cascades_to_their_posts() {
        User ann = await(odm.objects(User.class).get("email", "a@x.com"));
        User bob = await(odm.objects(User.class).get("email", "b@x.com"));
        await(odm.save(new Post("Ann's", ann)));
        await(odm.save(new Post("Bob's", bob)));

        assertEquals(1L, await(odm.delete(ann)));

        assertEquals(List.of("Bob's"), await(odm.objects(Post.class).toList()).stream().map(post -> post.title).toList());
    }

    @Test
    void unique_index_rejects_duplicates() {
        await(odm.objects(Account.class).createIndexes());
        await(odm.save(new Account("ann")));

        Throwable error = failure(odm.save(new Account("ann")));

        MongoWriteException duplicate = assertInstanceOf(MongoWriteException.class, error);
        assertEquals(11000, duplicate.getCode());
        assertEquals(1L, await(odm.objects(Account.class).count()));
    }
}
