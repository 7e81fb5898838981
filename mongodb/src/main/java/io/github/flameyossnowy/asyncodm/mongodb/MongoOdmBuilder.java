package io.github.flameyossnowy.asyncodm.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import io.github.flameyossnowy.asyncodm.api.OdmSettings;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.api.utils.Logging;
import io.github.flameyossnowy.asyncodm.mongodb.codec.MongoValueTypeResolver;
import io.github.flameyossnowy.asyncodm.mongodb.codec.ValueTypeResolverRegistry;
import io.github.flameyossnowy.asyncodm.mongodb.collection.CollectionProvider;
import io.github.flameyossnowy.asyncodm.mongodb.collection.ReactiveCollectionProvider;

import java.util.Objects;

public class MongoOdmBuilder {
    private MongoClientSettings.Builder credentialsBuilder;
    private MongoClient client;
    private CollectionProvider collectionProvider;
    private String database;
    private OdmSettings settings = OdmSettings.defaults();
    private final ValueTypeResolverRegistry resolvers = new ValueTypeResolverRegistry();

    MongoOdmBuilder() {}

    /**
     * Uses an existing client instead of creating one. The mapper takes ownership of the
     * client and closes it when it is closed.
     *
     * @param client the reactive streams client
     * @return The builder instance, for chaining method calls.
     */
    public MongoOdmBuilder withClient(MongoClient client) {
        this.client = client;
        return this;
    }

    /**
     * Sets the MongoDB connection settings using the provided MongoClientSettings.
     *
     * <p>The settings are used to create the MongoClient of the mapper. They define the
     * configuration options such as the cluster, the read preference, the write concern and the
     * credentials.
     *
     * @param credentials A MongoClientSettings instance that defines the
     *                    connection settings for the MongoClient.
     * @return The builder instance, for chaining method calls.
     */
    public MongoOdmBuilder withCredentials(MongoClientSettings credentials) {
        this.credentialsBuilder = MongoClientSettings.builder(credentials);
        return this;
    }

    /**
     * Applies a connection string to the MongoClientSettings. Parsing it is left to the driver.
     *
     * @param string A ConnectionString instance that defines the connection
     *               string for the MongoClient.
     * @return The builder instance, for chaining method calls.
     */
    public MongoOdmBuilder withConnectionString(ConnectionString string) {
        getCredentialsBuilder().applyConnectionString(string);
        return this;
    }

    /**
     * Applies a connection string to the MongoClientSettings.
     *
     * @param string A string that defines the connection string for the MongoClient.
     * @return The builder instance, for chaining method calls.
     */
    public MongoOdmBuilder withConnectionString(String string) {
        return withConnectionString(new ConnectionString(string));
    }

    /**
     * Replaces the driver entirely. Mostly useful to run the mapper against another storage in tests.
     *
     * @param collectionProvider the source of collections
     * @return The builder instance, for chaining method calls.
     */
    public MongoOdmBuilder withCollectionProvider(CollectionProvider collectionProvider) {
        this.collectionProvider = collectionProvider;
        return this;
    }

    public MongoOdmBuilder withSettings(OdmSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        return this;
    }

    /**
     * Registers how values of a Java type are stored, replacing the built-in coercion for the type.
     *
     * @return The builder instance, for chaining method calls.
     */
    public <E, D> MongoOdmBuilder withResolver(Class<D> type, MongoValueTypeResolver<E, D> resolver) {
        resolvers.register(type, resolver);
        return this;
    }

    public MongoOdmBuilder setDatabase(final String database) {
        this.database = database;
        return this;
    }

    private MongoClientSettings.Builder getCredentialsBuilder() {
        if (credentialsBuilder == null) credentialsBuilder = MongoClientSettings.builder();
        return credentialsBuilder;
    }

    /**
     * Builds the mapper and seals the {@link ModelRegistry}; models must be registered before.
     *
     * @return a new mapper
     * @throws IllegalStateException if neither a collection provider nor a database is configured
     */
    public MongoOdm build() {
        ModelRegistry.seal();

        if (collectionProvider != null) {
            return new MongoOdm(client, collectionProvider, settings, resolvers);
        }

        if (database == null) {
            throw new IllegalStateException("A database name is required, call setDatabase(...)");
        }

        MongoClient mongoClient = client;
        if (mongoClient == null) {
            mongoClient = MongoClients.create(getCredentialsBuilder().build());
        }
        Logging.info("Connected mapper to database " + database + ", " + ModelRegistry.models().size() + " models registered");
        return new MongoOdm(mongoClient, new ReactiveCollectionProvider(mongoClient.getDatabase(database)), settings, resolvers);
    }
}
