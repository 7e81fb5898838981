package io.github.flameyossnowy.asyncodm.mongodb.query;

import com.mongodb.client.model.IndexModel;
import io.github.flameyossnowy.asyncodm.api.IndexOptions;
import io.github.flameyossnowy.asyncodm.api.exceptions.QueryTranslationException;
import io.github.flameyossnowy.asyncodm.api.options.FilterOption;
import io.github.flameyossnowy.asyncodm.api.options.Projection;
import io.github.flameyossnowy.asyncodm.api.options.QuerySpec;
import io.github.flameyossnowy.asyncodm.api.options.SortOption;
import io.github.flameyossnowy.asyncodm.api.options.SortOrder;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldPath;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.mongodb.codec.DocumentCodec;
import org.bson.Document;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Translates query specs into filter, projection, sort and update documents.
 * <p>
 * Model field paths are mapped to stored paths and values are encoded through the
 * {@link DocumentCodec}, so a condition on a reference field accepts a {@code Ref}, a model
 * instance or a raw primary key. Conditions on the same field are merged into one operator
 * document, which makes the order in which conditions were added irrelevant.
 */
@ApiStatus.Internal
public class QueryTranslator {
    private final DocumentCodec codec;

    public QueryTranslator(@NotNull DocumentCodec codec) {
        this.codec = codec;
    }

    /**
     * @return the filter document of the query, an empty document when it has no conditions
     * @throws QueryTranslationException if a condition names an unknown field or operator
     */
    public @NotNull Document filter(@NotNull ModelInformation information, @NotNull QuerySpec spec) {
        Document merged = new Document();
        List<Document> overflow = new ArrayList<>(0);

        for (FilterOption option : spec.filters()) {
            merge(merged, translate(information, option), overflow);
        }

        Map<String, Object> raw = spec.rawFilter();
        if (raw != null) {
            for (Map.Entry<String, Object> entry : raw.entrySet()) {
                merge(merged, new Document(entry.getKey(), entry.getValue()), overflow);
            }
        }

        if (!overflow.isEmpty()) appendAnd(merged, overflow);
        return merged;
    }

    private Document translate(ModelInformation information, FilterOption option) {
        String path = resolve(information, option.field()).wirePath();
        Object value = option.value();

        return switch (option.operator().toUpperCase(Locale.ROOT)) {
            case "=" -> new Document(path, codec.encodeValue(value));
            case "!=" -> operator(path, "$ne", codec.encodeValue(value));
            case ">" -> operator(path, "$gt", codec.encodeValue(value));
            case ">=" -> operator(path, "$gte", codec.encodeValue(value));
            case "<" -> operator(path, "$lt", codec.encodeValue(value));
            case "<=" -> operator(path, "$lte", codec.encodeValue(value));
            case "IN" -> operator(path, "$in", values(option));
            case "NIN" -> operator(path, "$nin", values(option));
            case "EXISTS" -> {
                if (!(value instanceof Boolean)) {
                    throw new QueryTranslationException("EXISTS on '" + option.field() + "' requires a boolean value");
                }
                yield operator(path, "$exists", value);
            }
            case "REGEX" -> {
                if (!(value instanceof String) && !(value instanceof Pattern)) {
                    throw new QueryTranslationException("REGEX on '" + option.field() + "' requires a pattern string");
                }
                yield operator(path, "$regex", value instanceof Pattern pattern ? pattern.pattern() : value);
            }
            default -> throw new QueryTranslationException("Unknown operator '" + option.operator() + "' on '" + option.field()
                + "', expected one of " + FilterOption.OPERATORS);
        };
    }

    private List<Object> values(FilterOption option) {
        Object value = option.value();
        Collection<?> values;
        if (value instanceof Collection<?> collection) values = collection;
        else if (value instanceof Object[] array) values = Arrays.asList(array);
        else throw new QueryTranslationException(option.operator() + " on '" + option.field() + "' requires a collection of values");

        List<Object> encoded = new ArrayList<>(values.size());
        for (Object element : values) encoded.add(codec.encodeValue(element));
        return encoded;
    }

    private static Document operator(String path, String operator, Object value) {
        return new Document(path, new Document(operator, value));
    }

    private static void merge(Document target, Document clause, List<Document> overflow) {
        for (Map.Entry<String, Object> entry : clause.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (!target.containsKey(key)) {
                target.put(key, value);
                continue;
            }

            Object existing = target.get(key);
            if ("$and".equals(key) && existing instanceof List<?> && value instanceof List<?> more) {
                appendAnd(target, more);
            } else if (isOperatorDocument(existing) && isOperatorDocument(value) && disjoint((Document) existing, (Document) value)) {
                Document combined = new Document((Document) existing);
                combined.putAll((Document) value);
                target.put(key, combined);
            } else {
                overflow.add(new Document(key, value));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void appendAnd(Document target, List<?> clauses) {
        List<Object> and = new ArrayList<>();
        Object existing = target.get("$and");
        if (existing instanceof List<?> list) and.addAll(list);
        and.addAll(clauses);
        target.put("$and", and);
    }

    private static boolean isOperatorDocument(Object value) {
        if (!(value instanceof Document document) || document.isEmpty()) return false;
        for (String key : document.keySet()) {
            if (!key.startsWith("$")) return false;
        }
        return true;
    }

    private static boolean disjoint(Document left, Document right) {
        for (String key : right.keySet()) {
            if (left.containsKey(key)) return false;
        }
        return true;
    }

    /**
     * @return the projection document, or {@code null} if the query loads whole documents
     */
    public @Nullable Document projection(@NotNull ModelInformation information, @NotNull QuerySpec spec) {
        Projection projection = spec.projection();
        if (projection == null) return null;

        Document document = new Document();
        boolean include = projection.mode() == Projection.Mode.INCLUDE;
        for (String field : projection.fields()) {
            String path = resolve(information, field).wirePath();
            if ("_id".equals(path)) continue;
            document.put(path, include ? 1 : 0);
        }
        if (include) document.put("_id", 1);
        return document.isEmpty() ? null : document;
    }

    /**
     * @return the sort document, or {@code null} if the query has no sort order
     */
    public @Nullable Document sort(@NotNull ModelInformation information, @NotNull QuerySpec spec) {
        if (spec.sort().isEmpty()) return null;
        Document document = new Document();
        for (SortOption option : spec.sort()) {
            document.put(resolve(information, option.field()).wirePath(), option.order() == SortOrder.ASCENDING ? 1 : -1);
        }
        return document;
    }

    /**
     * Translates an update made of update operators, such as
     * {@code {"$set": {"name": "B"}, "$inc": {"age": 1}}}, with model field paths. Paths may use
     * the positional operators, and {@code $rename} targets naming a field are translated too.
     * @throws QueryTranslationException if a key is not an update operator or a path is unknown
     */
    public @NotNull Document update(@NotNull ModelInformation information, @NotNull Map<String, ?> modifications) {
        if (modifications.isEmpty()) {
            throw new QueryTranslationException("Update must contain at least one update operator");
        }

        Document update = new Document();
        for (Map.Entry<String, ?> entry : modifications.entrySet()) {
            String operator = entry.getKey();
            if (!operator.startsWith("$")) {
                throw new QueryTranslationException("Update key '" + operator + "' is not an update operator, use e.g. {\"$set\": {\""
                    + operator + "\": ...}}");
            }
            if (!(entry.getValue() instanceof Map<?, ?> fields)) {
                throw new QueryTranslationException("Update operator " + operator + " requires a document of fields");
            }

            Document translated = new Document();
            for (Map.Entry<?, ?> field : fields.entrySet()) {
                String path = resolve(information, String.valueOf(field.getKey())).wirePath();
                if ("$rename".equals(operator) && field.getValue() instanceof String target) {
                    FieldPath renamed = information.resolvePath(target);
                    translated.put(path, renamed == null ? target : renamed.wirePath());
                    continue;
                }
                translated.put(path, codec.encodeValue(field.getValue()));
            }
            update.put(operator, translated);
        }
        return update;
    }

    /**
     * Translates the declared indexes of a model.
     */
    public @NotNull List<IndexModel> indexModels(@NotNull ModelInformation information) {
        List<IndexModel> models = new ArrayList<>(information.getIndexes().size());
        for (IndexOptions index : information.getIndexes()) {
            com.mongodb.client.model.IndexOptions options = new com.mongodb.client.model.IndexOptions().unique(index.unique());
            if (index.name() != null) options.name(index.name());
            Document keys = new Document();
            keys.putAll(index.keys());
            models.add(new IndexModel(keys, options));
        }
        return models;
    }

    public static @NotNull Document idsFilter(@NotNull Collection<?> ids) {
        return new Document("_id", new Document("$in", new ArrayList<>(ids)));
    }

    private static FieldPath resolve(ModelInformation information, String field) {
        FieldPath path = information.resolvePath(field);
        if (path == null) {
            throw new QueryTranslationException("Unknown field '" + field + "' for model " + information.getType().getSimpleName());
        }
        return path;
    }
}
