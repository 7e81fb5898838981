package io.github.flameyossnowy.asyncodm.mongodb.query;

import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;
import io.github.flameyossnowy.asyncodm.api.exceptions.OperationException;
import io.github.flameyossnowy.asyncodm.api.reflect.DeleteRuleEntry;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.api.utils.Logging;
import io.github.flameyossnowy.asyncodm.mongodb.MongoOdm;
import org.bson.Document;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Deletes documents by primary key and applies the delete rules of the referencing models.
 * <p>
 * {@link DeleteRule#DENY} rules are checked first and abort before anything is deleted. The
 * documents are deleted next, then the other rules run one after the other. Cascades terminate
 * because a deleted document matches no later query.
 */
final class DeleteRules {
    private DeleteRules() {}

    static CompletableFuture<Long> deleteWithRules(MongoOdm odm, ModelInformation information, List<Object> ids) {
        if (ids.isEmpty()) return CompletableFuture.completedFuture(0L);

        List<DeleteRuleEntry> rules = information.getDeleteRules();
        CompletableFuture<Void> checked = CompletableFuture.completedFuture(null);
        for (DeleteRuleEntry entry : rules) {
            if (entry.rule() != DeleteRule.DENY) continue;
            checked = checked.thenCompose(ignored -> deny(odm, information, entry, ids));
        }

        return checked
            .thenCompose(ignored -> odm.collection(information).deleteMany(QueryTranslator.idsFilter(ids)))
            .thenCompose(deleted -> {
                CompletableFuture<Void> applied = CompletableFuture.completedFuture(null);
                for (DeleteRuleEntry entry : rules) {
                    if (entry.rule() == DeleteRule.DENY || entry.rule() == DeleteRule.DO_NOTHING) continue;
                    applied = applied.thenCompose(ignored -> apply(odm, entry, ids));
                }
                return applied.thenApply(ignored -> deleted);
            });
    }

    private static CompletableFuture<Void> deny(MongoOdm odm, ModelInformation target, DeleteRuleEntry entry, List<Object> ids) {
        ModelInformation referencing = ModelRegistry.get(entry.referencingType());
        return odm.collection(referencing).count(referencingFilter(entry, ids), 0, 0).thenAccept(count -> {
            if (count > 0) {
                throw new OperationException("Cannot delete " + target.getType().getSimpleName() + ", " + count + " "
                    + referencing.getType().getSimpleName() + " document(s) reference it through '" + entry.field().name() + "'");
            }
        });
    }

    private static CompletableFuture<Void> apply(MongoOdm odm, DeleteRuleEntry entry, List<Object> ids) {
        ModelInformation referencing = ModelRegistry.get(entry.referencingType());
        String path = entry.field().wireName();
        Document filter = referencingFilter(entry, ids);
        Logging.deepInfo(() -> "Applying " + entry.rule() + " to " + referencing.getType().getSimpleName() + "." + entry.field().name());

        return switch (entry.rule()) {
            case NULLIFY -> odm.collection(referencing)
                .updateMany(filter, new Document("$unset", new Document(path, "")), false)
                .thenAccept(ignored -> {});
            case PULL -> odm.collection(referencing)
                .updateMany(filter, new Document("$pull", new Document(path, new Document("$in", ids))), false)
                .thenAccept(ignored -> {});
            case CASCADE -> odm.objects(referencing.getType())
                .raw(filter)
                .delete()
                .thenAccept(ignored -> {});
            default -> CompletableFuture.completedFuture(null);
        };
    }

    private static Document referencingFilter(DeleteRuleEntry entry, List<Object> ids) {
        return new Document(entry.field().wireName(), new Document("$in", ids));
    }
}
