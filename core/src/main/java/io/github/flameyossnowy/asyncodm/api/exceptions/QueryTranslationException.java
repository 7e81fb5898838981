package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * A query, projection, sort or update could not be translated into a MongoDB document.
 */
public class QueryTranslationException extends OdmException {
    public QueryTranslationException(String message) {
        super(message);
    }
}
