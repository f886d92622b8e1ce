package io.github.cyfko.relayql.core.resolver;

/**
 * Stages of the resolution state machine, in execution order.
 * <p>
 * Every operation walks these stages in order and stops at the first failure; the failing stage is
 * recorded on the raised {@link io.github.cyfko.relayql.core.exception.ResolutionException}.
 * {@link #PAGINATE} is skipped for item queries and mutations.
 * </p>
 */
public enum ResolutionStage {
    PARSE,
    AUTHORIZE_COLLECTION,
    TRANSLATE_ARGS,
    PAGINATE,
    FETCH,
    AUTHORIZE_ITEM,
    RESOLVE_SERIALIZATION_CONTEXT,
    SHAPE_RESPONSE
}
