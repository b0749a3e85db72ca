package com.haven.common.event;

/**
 * Tracing data shared by every event of one saga run.
 *
 * @param correlationId  identical for the whole saga, taken from the initiating event
 * @param sourceService  service that emitted this event
 * @param retryCount     number of times the emitter re-published it
 * @param schemaVersion  envelope schema version
 */
public record SagaMetadata(
        String correlationId,
        String sourceService,
        int retryCount,
        String schemaVersion
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public static SagaMetadata of(String correlationId, String sourceService) {
        return new SagaMetadata(correlationId, sourceService, 0, SCHEMA_VERSION);
    }
}
