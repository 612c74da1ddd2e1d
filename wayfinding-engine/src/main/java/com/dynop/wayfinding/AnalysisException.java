package com.dynop.wayfinding;

/**
 * Exception thrown when an analysis input fails validation or a computation cannot complete.
 *
 * <p>Possible error codes:
 * <ul>
 *   <li>{@code EMPTY_GRAPH} - No nodes were supplied</li>
 *   <li>{@code DUPLICATE_NODE} - Two nodes share the same id</li>
 *   <li>{@code UNKNOWN_NODE} - An edge or scenario references a node id that does not exist</li>
 *   <li>{@code INVALID_EDGE} - Self loop, negative or non-finite weight</li>
 *   <li>{@code GRAPH_TOO_SMALL} - Fewer than 2 nodes for a space-syntax request</li>
 *   <li>{@code EMPTY_SAMPLE_GRID} - The sampling configuration produced no sample points</li>
 *   <li>{@code INVALID_SCENARIO} - Empty population or non-positive run count</li>
 *   <li>{@code UNREACHABLE_DESTINATION} - No path connects scenario origin and destination</li>
 *   <li>{@code INVALID_CONFIGURATION} - A configuration value is out of its allowed range</li>
 *   <li>{@code INTERRUPTED} - The calling thread was interrupted while waiting for workers</li>
 *   <li>{@code COMPUTATION_FAILED} - A worker task failed</li>
 * </ul>
 */
public class AnalysisException extends RuntimeException {

    public static final String EMPTY_GRAPH = "EMPTY_GRAPH";
    public static final String DUPLICATE_NODE = "DUPLICATE_NODE";
    public static final String UNKNOWN_NODE = "UNKNOWN_NODE";
    public static final String INVALID_EDGE = "INVALID_EDGE";
    public static final String GRAPH_TOO_SMALL = "GRAPH_TOO_SMALL";
    public static final String EMPTY_SAMPLE_GRID = "EMPTY_SAMPLE_GRID";
    public static final String INVALID_SCENARIO = "INVALID_SCENARIO";
    public static final String UNREACHABLE_DESTINATION = "UNREACHABLE_DESTINATION";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String COMPUTATION_FAILED = "COMPUTATION_FAILED";

    private final String errorCode;
    private final String entityId;

    /**
     * Creates an analysis exception bound to a specific entity.
     *
     * @param errorCode Error code
     * @param entityId  Id of the offending node, edge, scenario or setting (may be null)
     * @param detail    Human-readable detail
     */
    public AnalysisException(String errorCode, String entityId, String detail) {
        super(formatMessage(errorCode, entityId, detail));
        this.errorCode = errorCode;
        this.entityId = entityId;
    }

    /**
     * Creates an analysis exception wrapping a lower-level failure.
     *
     * @param errorCode Error code
     * @param entityId  Id of the offending entity (may be null)
     * @param detail    Human-readable detail
     * @param cause     Underlying failure
     */
    public AnalysisException(String errorCode, String entityId, String detail, Throwable cause) {
        super(formatMessage(errorCode, entityId, detail), cause);
        this.errorCode = errorCode;
        this.entityId = entityId;
    }

    private static String formatMessage(String errorCode, String entityId, String detail) {
        if (entityId == null) {
            return String.format("%s: %s", errorCode, detail);
        }
        return String.format("%s: %s [%s]", errorCode, detail, entityId);
    }

    /**
     * @return Error code (e.g., "UNKNOWN_NODE")
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return Id of the entity that failed the guard, or null if not entity specific
     */
    public String getEntityId() {
        return entityId;
    }
}
