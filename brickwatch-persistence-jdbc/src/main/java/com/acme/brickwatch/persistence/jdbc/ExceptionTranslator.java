package com.acme.brickwatch.persistence.jdbc;

import com.acme.brickwatch.core.PermanentException;
import com.acme.brickwatch.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Translates SQLException into the retry classification used by the brick store callers.
 * Transient failures are retried by the scheduler with backoff; permanent ones are surfaced.
 */
public final class ExceptionTranslator {

    enum Classification { TRANSIENT, PERMANENT, UNKNOWN }

    private static final List<String> TRANSIENT_MESSAGES = List.of(
            "timeout", "connection refused", "deadlock", "too many connections", "pool exhausted",
            "connection is closed");

    private static final List<String> PERMANENT_MESSAGES = List.of(
            "syntax error", "table not found", "column not found", "does not exist", "schema not found",
            "database not found", "constraint violation", "unique constraint", "foreign key",
            "type mismatch", "invalid column");

    // 08 connection, 40 rollback (deadlock, serialization)
    private static final List<String> TRANSIENT_STATE_CLASSES = List.of("08", "40");

    // 22 data, 23 integrity, 42 syntax or access, 3D catalog, 3F schema
    private static final List<String> PERMANENT_STATE_CLASSES = List.of("22", "23", "42", "3D", "3F");

    // PostgreSQL 40001/8003/8006, H2 90008
    private static final Set<Integer> TRANSIENT_ERROR_CODES = Set.of(40001, 8003, 8006, 90008);

    // PostgreSQL 42703/23505/23503, H2 90002/90007/42122 and 42102 (table not found)
    private static final Set<Integer> PERMANENT_ERROR_CODES = Set.of(42703, 23505, 23503, 90002, 90007, 42122, 42102);

    private static final String UNIQUE_VIOLATION_STATE = "23505";

    // PostgreSQL invalid_regular_expression, H2 LIKE_ESCAPE_ERROR_1 (raised for bad REGEXP_LIKE patterns)
    private static final Set<String> INVALID_REGEX_STATES = Set.of("2201B", "22025");

    private ExceptionTranslator() {
    }

    /**
     * True if the exception is a unique violation of the named constraint. H2 reports the backing
     * index ("UK_BRICK_SLUG_INDEX_3"), PostgreSQL the constraint itself.
     */
    public static boolean isUniqueViolation(SQLException exception, String constraint) {
        if (!UNIQUE_VIOLATION_STATE.equals(exception.getSQLState())) {
            return false;
        }
        String message = exception.getMessage() == null ? "" : exception.getMessage().toLowerCase(Locale.ROOT);
        return message.contains(constraint.toLowerCase(Locale.ROOT));
    }

    /**
     * True if the database rejected a regular expression supplied by the caller.
     */
    public static boolean isInvalidRegex(SQLException exception) {
        if (exception.getSQLState() != null && INVALID_REGEX_STATES.contains(exception.getSQLState())) {
            return true;
        }
        for (Throwable cause = exception.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof PatternSyntaxException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Logs the failure and maps it to TransientException or PermanentException.
     * Unclassifiable errors are treated as transient.
     *
     * @param originalException the SQLException that occurred
     * @param operation         description of the failed operation, used in the message
     * @param logger            logger of the calling repository
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        String detail = originalException.getMessage();
        switch (classify(originalException)) {
            case TRANSIENT:
                return new TransientException(
                        String.format("Transient database error during %s: %s", operation, detail), originalException);
            case PERMANENT:
                return new PermanentException(
                        String.format("Permanent database error during %s: %s", operation, detail), originalException);
            default:
                return new TransientException(
                        String.format("Database error during %s: %s", operation, detail), originalException);
        }
    }

    static Classification classify(SQLException exception) {
        String message = exception.getMessage() == null ? "" : exception.getMessage().toLowerCase(Locale.ROOT);
        String sqlState = exception.getSQLState();
        int errorCode = exception.getErrorCode();

        if (containsAny(message, TRANSIENT_MESSAGES)
                || hasStateClass(sqlState, TRANSIENT_STATE_CLASSES)
                || "57P03".equals(sqlState)
                || TRANSIENT_ERROR_CODES.contains(errorCode)) {
            return Classification.TRANSIENT;
        }
        if (containsAny(message, PERMANENT_MESSAGES)
                || hasStateClass(sqlState, PERMANENT_STATE_CLASSES)
                || PERMANENT_ERROR_CODES.contains(errorCode)) {
            return Classification.PERMANENT;
        }
        return Classification.UNKNOWN;
    }

    private static boolean containsAny(String message, List<String> fragments) {
        return fragments.stream().anyMatch(message::contains);
    }

    private static boolean hasStateClass(String sqlState, List<String> classes) {
        return sqlState != null && classes.stream().anyMatch(sqlState::startsWith);
    }
}
