package uk.gegc.creditledger.features.wallet.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for credit movements. Fields go to MDC under {@code ledger.*}
 * for the duration of one log call.
 */
public final class LedgerStructuredLogger {

    private static final String[] KEYS = {
            "ledger.userId", "ledger.pool", "ledger.kind", "ledger.amount", "ledger.sourceType",
            "ledger.sourceId", "ledger.balanceAfter", "ledger.operation", "ledger.reservationId",
            "ledger.subscriptionId", "ledger.periodStart"
    };

    private LedgerStructuredLogger() {
    }

    /**
     * Log one ledger append.
     */
    public static void logLedgerWrite(Logger logger, String level, String message,
                                      UUID userId, String pool, String kind, long amount,
                                      String sourceType, String sourceId, long balanceAfter,
                                      Object... args) {
        MDC.put("ledger.userId", userId != null ? userId.toString() : null);
        MDC.put("ledger.pool", pool);
        MDC.put("ledger.kind", kind);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.sourceType", sourceType);
        MDC.put("ledger.sourceId", sourceId);
        MDC.put("ledger.balanceAfter", String.valueOf(balanceAfter));
        log(logger, level, message, args);
    }

    /**
     * Log a reservation state change.
     */
    public static void logReservationOperation(Logger logger, String level, String message,
                                               UUID userId, String operation, long amount,
                                               String reservationId, long balanceAfter,
                                               Object... args) {
        MDC.put("ledger.userId", userId != null ? userId.toString() : null);
        MDC.put("ledger.operation", operation);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.reservationId", reservationId);
        MDC.put("ledger.balanceAfter", String.valueOf(balanceAfter));
        log(logger, level, message, args);
    }

    /**
     * Log a billing cycle event (grant, renewal, revoke).
     */
    public static void logCycleOperation(Logger logger, String level, String message,
                                         UUID userId, String operation, String subscriptionId,
                                         String periodStart, Object... args) {
        MDC.put("ledger.userId", userId != null ? userId.toString() : null);
        MDC.put("ledger.operation", operation);
        MDC.put("ledger.subscriptionId", subscriptionId);
        MDC.put("ledger.periodStart", periodStart);
        log(logger, level, message, args);
    }

    public static void clearLedgerMDC() {
        for (String key : KEYS) {
            MDC.remove(key);
        }
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, args);
                case "error" -> logger.error(message, args);
                case "debug" -> logger.debug(message, args);
                default -> logger.info(message, args);
            }
        } finally {
            clearLedgerMDC();
        }
    }
}
