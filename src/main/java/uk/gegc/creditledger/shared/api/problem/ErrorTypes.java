package uk.gegc.creditledger.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the credits API.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://credits.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESERVATION_NOT_FOUND = URI.create(BASE_URL + "/reservation-not-found");

    // ==================== Validation Errors ====================
    public static final URI INVALID_AMOUNT = URI.create(BASE_URL + "/invalid-amount");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Credit Errors ====================
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");
    public static final URI SUBSCRIPTION_ALREADY_GRANTED = URI.create(BASE_URL + "/subscription-already-granted");
    public static final URI BILLING_PERIOD_ALREADY_APPLIED = URI.create(BASE_URL + "/billing-period-already-applied");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
