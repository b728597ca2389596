package uk.gegc.creditledger.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Builds {@link ProblemDetail} bodies with the same shape for every credits endpoint.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(HttpStatus status,
                                       URI type,
                                       String title,
                                       String detail,
                                       HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (request != null && request.getRequestURI() != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    /**
     * Same as {@link #create} with extra top-level members, e.g. {@code required} and {@code available}.
     */
    public static ProblemDetail createWithProperties(HttpStatus status,
                                                     URI type,
                                                     String title,
                                                     String detail,
                                                     HttpServletRequest request,
                                                     Map<String, Object> properties) {
        ProblemDetail problem = create(status, type, title, detail, request);
        if (properties != null) {
            properties.forEach(problem::setProperty);
        }
        return problem;
    }
}
