package uk.gegc.flashcards.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Builds the RFC 7807 bodies returned by the API. Every problem carries a {@code type} from
 * {@link ErrorTypes}, the request path as {@code instance} and a {@code timestamp}.
 */
public final class ProblemDetailBuilder {

    private static final String WEB_REQUEST_URI_PREFIX = "uri=";

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request
    ) {
        return build(status, type, title, detail, pathOf(request), Map.of());
    }

    /**
     * Variant for the {@code ResponseEntityExceptionHandler} overrides, which only see a {@link WebRequest}.
     */
    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            WebRequest request
    ) {
        return build(status, type, title, detail, pathOf(request), Map.of());
    }

    public static ProblemDetail createWithProperties(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request,
            Map<String, Object> properties
    ) {
        return build(status, type, title, detail, pathOf(request), properties);
    }

    private static ProblemDetail build(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            String path,
            Map<String, Object> properties
    ) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", Instant.now());
        if (properties != null) {
            properties.forEach(problem::setProperty);
        }
        return problem;
    }

    private static String pathOf(HttpServletRequest request) {
        return request == null ? null : request.getRequestURI();
    }

    // ServletWebRequest describes itself as "uri=/path"
    private static String pathOf(WebRequest request) {
        if (request == null) {
            return null;
        }
        String description = request.getDescription(false);
        if (description == null) {
            return null;
        }
        return description.startsWith(WEB_REQUEST_URI_PREFIX)
                ? description.substring(WEB_REQUEST_URI_PREFIX.length())
                : description;
    }
}
