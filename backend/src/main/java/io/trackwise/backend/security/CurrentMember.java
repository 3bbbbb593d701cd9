package io.trackwise.backend.security;

import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.ErrorResponseException;

/**
 * Resolves the acting member from the bearer token. The JWT subject carries the member id issued by
 * the identity service.
 */
public final class CurrentMember {

  private CurrentMember() {}

  /** Member id of the authenticated caller, empty outside an authenticated request. */
  public static Optional<UUID> id() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return Optional.empty();
    }
    String subject = jwtAuth.getToken().getSubject();
    if (subject == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(subject));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /** Nullable variant for activity events, which tolerate system-initiated changes. */
  public static UUID idOrNull() {
    return id().orElse(null);
  }

  public static UUID require() {
    return id()
        .orElseThrow(
            () ->
                new ErrorResponseException(
                    HttpStatus.UNAUTHORIZED,
                    problem("Token subject is not a member id"),
                    null));
  }

  private static ProblemDetail problem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Unknown member");
    problem.setDetail(detail);
    return problem;
  }
}
