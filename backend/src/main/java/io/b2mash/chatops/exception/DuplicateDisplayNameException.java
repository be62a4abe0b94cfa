package io.b2mash.chatops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a channel lookup matches more than one Slack user by display name and no user by
 * username. The user has to retry with the exact username.
 */
public class DuplicateDisplayNameException extends ErrorResponseException {

  private final String displayName;

  public DuplicateDisplayNameException(String displayName) {
    super(HttpStatus.BAD_REQUEST, createProblem(displayName), null);
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String getMessage() {
    return "Multiple users were found with display name '" + displayName + "'";
  }

  private static ProblemDetail createProblem(String displayName) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Ambiguous display name");
    problem.setDetail(
        "Multiple users were found with display name '"
            + displayName
            + "'. Please use the exact channel or user name instead.");
    return problem;
  }
}
