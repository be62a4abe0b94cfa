package io.b2mash.chatops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when notification setting coordinates do not name exactly one target (user or team), or
 * when no scope (project, organization or user) can be derived from them.
 */
public class InvalidTargetException extends ErrorResponseException {

  public InvalidTargetException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid notification target");
    problem.setDetail(detail);
    return problem;
  }
}
