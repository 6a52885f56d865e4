package io.b2mash.projecthealth.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A project change that its current date mode or the submitted values do not allow. */
public class InvalidStateException extends ErrorResponseException {

  private final UUID projectId;

  public InvalidStateException(UUID projectId, String title, String detail) {
    super(HttpStatus.BAD_REQUEST, problemFor(projectId, title, detail), null);
    this.projectId = projectId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  private static ProblemDetail problemFor(UUID projectId, String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setTitle(title);
    problem.setProperty("projectId", projectId);
    return problem;
  }
}
