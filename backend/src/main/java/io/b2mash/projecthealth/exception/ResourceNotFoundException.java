package io.b2mash.projecthealth.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  private ResourceNotFoundException(String resourceType, UUID id) {
    super(HttpStatus.NOT_FOUND, problemFor(resourceType, id), null);
  }

  public static ResourceNotFoundException project(UUID projectId) {
    return new ResourceNotFoundException("Project", projectId);
  }

  private static ProblemDetail problemFor(String resourceType, UUID id) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, "No " + resourceType.toLowerCase() + " found with id " + id);
    problem.setTitle(resourceType + " not found");
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", id);
    return problem;
  }
}
