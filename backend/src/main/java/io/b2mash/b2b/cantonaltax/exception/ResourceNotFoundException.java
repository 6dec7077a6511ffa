package io.b2mash.b2b.cantonaltax.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A tax year, a canton of a year or a feed file that is not available. */
public class ResourceNotFoundException extends ErrorResponseException {

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail), null);
  }

  public static ResourceNotFoundException taxYear(int year, int firstYear, int lastYear) {
    return new ResourceNotFoundException(
        "Tax year not found",
        "No tax data for " + year + ", available years are " + firstYear + " to " + lastYear);
  }

  public static ResourceNotFoundException canton(String canton, int year) {
    return new ResourceNotFoundException(
        "Canton not found", "No income tax tables compiled for " + canton + " in " + year);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
