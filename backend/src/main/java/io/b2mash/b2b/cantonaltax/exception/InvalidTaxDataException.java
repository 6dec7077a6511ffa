package io.b2mash.b2b.cantonaltax.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The published tax data of a year cannot be used: malformed JSON or contradicting values. */
public class InvalidTaxDataException extends ErrorResponseException {

  public InvalidTaxDataException(String title, String detail) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
