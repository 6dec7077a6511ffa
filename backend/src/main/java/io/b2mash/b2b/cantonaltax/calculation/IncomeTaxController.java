package io.b2mash.b2b.cantonaltax.calculation;

import io.b2mash.b2b.cantonaltax.calculation.dto.IncomeTaxResponse;
import io.b2mash.b2b.cantonaltax.calculation.dto.ScaleReport;
import io.b2mash.b2b.cantonaltax.feed.Target;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/income-tax")
public class IncomeTaxController {

  private final IncomeTaxService incomeTaxService;

  public IncomeTaxController(IncomeTaxService incomeTaxService) {
    this.incomeTaxService = incomeTaxService;
  }

  @GetMapping("/{year}/cantons")
  public ResponseEntity<List<String>> listCantons(@PathVariable int year) {
    return ResponseEntity.ok(incomeTaxService.cantons(year));
  }

  @GetMapping("/{year}/scales")
  public ResponseEntity<ScaleReport> scaleReport(
      @PathVariable int year, @RequestParam(defaultValue = "KANTON") Target target) {
    return ResponseEntity.ok(incomeTaxService.scaleReport(year, target));
  }

  @GetMapping("/{year}/{canton}")
  public ResponseEntity<IncomeTaxResponse> calculate(
      @PathVariable int year,
      @PathVariable String canton,
      @RequestParam @PositiveOrZero double income,
      @RequestParam(defaultValue = "false") boolean married) {
    return ResponseEntity.ok(incomeTaxService.calculate(year, canton, income, married));
  }
}
