package io.b2mash.b2b.cantonaltax.canton;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.cantonaltax.formula.FormulaParser;
import io.b2mash.b2b.cantonaltax.table.EvalPolicy;
import io.b2mash.b2b.cantonaltax.table.RawTable;
import io.b2mash.b2b.cantonaltax.table.TaxTable;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;

class TaxDatabaseExporterTest {

  private final TaxDatabaseExporter exporter = new TaxDatabaseExporter(new ObjectMapper());

  private static TaxDatabase database() throws Exception {
    var zurich =
        new TaxTable(
            new RawTable.Zuerich(
                List.of(
                    new RawTable.Zuerich.Entry(7_000, 0),
                    new RawTable.Zuerich.Entry(Double.POSITIVE_INFINITY, 5))),
            EvalPolicy.NO_SPLIT_ROUND_100);
    var geneva =
        new TaxTable(
            new RawTable.Formel(
                List.of(
                    new RawTable.Formel.Entry(0, FormulaParser.parse("")),
                    new RawTable.Formel.Entry(
                        10_000, FormulaParser.parse("log($wert$) * 2 / (1 + 0.5e1) - 3")))),
            EvalPolicy.RAW);
    var federal =
        new TaxTable(
            new RawTable.Bund(List.of(new RawTable.Bund.Entry(0, 0, 1))),
            EvalPolicy.NO_SPLIT_ROUND_100);
    var year =
        new TaxYear(
            2024,
            Map.of(
                "ZH", new CantonalBase(98, new CantonalScale(0, zurich, zurich)),
                "GE", new CantonalBase(89, new CantonalScale(2, geneva, geneva)),
                "CH", new CantonalBase(100, new CantonalScale(0, federal, federal)),
                "AG",
                    new CantonalBase(
                        112,
                        new CantonalScale(
                            2,
                            new TaxTable(new RawTable.Flattax(5), EvalPolicy.ROUND_100),
                            new TaxTable(
                                new RawTable.Freiburg(
                                    List.of(
                                        new RawTable.Freiburg.Entry(0, 1),
                                        new RawTable.Freiburg.Entry(1_000, 2))),
                                EvalPolicy.DOUBLE_ROUND_100)))));
    return new TaxDatabase(Map.of(2024, year));
  }

  @Test
  void write_thenRead_restoresEqualDatabase() throws Exception {
    var original = database();
    var out = new ByteArrayOutputStream();

    exporter.write(original, out);
    var restored = exporter.read(new ByteArrayInputStream(out.toByteArray()));

    assertThat(restored).isEqualTo(original);
    var zurich = restored.years().get(2024).canton("ZH").orElseThrow();
    assertThat(zurich.scale().singleTax(20_000)).isEqualTo(650.0);
  }

  @Test
  void write_encodesInfiniteWidthAsString() throws Exception {
    var out = new ByteArrayOutputStream();

    exporter.write(database(), out);

    var json = out.toString(StandardCharsets.UTF_8);
    assertThat(json).contains("\"Infinity\"").contains("\"kind\"").contains("\"op\"");
  }

  @Test
  void exportTo_writesNewFile(@TempDir Path dir) throws Exception {
    var file = dir.resolve("tax-db.json");

    exporter.exportTo(database(), file);

    try (var in = Files.newInputStream(file)) {
      assertThat(exporter.read(in)).isEqualTo(database());
    }
  }

  @Test
  void exportTo_neverOverwritesExistingFile(@TempDir Path dir) throws Exception {
    var file = dir.resolve("tax-db.json");
    Files.writeString(file, "keep");

    assertThatThrownBy(() -> exporter.exportTo(database(), file))
        .isInstanceOf(FileAlreadyExistsException.class);
    assertThat(Files.readString(file)).isEqualTo("keep");
  }
}
