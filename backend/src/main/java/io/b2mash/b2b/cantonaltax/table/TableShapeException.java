package io.b2mash.b2b.cantonaltax.table;

/** Raised when a scale row violates the structure required by its table type. */
public class TableShapeException extends Exception {

  private final TableType tableType;
  private final String field;
  private final int row;

  public TableShapeException(TableType tableType, String field, int row, String detail) {
    super(
        "Invalid "
            + field
            + " in row "
            + row
            + " of table of type "
            + tableType
            + ": "
            + detail);
    this.tableType = tableType;
    this.field = field;
    this.row = row;
  }

  public TableType getTableType() {
    return tableType;
  }

  public String getField() {
    return field;
  }

  public int getRow() {
    return row;
  }
}
