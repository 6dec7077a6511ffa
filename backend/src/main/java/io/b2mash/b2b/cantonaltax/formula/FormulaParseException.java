package io.b2mash.b2b.cantonaltax.formula;

/** Raised when formula text is malformed or not fully consumed by the grammar. */
public class FormulaParseException extends Exception {

  private final String text;
  private final int position;

  public FormulaParseException(String message, String text, int position) {
    super(message + " at position " + position + " in formula \"" + text + "\"");
    this.text = text;
    this.position = position;
  }

  public String getText() {
    return text;
  }

  public int getPosition() {
    return position;
  }
}
