package io.b2mash.b2b.cantonaltax.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for the formulas published with formula-based tax scales.
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') term)?
 * factor := '(' expr ')' | number | '$wert$' | 'log' factor
 * </pre>
 *
 * <p>Addition and subtraction fold to the left. The right operand of a multiplicative operator is a
 * whole term, so {@code a / b / c} parses as {@code a / (b / c)}. Published formulas are parsed
 * with exactly this grammar; formulas where a division is affected by it are logged for review.
 *
 * <p>Whitespace is ignored around every token. A sign is only accepted as part of a number
 * literal.
 */
public final class FormulaParser {

  private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

  /** Token denoting the taxable income in published formulas. */
  public static final String INPUT_TOKEN = "$wert$";

  private static final String LOG_KEYWORD = "log";

  private final String text;
  private int pos;
  private boolean divisionChain;

  private FormulaParser(String text) {
    this.text = text;
  }

  /**
   * Parses formula text. The empty string is the constant zero.
   *
   * @throws FormulaParseException if the text is malformed or has an unparsed remainder
   */
  public static Formula parse(String text) throws FormulaParseException {
    if (text.isEmpty()) {
      return Formula.constant(0.0);
    }
    var parser = new FormulaParser(text);
    var formula = parser.expr();
    if (parser.pos != text.length()) {
      throw new FormulaParseException(
          "Incomplete parsing, remainder \"" + text.substring(parser.pos) + "\"",
          text,
          parser.pos);
    }
    if (parser.divisionChain) {
      log.warn("Formula divides by a right-nested product or quotient, review: {}", text);
    }
    return formula;
  }

  private Formula expr() throws FormulaParseException {
    var result = term();
    while (pos < text.length()) {
      char op = text.charAt(pos);
      if (op == '+') {
        pos++;
        result = Formula.add(result, term());
      } else if (op == '-') {
        pos++;
        result = Formula.sub(result, term());
      } else {
        break;
      }
    }
    return result;
  }

  private Formula term() throws FormulaParseException {
    var left = factor();
    if (pos >= text.length()) {
      return left;
    }
    char op = text.charAt(pos);
    if (op != '*' && op != '/') {
      return left;
    }
    pos++;
    var right = term();
    if (op == '/' && (right instanceof Formula.Mul || right instanceof Formula.Div)) {
      divisionChain = true;
    }
    return op == '*' ? Formula.mul(left, right) : Formula.div(left, right);
  }

  private Formula factor() throws FormulaParseException {
    skipWhitespace();
    if (pos >= text.length()) {
      throw new FormulaParseException("Unexpected end of formula", text, pos);
    }
    char c = text.charAt(pos);
    Formula result;
    if (c == '(') {
      pos++;
      result = expr();
      if (pos >= text.length() || text.charAt(pos) != ')') {
        throw new FormulaParseException("Expected ')'", text, pos);
      }
      pos++;
    } else if (c == '+' || c == '-' || c == '.' || isDigit(c)) {
      result = Formula.constant(number());
    } else if (text.startsWith(INPUT_TOKEN, pos)) {
      pos += INPUT_TOKEN.length();
      result = Formula.input();
    } else if (text.startsWith(LOG_KEYWORD, pos)) {
      pos += LOG_KEYWORD.length();
      result = Formula.log(factor());
    } else {
      throw new FormulaParseException("Unexpected character '" + c + "'", text, pos);
    }
    skipWhitespace();
    return result;
  }

  /** Signed {@code digits[.[digits]]} or {@code .digits}, with an optional exponent. */
  private double number() throws FormulaParseException {
    int start = pos;
    if (text.charAt(pos) == '+' || text.charAt(pos) == '-') {
      pos++;
    }
    if (digits() > 0) {
      if (peek('.')) {
        pos++;
        digits();
      }
    } else if (peek('.')) {
      pos++;
      if (digits() == 0) {
        throw new FormulaParseException("Expected digits after '.'", text, pos);
      }
    } else {
      throw new FormulaParseException("Expected a number", text, start);
    }
    if (peek('e') || peek('E')) {
      pos++;
      if (peek('+') || peek('-')) {
        pos++;
      }
      if (digits() == 0) {
        throw new FormulaParseException("Expected exponent digits", text, pos);
      }
    }
    return Double.parseDouble(text.substring(start, pos));
  }

  private int digits() {
    int start = pos;
    while (pos < text.length() && isDigit(text.charAt(pos))) {
      pos++;
    }
    return pos - start;
  }

  private boolean peek(char expected) {
    return pos < text.length() && text.charAt(pos) == expected;
  }

  private void skipWhitespace() {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
        return;
      }
      pos++;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
