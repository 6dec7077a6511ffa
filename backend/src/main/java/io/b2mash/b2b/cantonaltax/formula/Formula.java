package io.b2mash.b2b.cantonaltax.formula;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Objects;

/**
 * Arithmetic expression over a single input variable, as used by formula-based tax scales.
 *
 * <p>Instances are immutable trees. Equality is structural; two constants are equal when their
 * values compare equal with {@link Double#compare}, so formulas can be used as map keys.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Formula.Input.class, name = "input"),
  @JsonSubTypes.Type(value = Formula.Const.class, name = "const"),
  @JsonSubTypes.Type(value = Formula.Log.class, name = "log"),
  @JsonSubTypes.Type(value = Formula.Add.class, name = "add"),
  @JsonSubTypes.Type(value = Formula.Sub.class, name = "sub"),
  @JsonSubTypes.Type(value = Formula.Mul.class, name = "mul"),
  @JsonSubTypes.Type(value = Formula.Div.class, name = "div")
})
public sealed interface Formula
    permits Formula.Input,
        Formula.Const,
        Formula.Log,
        Formula.Add,
        Formula.Sub,
        Formula.Mul,
        Formula.Div {

  /** Evaluates this formula with the input variable bound to {@code x}. */
  double evaluate(double x);

  static Formula input() {
    return new Input();
  }

  static Formula constant(double value) {
    return new Const(value);
  }

  static Formula log(Formula arg) {
    return new Log(arg);
  }

  static Formula add(Formula left, Formula right) {
    return new Add(left, right);
  }

  static Formula sub(Formula left, Formula right) {
    return new Sub(left, right);
  }

  static Formula mul(Formula left, Formula right) {
    return new Mul(left, right);
  }

  static Formula div(Formula left, Formula right) {
    return new Div(left, right);
  }

  /** The free variable (taxable income). */
  record Input() implements Formula {
    @Override
    public double evaluate(double x) {
      return x;
    }
  }

  record Const(double value) implements Formula {
    @Override
    public double evaluate(double x) {
      return value;
    }
  }

  /** Natural logarithm. Non-positive arguments yield NaN or -Infinity. */
  record Log(Formula arg) implements Formula {
    public Log {
      Objects.requireNonNull(arg, "arg must not be null");
    }

    @Override
    public double evaluate(double x) {
      return Math.log(arg.evaluate(x));
    }
  }

  record Add(Formula left, Formula right) implements Formula {
    public Add {
      Objects.requireNonNull(left, "left must not be null");
      Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public double evaluate(double x) {
      return left.evaluate(x) + right.evaluate(x);
    }
  }

  record Sub(Formula left, Formula right) implements Formula {
    public Sub {
      Objects.requireNonNull(left, "left must not be null");
      Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public double evaluate(double x) {
      return left.evaluate(x) - right.evaluate(x);
    }
  }

  record Mul(Formula left, Formula right) implements Formula {
    public Mul {
      Objects.requireNonNull(left, "left must not be null");
      Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public double evaluate(double x) {
      return left.evaluate(x) * right.evaluate(x);
    }
  }

  record Div(Formula left, Formula right) implements Formula {
    public Div {
      Objects.requireNonNull(left, "left must not be null");
      Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public double evaluate(double x) {
      return left.evaluate(x) / right.evaluate(x);
    }
  }
}
