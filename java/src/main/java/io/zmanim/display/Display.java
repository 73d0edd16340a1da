package io.zmanim.display;

import io.zmanim.ast.*;
import java.math.BigDecimal;
import java.util.stream.Collectors;

/** Renders expression trees as canonical formula text. */
public final class Display {
  private Display() {}

  /**
   * Renders an expression as canonical formula text. Parsing the result and rendering again
   * yields the same string.
   *
   * @param expr the expression to render
   * @return the canonical string representation
   */
  public static String render(Expr expr) {
    if (expr instanceof NumberLiteral n) {
      return number(n.value());
    }
    if (expr instanceof DurationLiteral d) {
      return number(d.magnitude()) + d.unit().symbol();
    }
    if (expr instanceof PrimitiveRef p) {
      return p.primitive().keyword();
    }
    if (expr instanceof ClockTime t) {
      return t.toString();
    }
    if (expr instanceof Reference r) {
      return "@" + r.key();
    }
    if (expr instanceof Identifier id) {
      return id.name();
    }
    if (expr instanceof CustomBase c) {
      return "custom(" + render(c.start()) + ", " + render(c.end()) + ")";
    }
    if (expr instanceof FunctionCall call) {
      return call.name()
          + call.args().stream().map(Display::render).collect(Collectors.joining(", ", "(", ")"));
    }
    if (expr instanceof BinaryOp op) {
      return renderBinary(op);
    }
    throw new IllegalArgumentException("unsupported node: " + expr);
  }

  private static String renderBinary(BinaryOp op) {
    String right = render(op.right());
    // Operators are left-associative, so a nested right operand needs its group back.
    if (op.right() instanceof BinaryOp) {
      right = "(" + right + ")";
    }
    return render(op.left()) + " " + op.op() + " " + right;
  }

  /**
   * Formats a number the way formulas write it: integral values without a fraction.
   *
   * @param value the number
   * @return the text
   */
  public static String number(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return String.valueOf((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
