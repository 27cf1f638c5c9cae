package io.github.wphillipmoore.fieldmerge.value;

import com.google.gson.JsonPrimitive;
import java.util.Objects;

/**
 * A leaf type holding one JSON primitive.
 *
 * @param kind the accepted primitive kind, never null
 */
public record ScalarType(ScalarKind kind) implements TypeDef {

  static final ScalarType NUMERIC = new ScalarType(ScalarKind.NUMERIC);
  static final ScalarType STRING = new ScalarType(ScalarKind.STRING);
  static final ScalarType BOOLEAN = new ScalarType(ScalarKind.BOOLEAN);
  static final ScalarType UNTYPED = new ScalarType(ScalarKind.UNTYPED);

  /** Validates that the kind is non-null. */
  public ScalarType {
    Objects.requireNonNull(kind, "kind");
  }

  @Override
  public boolean isAtomic() {
    return true;
  }

  /** Returns true if the primitive is of the kind this type accepts. */
  public boolean accepts(JsonPrimitive value) {
    if (kind == ScalarKind.NUMERIC) {
      return value.isNumber();
    }
    if (kind == ScalarKind.STRING) {
      return value.isString();
    }
    if (kind == ScalarKind.BOOLEAN) {
      return value.isBoolean();
    }
    return true;
  }
}
