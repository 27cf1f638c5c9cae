package io.github.wphillipmoore.fieldmerge.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.JsonPrimitive;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TypeDefTest {

  // ---------------------------------------------------------------------------
  // Scalars
  // ---------------------------------------------------------------------------

  @Nested
  class Scalars {

    @Test
    void factoriesReturnSharedInstances() {
      assertThat(TypeDef.numeric()).isSameAs(TypeDef.numeric());
      assertThat(TypeDef.string().kind()).isEqualTo(ScalarKind.STRING);
      assertThat(TypeDef.bool().kind()).isEqualTo(ScalarKind.BOOLEAN);
      assertThat(TypeDef.untyped().kind()).isEqualTo(ScalarKind.UNTYPED);
    }

    @Test
    void scalarsAreAtomic() {
      assertThat(TypeDef.numeric().isAtomic()).isTrue();
    }

    @Test
    void eachKindAcceptsItsPrimitive() {
      assertThat(TypeDef.numeric().accepts(new JsonPrimitive(1))).isTrue();
      assertThat(TypeDef.numeric().accepts(new JsonPrimitive("1"))).isFalse();
      assertThat(TypeDef.string().accepts(new JsonPrimitive("a"))).isTrue();
      assertThat(TypeDef.string().accepts(new JsonPrimitive(true))).isFalse();
      assertThat(TypeDef.bool().accepts(new JsonPrimitive(false))).isTrue();
      assertThat(TypeDef.bool().accepts(new JsonPrimitive(0))).isFalse();
    }

    @Test
    void untypedAcceptsAnyPrimitive() {
      assertThat(TypeDef.untyped().accepts(new JsonPrimitive(1))).isTrue();
      assertThat(TypeDef.untyped().accepts(new JsonPrimitive("a"))).isTrue();
      assertThat(TypeDef.untyped().accepts(new JsonPrimitive(true))).isTrue();
    }

    @Test
    void nullKindThrowsNpe() {
      assertThatThrownBy(() -> new ScalarType(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("kind");
    }
  }

  // ---------------------------------------------------------------------------
  // Maps
  // ---------------------------------------------------------------------------

  @Nested
  class Maps {

    @Test
    void declaredFieldTypeWinsOverElementType() {
      MapType map =
          MapType.builder().field("count", TypeDef.numeric()).elementType(TypeDef.string()).build();

      assertThat(map.fieldType("count")).isEqualTo(TypeDef.numeric());
      assertThat(map.fieldType("other")).isEqualTo(TypeDef.string());
    }

    @Test
    void undeclaredFieldHasNoTypeWithoutElementType() {
      MapType map = MapType.builder().field("count", TypeDef.numeric()).build();

      assertThat(map.fieldType("other")).isNull();
    }

    @Test
    void mapsAreSeparableUnlessMarkedAtomic() {
      assertThat(MapType.builder().build().isAtomic()).isFalse();
      assertThat(MapType.builder().atomic().build().isAtomic()).isTrue();
    }

    @Test
    void associativeMapIsRejected() {
      assertThatThrownBy(() -> new MapType(Map.of(), null, ElementRelationship.ASSOCIATIVE))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("map relationship must be SEPARABLE or ATOMIC");
    }

    @Test
    void fieldsAreUnmodifiable() {
      MapType map = MapType.builder().field("count", TypeDef.numeric()).build();

      assertThatThrownBy(() -> map.fields().put("other", TypeDef.string()))
          .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equalDefinitionsAreEqual() {
      assertThat(MapType.builder().field("a", TypeDef.string()).build())
          .isEqualTo(MapType.builder().field("a", TypeDef.string()).build());
    }
  }

  // ---------------------------------------------------------------------------
  // Lists
  // ---------------------------------------------------------------------------

  @Nested
  class Lists {

    private final MapType port = MapType.builder().field("port", TypeDef.numeric()).build();

    @Test
    void keyedListShape() {
      ListType list = ListType.keyed(port, "port");

      assertThat(list.isKeyed()).isTrue();
      assertThat(list.isSet()).isFalse();
      assertThat(list.isAtomic()).isFalse();
      assertThat(list.keys()).containsExactly("port");
    }

    @Test
    void setShape() {
      ListType list = ListType.set(TypeDef.string());

      assertThat(list.isSet()).isTrue();
      assertThat(list.isKeyed()).isFalse();
      assertThat(list.isAtomic()).isFalse();
    }

    @Test
    void atomicShape() {
      ListType list = ListType.atomic(port);

      assertThat(list.isAtomic()).isTrue();
      assertThat(list.isKeyed()).isFalse();
      assertThat(list.isSet()).isFalse();
    }

    @Test
    void keyedListNeedsAKey() {
      assertThatThrownBy(() -> ListType.keyed(port))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("keyed lists need at least one key");
    }

    @Test
    void separableListIsRejected() {
      assertThatThrownBy(
              () -> new ListType(TypeDef.string(), ElementRelationship.SEPARABLE, List.of()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("list relationship must be ASSOCIATIVE or ATOMIC");
    }

    @Test
    void atomicListWithKeysIsRejected() {
      assertThatThrownBy(() -> new ListType(port, ElementRelationship.ATOMIC, List.of("port")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("atomic lists must not declare keys");
    }

    @Test
    void setOfMapsIsRejected() {
      assertThatThrownBy(() -> new ListType(port, ElementRelationship.ASSOCIATIVE, List.of()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("set-like lists must have scalar elements");
    }

    @Test
    void keyedListOfScalarsIsRejected() {
      assertThatThrownBy(
              () -> new ListType(TypeDef.string(), ElementRelationship.ASSOCIATIVE, List.of("k")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("keyed lists must have map elements");
    }
  }
}
