package io.github.wphillipmoore.fieldmerge.managed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import io.github.wphillipmoore.fieldmerge.path.PathElement;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ManagedFieldsCodecTest {

  private static final FieldPath SPEC_MARKER =
      FieldPath.fields("spec").append(PathElement.WHOLE_VALUE);
  private static final FieldPath HTTP_PROTOCOL =
      FieldPath.fields("spec", "ports")
          .append(PathElement.parse("k:{\"port\":80}"))
          .append(new PathElement.FieldName("protocol"));

  // ---------------------------------------------------------------------------
  // Writing
  // ---------------------------------------------------------------------------

  @Nested
  class Writing {

    @Test
    void emptySnapshotIsAnEmptyObject() {
      assertThat(ManagedFieldsCodec.toJson(ManagedFields.empty())).isEqualTo("{}");
    }

    @Test
    void writesSortedManagersAndPaths() {
      ManagedFields managed =
          ManagedFields.of(
              Map.of(
                  "operator",
                  new VersionedSet(FieldSet.of(HTTP_PROTOCOL, SPEC_MARKER), "v1", true),
                  "controller",
                  new VersionedSet(FieldSet.of(FieldPath.fields("bool")), "v2", false)));

      assertThat(ManagedFieldsCodec.toJson(managed))
          .isEqualTo(
              "{\"controller\":{\"apiVersion\":\"v2\",\"applied\":false,\"fields\":[[\"f:bool\"]]},"
                  + "\"operator\":{\"apiVersion\":\"v1\",\"applied\":true,\"fields\":["
                  + "[\"f:spec\",\"f:ports\",\"k:{\\\"port\\\":80}\",\"f:protocol\"],"
                  + "[\"f:spec\",\".\"]]}}");
    }
  }

  // ---------------------------------------------------------------------------
  // Reading
  // ---------------------------------------------------------------------------

  @Nested
  class Reading {

    @Test
    void readsWhatWasWritten() {
      ManagedFields managed =
          ManagedFields.of(
              Map.of(
                  "operator",
                  new VersionedSet(FieldSet.of(HTTP_PROTOCOL, SPEC_MARKER), "v1", true)));

      assertThat(ManagedFieldsCodec.fromJson(ManagedFieldsCodec.toJson(managed)))
          .isEqualTo(managed);
    }

    @Test
    void readsHandWrittenDocument() {
      ManagedFields managed =
          ManagedFieldsCodec.fromJson(
              """
              {
                "controller": {"apiVersion": "v1", "applied": false, "fields": [["f:bool"]]}
              }
              """);

      assertThat(managed.get("controller"))
          .isEqualTo(new VersionedSet(FieldSet.of(FieldPath.fields("bool")), "v1", false));
    }

    @Test
    void entriesWithoutFieldsAreDropped() {
      ManagedFields managed =
          ManagedFieldsCodec.fromJson(
              """
              {"a": {"apiVersion": "v1", "applied": true, "fields": []},
               "b": {"apiVersion": "v1", "applied": true}}
              """);

      assertThat(managed.isEmpty()).isTrue();
    }

    @Test
    void missingAppliedFlagReadsAsUpdate() {
      ManagedFields managed =
          ManagedFieldsCodec.fromJson("{\"a\": {\"apiVersion\": \"v1\", \"fields\": [[\"f:x\"]]}}");

      assertThat(managed.get("a").applied()).isFalse();
    }

    @Test
    void nullJsonThrowsNpe() {
      assertThatThrownBy(() -> ManagedFieldsCodec.fromJson(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("json");
    }

    @Test
    void emptyJsonThrows() {
      assertThatThrownBy(() -> ManagedFieldsCodec.fromJson(""))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("json must not be empty");
    }

    @Test
    void malformedJsonThrows() {
      assertThatThrownBy(() -> ManagedFieldsCodec.fromJson("{\"a\": "))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("json is not a managed fields document");
    }

    @Test
    void wrongShapeThrows() {
      assertThatThrownBy(() -> ManagedFieldsCodec.fromJson("[1, 2]"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("json is not a managed fields document");
    }

    @Test
    void missingApiVersionThrows() {
      assertThatThrownBy(
              () -> ManagedFieldsCodec.fromJson("{\"a\": {\"applied\": true, \"fields\": []}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("entry for manager 'a' has no apiVersion");
    }

    @Test
    void malformedPathElementThrows() {
      assertThatThrownBy(
              () ->
                  ManagedFieldsCodec.fromJson(
                      "{\"a\": {\"apiVersion\": \"v1\", \"fields\": [[\"q:x\"]]}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown path element: q:x");
    }

    @Test
    void nullPathElementThrows() {
      assertThatThrownBy(
              () ->
                  ManagedFieldsCodec.fromJson(
                      "{\"a\": {\"apiVersion\": \"v1\", \"fields\": [[\"f:x\", null]]}}"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("entry for manager 'a' has a null path element");
    }
  }
}
