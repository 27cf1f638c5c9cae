package io.github.wphillipmoore.fieldmerge.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.fieldmerge.managed.ManagedFields;
import io.github.wphillipmoore.fieldmerge.managed.VersionedSet;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import io.github.wphillipmoore.fieldmerge.path.PathElement;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConflictDetectorTest {

  private static final FieldPath SPEC = FieldPath.fields("spec");
  private static final FieldPath REPLICAS = FieldPath.fields("spec", "replicas");
  private static final FieldPath IMAGE = FieldPath.fields("spec", "image");

  @Test
  void noOwnersMeansNoConflicts() {
    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS), ManagedFields.empty(), "m"))
        .isEmpty();
  }

  @Test
  void pathOwnedByAnotherManagerConflicts() {
    ManagedFields managed =
        ManagedFields.of(Map.of("other", new VersionedSet(FieldSet.of(REPLICAS), "v1", true)));

    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS, IMAGE), managed, "m"))
        .containsExactly(new Conflict("other", REPLICAS));
  }

  @Test
  void pathOwnedByTheActingManagerDoesNotConflict() {
    ManagedFields managed =
        ManagedFields.of(Map.of("m", new VersionedSet(FieldSet.of(REPLICAS), "v1", true)));

    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS), managed, "m")).isEmpty();
  }

  @Test
  void ownedAncestorCoversChangedDescendant() {
    ManagedFields managed =
        ManagedFields.of(Map.of("other", new VersionedSet(FieldSet.of(SPEC), "v1", false)));

    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS), managed, "m"))
        .containsExactly(new Conflict("other", REPLICAS));
  }

  @Test
  void ownedWholeValueMarkerDoesNotCoverChildren() {
    ManagedFields managed =
        ManagedFields.of(
            Map.of(
                "other",
                new VersionedSet(FieldSet.of(SPEC.append(PathElement.WHOLE_VALUE)), "v1", true)));

    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS), managed, "m")).isEmpty();
  }

  @Test
  void versionsAreNotCompared() {
    ManagedFields managed =
        ManagedFields.of(Map.of("other", new VersionedSet(FieldSet.of(REPLICAS), "v2", true)));

    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS), managed, "m")).hasSize(1);
  }

  @Test
  void conflictsAreSortedByManagerThenPath() {
    ManagedFields managed =
        ManagedFields.of(
            Map.of(
                "zeta", new VersionedSet(FieldSet.of(IMAGE), "v1", true),
                "alpha", new VersionedSet(FieldSet.of(REPLICAS, IMAGE), "v1", false)));

    assertThat(ConflictDetector.detect(FieldSet.of(REPLICAS, IMAGE), managed, "m"))
        .containsExactly(
            new Conflict("alpha", IMAGE),
            new Conflict("alpha", REPLICAS),
            new Conflict("zeta", IMAGE));
  }

  @Test
  void nullArgumentsThrowNpe() {
    assertThatThrownBy(() -> ConflictDetector.detect(null, ManagedFields.empty(), "m"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("changed");
    assertThatThrownBy(() -> ConflictDetector.detect(FieldSet.empty(), null, "m"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("managed");
    assertThatThrownBy(() -> ConflictDetector.detect(FieldSet.empty(), ManagedFields.empty(), null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("manager");
  }
}
