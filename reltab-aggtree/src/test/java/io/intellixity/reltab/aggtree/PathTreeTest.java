package io.intellixity.reltab.aggtree;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PathTreeTest {
  @Test
  void rootHasItsOwnOpenState() {
    assertFalse(PathTree.empty().isOpen(List.of()));
    assertTrue(PathTree.root().isOpen(List.of()));
    assertFalse(PathTree.root().isOpen(List.of("Police")));
    assertEquals(PathTree.root(), PathTree.empty().open(List.of()));
    assertNotEquals(PathTree.empty(), PathTree.root());
    assertTrue(PathTree.empty().open(List.of("Police")).isOpen(List.of()));
  }

  @Test
  void closingTheRootClosesEverything() {
    PathTree t = PathTree.root().open(List.of("Police", "Police Chief"));
    assertEquals(PathTree.empty(), t.close(List.of()));
    assertFalse(t.close(List.of()).isOpen(List.of("Police")));
    assertEquals(Set.of(), PathTree.empty().children(List.of()));
  }

  @Test
  void openingAPathOpensItsPrefixes() {
    PathTree t = PathTree.empty().open(List.of("Police", "Police Chief"));
    assertTrue(t.isOpen(List.of("Police")));
    assertTrue(t.isOpen(List.of("Police", "Police Chief")));
    assertEquals(List.of(List.of("Police"), List.of("Police", "Police Chief")), t.openPaths());
  }

  @Test
  void closingRemovesDescendants() {
    PathTree t = PathTree.empty()
        .open(List.of("Police", "Police Chief"))
        .open(List.of("Safety"))
        .close(List.of("Police"));
    assertFalse(t.isOpen(List.of("Police", "Police Chief")));
    assertEquals(List.of(List.of("Safety")), t.openPaths());
    assertEquals(PathTree.root(), t.close(List.of("Safety")));
    assertSame(t, t.close(List.of("Legal & Paralegal")));
  }

  @Test
  void openPathsAreDepthFirst() {
    PathTree t = PathTree.empty()
        .open(List.of("A", "x"))
        .open(List.of("B"))
        .open(List.of("A", "y"));
    assertEquals(List.of(List.of("A"), List.of("A", "x"), List.of("A", "y"), List.of("B")), t.openPaths());
    assertEquals(Set.of("x", "y"), t.children(List.of("A")));
  }

  @Test
  void nullIsAValidPathValue() {
    PathTree t = PathTree.empty().open(Arrays.asList(null, "x"));
    assertTrue(t.isOpen(Arrays.asList((Object) null)));
    assertTrue(t.isOpen(Arrays.asList(null, "x")));
  }

  @Test
  void mapFormRoundTrips() {
    PathTree t = PathTree.fromMap(Map.of("Police", Map.of("Police Chief", Map.of()), "Safety", Map.of()));
    assertTrue(t.isOpen(List.of("Police", "Police Chief")));
    assertEquals(t, PathTree.fromMap(t.toMap()));
    assertEquals(PathTree.empty(), PathTree.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> PathTree.fromMap(Map.of("Police", "open")));
  }
}
