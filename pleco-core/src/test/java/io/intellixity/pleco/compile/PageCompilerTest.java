package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.LimitOffsetPage;
import io.intellixity.pleco.query.PageDefaults;
import io.intellixity.pleco.querybuilder.RecordingQueryBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PageCompilerTest {
  private final PageCompiler compiler = new PageCompiler();

  @Test
  void absentPageLeavesQueryUntouched() {
    RecordingQueryBuilder base = RecordingQueryBuilder.table("vehicles");
    assertSame(base, compiler.compile((LimitOffsetPage) null, base));
    assertEquals("from(vehicles)", base.build());
  }

  @Test
  void emptyPageStillAppliesDefaultOffset() {
    assertEquals("from(vehicles) offset(0)", compiler.compile(Map.of(), RecordingQueryBuilder.table("vehicles")).build());
  }

  @Test
  void limitAndOffsetAreApplied() {
    String out = compiler.compile(LimitOffsetPage.of(10, 20), RecordingQueryBuilder.table("vehicles")).build();
    assertEquals("from(vehicles) offset(20) limit(10)", out);
  }

  @Test
  void configuredDefaultOffsetIsUsed() {
    PageCompiler c = new PageCompiler(new PageDefaults(5));
    assertEquals("from(vehicles) offset(5) limit(3)", c.compile(LimitOffsetPage.limit(3), RecordingQueryBuilder.table("vehicles")).build());
  }

  @Test
  void nonNumericInputIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> compiler.compile(Map.of("limit", "ten"), RecordingQueryBuilder.table("vehicles")));
  }

  @Test
  void boundsOutsideIntRangeAreRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> compiler.compile(Map.of("limit", 4294967301L), RecordingQueryBuilder.table("vehicles")));
    assertTrue(e.getMessage().contains("page.limit"), e.getMessage());

    e = assertThrows(IllegalArgumentException.class,
        () -> compiler.compile(Map.of("offset", 4294967296L), RecordingQueryBuilder.table("vehicles")));
    assertTrue(e.getMessage().contains("page.offset"), e.getMessage());
  }

  @Test
  void fractionalBoundsAreRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> compiler.compile(Map.of("limit", 2.5), RecordingQueryBuilder.table("vehicles")));
    assertTrue(e.getMessage().contains("page.limit"), e.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> compiler.compile(Map.of("offset", Double.NaN), RecordingQueryBuilder.table("vehicles")));
  }

  @Test
  void integralNumbersOfAnyTypeAreAccepted() {
    String out = compiler.compile(Map.of("limit", 10.0, "offset", 20L), RecordingQueryBuilder.table("vehicles")).build();
    assertEquals("from(vehicles) offset(20) limit(10)", out);
  }
}
