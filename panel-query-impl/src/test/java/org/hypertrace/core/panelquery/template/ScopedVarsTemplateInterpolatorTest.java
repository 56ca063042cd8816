package org.hypertrace.core.panelquery.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.hypertrace.core.panelquery.api.InterpolationFormat;
import org.hypertrace.core.panelquery.api.ScopedVariable;
import org.junit.jupiter.api.Test;

public class ScopedVarsTemplateInterpolatorTest {

  private final ScopedVarsTemplateInterpolator interpolator =
      new ScopedVarsTemplateInterpolator(
          Map.of(
              "host", ScopedVariable.ofValues(List.of("web01", "web02")),
              "dc", ScopedVariable.of("lga")));

  @Test
  public void testMultiValueFormats() {
    assertEquals("web01|web02", interpolator.replace("$host", Map.of(), InterpolationFormat.PIPE));
    assertEquals("web01,web02", interpolator.replace("$host", Map.of(), InterpolationFormat.CSV));
    assertEquals(
        "{web01,web02}", interpolator.replace("$host", Map.of(), InterpolationFormat.GLOB));
  }

  @Test
  public void testAllReferenceSyntaxes() {
    assertEquals(
        "lga-lga-lga",
        interpolator.replace("$dc-${dc}-[[dc]]", Map.of(), InterpolationFormat.GLOB));
  }

  @Test
  public void testScopedVariablesShadowGlobals() {
    assertEquals(
        "sjc",
        interpolator.replace(
            "$dc", Map.of("dc", ScopedVariable.of("sjc")), InterpolationFormat.PIPE));
  }

  @Test
  public void testUnknownReferenceIsKept() {
    assertEquals(
        "sys.$unknown.cpu",
        interpolator.replace("sys.$unknown.cpu", Map.of(), InterpolationFormat.PIPE));
  }

  @Test
  public void testVariableExists() {
    assertTrue(interpolator.variableExists("$host"));
    assertTrue(interpolator.variableExists("[[dc]]"));
    assertFalse(interpolator.variableExists("$other"));
    assertFalse(interpolator.variableExists("web01"));
    assertFalse(interpolator.variableExists(null));
  }
}
