package org.hypertrace.core.panelquery.template;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.hypertrace.core.panelquery.api.InterpolationFormat;
import org.hypertrace.core.panelquery.api.ScopedVariable;
import org.hypertrace.core.panelquery.api.TemplateInterpolator;

/**
 * Resolves {@code $name}, {@code ${name}} and {@code [[name]]} references against the scoped
 * variables of a request, then against a fixed set of dashboard level variables. References to
 * unknown variables are left as they are.
 */
public class ScopedVarsTemplateInterpolator implements TemplateInterpolator {

  private static final Pattern VARIABLE_REFERENCE =
      Pattern.compile("\\$(\\w+)|\\[\\[(\\w+)]]|\\$\\{(\\w+)}");

  private final Map<String, ScopedVariable> globalVariables;

  public ScopedVarsTemplateInterpolator(Map<String, ScopedVariable> globalVariables) {
    this.globalVariables = Map.copyOf(globalVariables);
  }

  @Override
  public String replace(
      String text, Map<String, ScopedVariable> scopedVars, InterpolationFormat format) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    Matcher matcher = VARIABLE_REFERENCE.matcher(text);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String name = referencedName(matcher);
      String replacement =
          lookup(name, scopedVars)
              .map(variable -> format(variable, format))
              .orElse(matcher.group());
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  @Override
  public boolean variableExists(String text) {
    if (text == null) {
      return false;
    }
    Matcher matcher = VARIABLE_REFERENCE.matcher(text);
    return matcher.find() && globalVariables.containsKey(referencedName(matcher));
  }

  private Optional<ScopedVariable> lookup(String name, Map<String, ScopedVariable> scopedVars) {
    if (scopedVars != null && scopedVars.containsKey(name)) {
      return Optional.of(scopedVars.get(name));
    }
    return Optional.ofNullable(globalVariables.get(name));
  }

  private static String referencedName(Matcher matcher) {
    for (int group = 1; group <= matcher.groupCount(); group++) {
      if (matcher.group(group) != null) {
        return matcher.group(group);
      }
    }
    throw new IllegalStateException("No variable name in " + matcher.group());
  }

  private static String format(ScopedVariable variable, InterpolationFormat format) {
    List<String> values = variable.getValues();
    if (values.isEmpty()) {
      return variable.getText() == null ? "" : variable.getText();
    }
    if (values.size() == 1) {
      return values.get(0);
    }
    switch (format) {
      case PIPE:
        return String.join("|", values);
      case CSV:
        return String.join(",", values);
      case GLOB:
      default:
        return "{" + String.join(",", values) + "}";
    }
  }
}
