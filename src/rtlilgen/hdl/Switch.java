package rtlilgen.hdl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Multi-way branch on {@code test}. Cases are matched in order; the default case (if any) matches everything that no labeled case
 * matched.
 */
public record Switch(Value test, List<Case> cases) implements Statement {

  /**
   * One branch of a switch.
   * @param pattern bit pattern of '0', '1' and '-' (don't care), most significant bit first; null for the default case
   * @param body the statements executed when this branch is taken
   */
  public record Case(String pattern, List<Statement> body) {
    public Case {
      body = List.copyOf(body);
      if (pattern != null && !pattern.chars().allMatch(c -> c == '0' || c == '1' || c == '-'))
        throw new IllegalArgumentException("Case pattern '" + pattern + "' may only contain '0', '1' and '-'");
    }
    public static Case of(String pattern, Statement... body) { return new Case(pattern, List.of(body)); }
    public static Case defaultCase(Statement... body) { return new Case(null, List.of(body)); }

    public boolean isDefault() { return pattern == null; }
  }

  public Switch {
    cases = List.copyOf(cases);
    int defaults = 0;
    for (Case c : cases) {
      if (c.isDefault())
        ++defaults;
      else if (c.pattern().length() != test.width())
        throw new IllegalArgumentException("Case pattern '" + c.pattern() + "' does not match test width " + test.width());
    }
    if (defaults > 1)
      throw new IllegalArgumentException("A switch may have only one default case");
  }

  public Switch(Value test, Case... cases) { this(test, List.of(cases)); }

  /** @return the default case, if present */
  public Optional<Case> defaultCase() { return cases.stream().filter(Case::isDefault).findFirst(); }

  /** @return the labeled cases followed by the default case, so that first-match-wins keeps the default as catch-all */
  public List<Case> casesDefaultLast() {
    List<Case> ret = new ArrayList<>(cases.size());
    cases.stream().filter(c -> !c.isDefault()).forEach(ret::add);
    defaultCase().ifPresent(ret::add);
    return ret;
  }
}
