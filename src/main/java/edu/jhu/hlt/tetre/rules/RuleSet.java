package edu.jhu.hlt.tetre.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.tetre.util.ExperimentProperties;

/**
 * An ordered list of {@link Rule}s. {@link #apply(RuleState)} runs each rule
 * exactly once, in order, and records the names of the rules which changed
 * something. The order of the list is the precedence of the heuristics.
 */
public abstract class RuleSet {
  protected Logger log = Logger.getLogger(this.getClass());

  public static final String CHECK_INVARIANTS = "rules.checkInvariants";

  private final List<Rule> rules;
  private final boolean checkInvariants;

  public RuleSet(List<? extends Rule> rules, ExperimentProperties config) {
    this.rules = ImmutableList.copyOf(rules);
    this.checkInvariants = config.getBoolean(CHECK_INVARIANTS, true);
  }

  public String getName() {
    return getClass().getSimpleName();
  }

  public List<Rule> getRules() {
    return rules;
  }

  /**
   * Runs every rule once, in order.
   * @throws edu.jhu.hlt.tetre.datatypes.DependencyTree.StructuralInvariantException
   * if invariant checking is on and a rule left the tree in a bad state.
   */
  public Applied apply(RuleState state) {
    List<String> fired = new ArrayList<>();
    for (Rule r : rules) {
      state = r.apply(state.withApplied(false));
      if (checkInvariants)
        state.getTree().checkInvariants();
      if (state.isApplied()) {
        fired.add(r.getName());
        if (log.isDebugEnabled()) {
          log.debug("[apply] " + getName() + " fired " + r.getName() + ", labels="
              + state.getLabels() + " tree=" + state.getTree());
        }
      }
    }
    return new Applied(state.withApplied(!fired.isEmpty()), fired);
  }

  /**
   * The state after running a rule set and the names of the rules which
   * fired, in order.
   */
  public static class Applied {
    private final RuleState state;
    private final List<String> fired;

    public Applied(RuleState state, List<String> fired) {
      this.state = state;
      this.fired = Collections.unmodifiableList(new ArrayList<>(fired));
    }

    public RuleState getState() {
      return state;
    }

    public List<String> getFired() {
      return fired;
    }

    /**
     * Result of running other's rule set after this one: other's state, the
     * firing logs concatenated.
     */
    public Applied then(Applied other) {
      List<String> f = new ArrayList<>(fired);
      f.addAll(other.fired);
      return new Applied(other.state, f);
    }

    @Override
    public String toString() {
      return "(Applied fired=" + fired + " " + state + ")";
    }
  }
}
