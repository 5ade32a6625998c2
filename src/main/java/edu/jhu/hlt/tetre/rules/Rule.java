package edu.jhu.hlt.tetre.rules;

/**
 * One heuristic rewrite of the tree around the focus node.
 *
 * Implementations are run exactly once per {@link RuleSet#apply(RuleState)};
 * a rule which needs to reach a fixpoint must loop on its own, and must
 * guarantee that the loop terminates.
 */
public interface Rule {

  /** Shows up in the firing log */
  public String getName();

  /**
   * May mutate the tree and label collection in state.
   *
   * @return the state to pass to the next rule, whose
   * {@link RuleState#isApplied()} says whether this rule changed anything.
   */
  public RuleState apply(RuleState state);
}
