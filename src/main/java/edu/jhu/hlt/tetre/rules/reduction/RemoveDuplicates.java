package edu.jhu.hlt.tetre.rules.reduction;

import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * Sentences with e.g. several "punct" children end up with the same labels.
 * Never reports a change.
 */
public class RemoveDuplicates implements Rule {

  public static final String NAME = "removeDuplicates";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    state.getLabels().dedup();
    return state.withApplied(false);
  }
}
