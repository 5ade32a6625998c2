package edu.jhu.hlt.tetre.rules.reduction;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * Collapses label variants through {@link DependencyTags#rewrite(String)}.
 * Never reports a change.
 */
public class TransformTags implements Rule {

  public static final String NAME = "transformTags";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    state.getLabels().canonicalize();
    return state.withApplied(false);
  }
}
