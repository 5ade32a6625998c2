package edu.jhu.hlt.tetre.rules.reduction;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.tetre.rules.RuleSet;
import edu.jhu.hlt.tetre.util.ExperimentProperties;

/**
 * Normalizes what {@link edu.jhu.hlt.tetre.rules.growth.Growth} leaves
 * behind: fewer, canonical labels and at most one subject and one object
 * under the focus. Running it twice gives the same labels as running it once.
 */
public class Reduction extends RuleSet {

  public Reduction() {
    this(new ExperimentProperties());
  }

  public Reduction(ExperimentProperties config) {
    super(ImmutableList.of(
        new RemoveDuplicates(),
        new SuppressTags(),
        new TransformTags(),
        new MergeMultipleSubjOrObj()),
        config);
  }
}
