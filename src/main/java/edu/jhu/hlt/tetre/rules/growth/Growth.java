package edu.jhu.hlt.tetre.rules.growth;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.tetre.rules.RuleSet;
import edu.jhu.hlt.tetre.util.ExperimentProperties;

/**
 * Rules which move subjects and objects (and the modifiers hiding under them)
 * into place around the focus predicate. Order matters: a subject found by an
 * earlier rule keeps later rules from inventing one.
 */
public class Growth extends RuleSet {

  public static final String CONJ_MAX_ITERATIONS = "rules.conj.maxIterations";
  public static final String HOIST_MAX_ITERATIONS = "rules.hoist.maxIterations";

  public Growth() {
    this(new ExperimentProperties());
  }

  public Growth(ExperimentProperties config) {
    super(ImmutableList.of(
        new ClauseSubjectPromotion(),
        new CoordinatedClauseRecursion(config.getInt(CONJ_MAX_ITERATIONS, 64)),
        new ComplementSubstitution(),
        new PrepInPromotion(),
        new GrandchildHoist(config.getInt(HOIST_MAX_ITERATIONS, 256))),
        config);
  }
}
