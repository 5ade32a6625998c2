package edu.jhu.hlt.tetre.rules.growth;

import java.util.List;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * "... matrix co-factorization helps to handle multiple aspects of the data
 * and improves in predicting individual decisions"
 *
 * Reads as "improves prediction of individual decisions", so when there is no
 * object, whatever follows a "prep in" is the object.
 */
public class PrepInPromotion implements Rule {

  public static final String NAME = "transformPrepInToDobj";

  public static final String IN = "in";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    List<TreeNode> children = state.getTree().getChildren(state.getFocus());
    boolean applied = false;
    if (!ComplementSubstitution.hasLabelContaining(children, DependencyTags.OBJ)) {
      for (TreeNode c : children) {
        if (c.getLabel().contains(DependencyTags.PREP) && IN.equals(c.getText())) {
          String old = c.getLabel();
          c.setLabel(DependencyTags.OBJ);
          state.getLabels().replaceFirst(old, DependencyTags.OBJ);
          applied = true;
        }
      }
    }
    state.getLabels().canonicalize();
    return state.withApplied(applied);
  }
}
