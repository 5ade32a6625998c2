package edu.jhu.hlt.tetre.rules.reduction;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * "Another partitional method ORCLUS [2] improves PROCLUS by selecting
 * principal components ..."
 *
 * has two nsubj, "Another partitional method" and "ORCLUS [2]", which belong
 * together. When the focus has more than one subject (or object) child they
 * are put under one synthetic node which takes their place, so afterwards
 * there is at most one of each.
 */
public class MergeMultipleSubjOrObj implements Rule {

  public static final String NAME = "mergeMultipleSubjOrDobj";

  public static final List<String> GROUPS =
      ImmutableList.of(DependencyTags.SUBJ, DependencyTags.OBJ);

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    DependencyTree t = state.getTree();
    int focus = state.getFocus();
    boolean applied = false;
    for (String group : GROUPS) {
      List<Integer> members = new ArrayList<>();
      for (TreeNode c : t.getChildren(focus))
        if (c.getLabel().contains(group))
          members.add(c.getId());
      if (members.size() < 2)
        continue;
      int merged = t.mergeNodes(members);
      t.reparent(merged, focus);
      applied = true;
    }
    return state.withApplied(applied);
  }
}
