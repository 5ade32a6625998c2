package edu.jhu.hlt.tetre.rules.growth;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * Clausal complements often play the part of a missing object or subject:
 * <pre>
 * xcomp: "Recent work has showed that structured retrieval improves answer ranking for factoid questions"
 * ccomp: "Caching frequently accessed data at the client side not only improves the user's experience ..."
 * </pre>
 * For each (source, target) pair in order, if the focus has no child in the
 * target family, its first source child is relabeled to the target bucket.
 * Objects are filled before subjects.
 */
public class ComplementSubstitution implements Rule {

  public static final String NAME = "transformXcompToDobjOrSubjIfDoesntExist";

  public static final List<String[]> MOVE_IF = ImmutableList.of(
      new String[] {"xcomp", DependencyTags.OBJ},
      new String[] {"ccomp", DependencyTags.OBJ},
      new String[] {"xcomp", DependencyTags.SUBJ},
      new String[] {"ccomp", DependencyTags.SUBJ});

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    DependencyTree t = state.getTree();
    List<TreeNode> children = t.getChildren(state.getFocus());
    boolean applied = false;
    for (String[] rt : MOVE_IF) {
      String replace = rt[0];
      String target = rt[1];
      if (hasLabelContaining(children, target))
        continue;
      for (TreeNode c : children) {
        if (c.getLabel().contains(replace)) {
          String old = c.getLabel();
          c.setLabel(target);
          state.getLabels().replaceFirst(old, target);
          applied = true;
          break;
        }
      }
    }
    state.getLabels().canonicalize();
    return state.withApplied(applied);
  }

  static boolean hasLabelContaining(List<TreeNode> nodes, String s) {
    for (TreeNode n : nodes)
      if (n.getLabel().contains(s))
        return true;
    return false;
  }
}
