package edu.jhu.hlt.tetre.rules.reduction;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * Drops labels which say nothing about the relation (punctuation, markers,
 * blanks) and flags the focus's children carrying them as suppressed. The
 * tree itself is left alone.
 */
public class SuppressTags implements Rule {

  public static final String NAME = "removeTags";

  public static final Set<String> TAGS_TO_BE_REMOVED =
      ImmutableSet.of("punct", "mark", " ", "", "meta");

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    state.getLabels().dedup();
    state.getLabels().removeAll(TAGS_TO_BE_REMOVED);
    boolean applied = false;
    for (TreeNode c : state.getTree().getChildren(state.getFocus())) {
      if (TAGS_TO_BE_REMOVED.contains(c.getLabel())) {
        c.setSuppressed(true);
        applied = true;
      }
    }
    return state.withApplied(applied);
  }
}
