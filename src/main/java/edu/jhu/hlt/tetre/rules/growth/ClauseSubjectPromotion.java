package edu.jhu.hlt.tetre.rules.growth;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * When the focus hangs off its head as a relative clause or clausal
 * complement, the head is usually the focus's real subject:
 * <pre>
 * "... a promising research area which continuously improves web search relevance"
 * </pre>
 * puts "area" above "improves" (relcl). If the focus has no open class
 * subject of its own (closed class ones like "which" are dropped), the
 * attachment is inverted and the head becomes the focus's nsubj. Proper nouns
 * count as open class, so in "... two shortcomings that GeckoFTL improves upon"
 * GeckoFTL stays the subject.
 */
public class ClauseSubjectPromotion implements Rule {

  public static final String NAME = "replaceSubjIfDepIsRelclOrCcomp";

  public static final Set<String> UPWARDS = ImmutableSet.of("relcl", "ccomp");

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    DependencyTree t = state.getTree();
    TreeNode focus = state.getFocusNode();
    if (!UPWARDS.contains(focus.getLabel()) || focus.getHead() < 0)
      return state;

    List<Integer> evict = new ArrayList<>();
    boolean hasValidSubj = false;
    for (TreeNode c : t.getChildren(focus.getId())) {
      if (DependencyTags.SUBJECTS.contains(c.getLabel())) {
        if (DependencyTags.isOpenClass(c.getPos()))
          hasValidSubj = true;
        else
          evict.add(c.getId());
      }
    }
    for (int e : evict)
      t.detach(e);

    boolean applied = !evict.isEmpty();
    if (!hasValidSubj) {
      t.invert(focus.getId(), DependencyTags.DOWNWARDS_SUBJ);
      state.getLabels().add(DependencyTags.DOWNWARDS_SUBJ);
      applied = true;
    }
    return state.withApplied(applied);
  }
}
