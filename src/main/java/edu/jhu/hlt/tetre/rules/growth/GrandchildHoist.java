package edu.jhu.hlt.tetre.rules.growth;

import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * The parser often attaches modifiers of the predicate to its subject or
 * object instead, e.g. "prep by" goes under "performance" in
 * <pre>
 * "... the proposed method improves the performance by 2.9 and 1.6 to 67.3 and 67.2 in F1-measure ..."
 * </pre>
 * which makes the object far too large. Prepositions by/to/for/with/whereby
 * and relcl/acl/advcl clauses found anywhere below a subject or object are
 * moved up to hang directly off the focus, as "prep" and "mod".
 */
public class GrandchildHoist implements Rule {
  public static final Logger LOG = Logger.getLogger(GrandchildHoist.class);

  public static final String NAME = "bringGrandchildPrepOrRelclUpAsChild";

  /** What to look for (label, text) and what to call it once it is moved */
  public static class Pattern {
    public final String label;
    public final String text;   // may be null
    public final String newLabel;

    public Pattern(String label, String text, String newLabel) {
      this.label = label;
      this.text = text;
      this.newLabel = newLabel;
    }

    @Override
    public String toString() {
      return label + "/" + text + "->" + newLabel;
    }
  }

  public static final List<Pattern> BRING_UP = ImmutableList.of(
      new Pattern("prep", "by", DependencyTags.PREP),
      new Pattern("prep", "to", DependencyTags.PREP),
      new Pattern("prep", "for", DependencyTags.PREP),
      new Pattern("prep", "with", DependencyTags.PREP),
      new Pattern("prep", "whereby", DependencyTags.PREP),
      new Pattern("relcl", null, DependencyTags.MOD),
      new Pattern("acl", null, DependencyTags.MOD),
      new Pattern("advcl", null, DependencyTags.MOD));

  private final int maxIterations;

  public GrandchildHoist(int maxIterations) {
    if (maxIterations <= 0)
      throw new IllegalArgumentException("maxIterations=" + maxIterations);
    this.maxIterations = maxIterations;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public RuleState apply(RuleState state) {
    DependencyTree t = state.getTree();
    int focus = state.getFocus();
    boolean applied = false;
    // Nodes hoisted below are appended to focus's children; they are not scanned
    for (TreeNode child : t.getChildren(focus)) {
      if (!DependencyTags.isObjectFamily(child.getLabel())
          && !DependencyTags.isSubjectFamily(child.getLabel()))
        continue;
      for (Pattern p : BRING_UP) {
        for (int iter = 0; ; iter++) {
          int found = findBelow(t, child, p);
          if (found == DependencyTree.NOT_FOUND)
            break;
          if (iter == maxIterations) {
            LOG.warn("[apply] stopped hoisting " + p + " from " + child + " after " + iter
                + " moves, " + t.getNode(found) + " is left");
            break;
          }
          t.reparent(found, focus, p.newLabel);
          state.getLabels().add(p.newLabel);
          applied = true;
        }
      }
    }
    return state.withApplied(applied);
  }

  /** First pre-order match strictly below n */
  private static int findBelow(DependencyTree t, TreeNode n, Pattern p) {
    for (int c : n.getChildren()) {
      int found = t.findFirst(c, p.label, p.text);
      if (found != DependencyTree.NOT_FOUND)
        return found;
    }
    return DependencyTree.NOT_FOUND;
  }
}
