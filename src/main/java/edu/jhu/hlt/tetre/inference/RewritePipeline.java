package edu.jhu.hlt.tetre.inference;

import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.RelationLabels;
import edu.jhu.hlt.tetre.rules.RuleSet;
import edu.jhu.hlt.tetre.rules.RuleState;
import edu.jhu.hlt.tetre.rules.growth.Growth;
import edu.jhu.hlt.tetre.rules.reduction.Reduction;
import edu.jhu.hlt.tetre.util.ExperimentProperties;

/**
 * Runs {@link Growth} and then {@link Reduction}, once each, over one
 * sentence's tree around a focus token.
 *
 * Not thread safe with respect to the tree: the caller must not touch the
 * tree while it is being rewritten. Instances hold no per-sentence state.
 */
public class RewritePipeline {
  private static final Logger LOG = Logger.getLogger(RewritePipeline.class);

  private final RuleSet growth;
  private final RuleSet reduction;

  public RewritePipeline() {
    this(new ExperimentProperties());
  }

  public RewritePipeline(ExperimentProperties config) {
    this(new Growth(config), new Reduction(config));
  }

  public RewritePipeline(RuleSet growth, RuleSet reduction) {
    this.growth = growth;
    this.reduction = reduction;
  }

  public RuleSet getGrowth() {
    return growth;
  }

  public RuleSet getReduction() {
    return reduction;
  }

  /**
   * Rewrites tree in place.
   * @param focus id of the focus token in tree
   */
  public Result process(DependencyTree tree, int focus) {
    if (focus < 0 || focus >= tree.size())
      throw new IllegalArgumentException("focus=" + focus + " not in a tree of size " + tree.size());
    RuleState init = RuleState.initial(tree, focus);
    RuleSet.Applied g = growth.apply(init);
    RuleSet.Applied r = reduction.apply(g.getState());
    RuleSet.Applied all = g.then(r);
    if (LOG.isDebugEnabled()) {
      LOG.debug("[process] focus=" + tree.getNode(focus).show() + " fired=" + all.getFired()
          + " labels=" + all.getState().getLabels());
    }
    return new Result(all.getState(), all.getFired());
  }

  /**
   * Rewrites a copy of tree, leaving the given tree as it was.
   */
  public Result processCopy(DependencyTree tree, int focus) {
    return process(tree.copy(), focus);
  }

  /**
   * Looks up the focus by its text (first pre-order match from the root).
   * @throws IllegalArgumentException if no token has that text.
   */
  public Result process(DependencyTree tree, String focusText) {
    int focus = tree.findFirst(tree.getRoot(), null, focusText);
    if (focus == DependencyTree.NOT_FOUND)
      throw new IllegalArgumentException("no token \"" + focusText + "\" in " + tree);
    return process(tree, focus);
  }

  /**
   * The rewritten tree, the labels seen under the focus, and which rules
   * changed something (Growth's then Reduction's, in order).
   */
  public static class Result {
    private final RuleState state;
    private final List<String> fired;

    public Result(RuleState state, List<String> fired) {
      this.state = state;
      this.fired = fired;
    }

    public DependencyTree getTree() {
      return state.getTree();
    }

    public int getFocus() {
      return state.getFocus();
    }

    public RelationLabels getLabels() {
      return state.getLabels();
    }

    public List<String> getFired() {
      return fired;
    }

    @Override
    public String toString() {
      return "(Result fired=" + fired + " labels=" + getLabels() + " tree=" + getTree() + ")";
    }
  }
}
