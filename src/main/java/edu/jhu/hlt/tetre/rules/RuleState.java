package edu.jhu.hlt.tetre.rules;

import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.RelationLabels;
import edu.jhu.hlt.tetre.datatypes.TreeNode;

/**
 * What gets threaded through the rules: the tree, the labels observed under
 * the focus node, the focus node, and whether the last rule fired.
 */
public final class RuleState {

  private final DependencyTree tree;
  private final RelationLabels labels;
  private final int focus;
  private final boolean applied;

  public RuleState(DependencyTree tree, RelationLabels labels, int focus) {
    this(tree, labels, focus, false);
  }

  public RuleState(DependencyTree tree, RelationLabels labels, int focus, boolean applied) {
    if (tree == null || labels == null)
      throw new IllegalArgumentException();
    tree.getNode(focus);
    this.tree = tree;
    this.labels = labels;
    this.focus = focus;
    this.applied = applied;
  }

  /** Starts from the labels of focus's children */
  public static RuleState initial(DependencyTree tree, int focus) {
    return new RuleState(tree, RelationLabels.ofChildren(tree, focus), focus);
  }

  public DependencyTree getTree() {
    return tree;
  }

  public int getRoot() {
    return tree.getRoot();
  }

  public RelationLabels getLabels() {
    return labels;
  }

  public int getFocus() {
    return focus;
  }

  public TreeNode getFocusNode() {
    return tree.getNode(focus);
  }

  public boolean isApplied() {
    return applied;
  }

  public RuleState withApplied(boolean applied) {
    return new RuleState(tree, labels, focus, applied);
  }

  public RuleState withLabels(RelationLabels labels) {
    return new RuleState(tree, labels, focus, applied);
  }

  @Override
  public String toString() {
    return "(RuleState focus=" + getFocusNode().show() + " labels=" + labels
        + " applied=" + applied + ")";
  }
}
