package edu.jhu.hlt.tetre.datatypes;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One token (or synthetic constituent) of a {@link DependencyTree}. Nodes are
 * addressed by their id in the owning tree; head and children are stored as
 * ids and may only be rewired through the tree, which keeps both sides of an
 * edge in agreement.
 */
public class TreeNode implements Serializable {
  private static final long serialVersionUID = 1L;

  private final int id;
  private String label;
  private final String pos;
  private final String text;
  private final int idx;
  private final int nLefts, nRights;

  // Owned by DependencyTree
  int head;
  final List<Integer> children;

  // Only read by whoever renders the result
  private boolean suppressed;

  TreeNode(int id, String label, String pos, String text, int idx, int nLefts, int nRights) {
    if (nLefts < 0 || nRights < 0)
      throw new IllegalArgumentException("nLefts=" + nLefts + " nRights=" + nRights);
    this.id = id;
    this.label = label;
    this.pos = pos;
    this.text = text;
    this.idx = idx;
    this.nLefts = nLefts;
    this.nRights = nRights;
    this.head = DependencyTree.DETACHED;
    this.children = new ArrayList<>();
  }

  public int getId() {
    return id;
  }

  /** The relation to this node's head, e.g. "nsubj" */
  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    if (label == null)
      throw new IllegalArgumentException();
    this.label = label;
  }

  public String getPos() {
    return pos;
  }

  public String getText() {
    return text;
  }

  /** Position in the original sentence */
  public int getIdx() {
    return idx;
  }

  public int getNumLefts() {
    return nLefts;
  }

  public int getNumRights() {
    return nRights;
  }

  /**
   * As reported by the parser, not the current number of children.
   */
  public boolean isLeaf() {
    return nLefts + nRights == 0;
  }

  /**
   * @return the id of this node's head, {@link DependencyTree#ROOT} or
   * {@link DependencyTree#DETACHED}.
   */
  public int getHead() {
    return head;
  }

  public boolean isRoot() {
    return head == DependencyTree.ROOT;
  }

  public boolean isDetached() {
    return head == DependencyTree.DETACHED;
  }

  /** Ids of this node's children, in order */
  public List<Integer> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public boolean isSuppressed() {
    return suppressed;
  }

  public void setSuppressed(boolean suppressed) {
    this.suppressed = suppressed;
  }

  TreeNode copy() {
    TreeNode n = new TreeNode(id, label, pos, text, idx, nLefts, nRights);
    n.head = head;
    n.children.addAll(children);
    n.suppressed = suppressed;
    return n;
  }

  /** label/text/pos, the same string {@link DependencyTree#toTreeString(int)} uses */
  public String show() {
    return label + "/" + text + "/" + pos;
  }

  @Override
  public String toString() {
    return "(TreeNode id=" + id + " " + show() + " idx=" + idx + " head=" + head + ")";
  }
}
