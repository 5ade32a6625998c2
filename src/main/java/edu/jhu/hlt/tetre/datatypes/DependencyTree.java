package edu.jhu.hlt.tetre.datatypes;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * A mutable dependency tree for one sentence. Nodes live in an arena and are
 * addressed by a stable integer id (for parsed tokens, the token's position
 * in the sentence). Every structural change goes through this class so that
 * a node's head and its parent's children list never disagree.
 *
 * Detached nodes (and their subtrees) stay in the arena but are no longer
 * reachable from the root.
 */
public class DependencyTree implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Head of the root node */
  public static final int ROOT = -1;
  /** Head of a node which is not attached anywhere */
  public static final int DETACHED = -2;
  /** Returned by {@link #findFirst(int, String, String)} */
  public static final int NOT_FOUND = -1;

  /**
   * Thrown when the head/children bookkeeping is broken, or when an operation
   * would break it. This is always a programming error.
   */
  public static class StructuralInvariantException extends IllegalStateException {
    private static final long serialVersionUID = 1L;
    public StructuralInvariantException(String message) {
      super(message);
    }
  }

  private final List<TreeNode> nodes;
  private int root;

  public DependencyTree() {
    this.nodes = new ArrayList<>();
    this.root = ROOT;
  }

  /**
   * Reads the parser's output in CoNLL-X format. Only FORM (1), CPOSTAG (3),
   * HEAD (6) and DEPREL (7) are used. Token i gets id i, and its left/right
   * child counts are the number of dependents before/after it.
   */
  public static DependencyTree fromConllx(List<String[]> conllx) {
    int n = conllx.size();
    if (n == 0)
      throw new IllegalArgumentException("empty sentence");
    int[] heads = new int[n];
    int[] lefts = new int[n];
    int[] rights = new int[n];
    for (int i = 0; i < n; i++) {
      String[] ar = conllx.get(i);
      if (ar.length < 8)
        throw new IllegalArgumentException("not enough columns in row " + i + ": " + ar.length);
      heads[i] = Integer.parseInt(ar[6]) - 1;
      if (heads[i] >= n || heads[i] < ROOT)
        throw new IllegalArgumentException("bad head for row " + i + ": " + ar[6]);
      if (heads[i] >= 0) {
        if (i < heads[i])
          lefts[heads[i]]++;
        else
          rights[heads[i]]++;
      }
    }
    DependencyTree t = new DependencyTree();
    for (int i = 0; i < n; i++) {
      String[] ar = conllx.get(i);
      t.addNode(ar[7], ar[3], ar[1], i, lefts[i], rights[i]);
    }
    for (int i = 0; i < n; i++) {
      if (heads[i] == ROOT) {
        if (t.root != ROOT)
          throw new IllegalArgumentException("multiple roots: " + t.root + " and " + i);
        t.setRoot(i);
      }
    }
    if (t.root == ROOT)
      throw new IllegalArgumentException("no root");
    // Children are added in sentence order
    for (int i = 0; i < n; i++)
      if (heads[i] >= 0)
        t.reparent(i, heads[i]);
    t.checkInvariants();
    return t;
  }

  /**
   * Adds a new node which is not attached to anything.
   * @return the new node's id
   */
  public int addNode(String label, String pos, String text, int idx, int nLefts, int nRights) {
    int id = nodes.size();
    nodes.add(new TreeNode(id, label, pos, text, idx, nLefts, nRights));
    return id;
  }

  /**
   * Makes a detached node the root. The previous root (if any) becomes detached.
   */
  public void setRoot(int id) {
    TreeNode n = getNode(id);
    if (!n.isDetached() && !n.isRoot())
      throw new StructuralInvariantException("can't make an attached node the root: " + n);
    if (root != ROOT)
      nodes.get(root).head = DETACHED;
    n.head = ROOT;
    root = id;
  }

  public int getRoot() {
    return root;
  }

  public TreeNode getNode(int id) {
    if (id < 0 || id >= nodes.size())
      throw new StructuralInvariantException("no node with id " + id);
    return nodes.get(id);
  }

  /** Number of nodes in the arena, including detached and synthetic ones */
  public int size() {
    return nodes.size();
  }

  public List<TreeNode> getChildren(int id) {
    TreeNode n = getNode(id);
    List<TreeNode> c = new ArrayList<>(n.children.size());
    for (int i : n.children)
      c.add(nodes.get(i));
    return c;
  }

  /** True if a is a proper ancestor of b */
  public boolean isAncestor(int a, int b) {
    int steps = 0;
    for (int h = getNode(b).head; h >= 0; h = nodes.get(h).head) {
      if (h == a)
        return true;
      if (++steps > nodes.size())
        throw new StructuralInvariantException("cycle above node " + b);
    }
    return false;
  }

  /**
   * Moves node (and its subtree) to the end of newParent's children.
   */
  public void reparent(int node, int newParent) {
    TreeNode n = getNode(node);
    TreeNode p = getNode(newParent);
    if (node == newParent || isAncestor(node, newParent))
      throw new StructuralInvariantException("reparenting " + n + " under " + p + " creates a cycle");
    if (n.isRoot())
      throw new StructuralInvariantException("can't reparent the root: " + n);
    unlink(n);
    n.head = newParent;
    p.children.add(node);
  }

  /**
   * Moves node under newParent and relabels it.
   */
  public void reparent(int node, int newParent, String newLabel) {
    reparent(node, newParent);
    getNode(node).setLabel(newLabel);
  }

  /**
   * Removes node (and its subtree) from the tree.
   */
  public void detach(int node) {
    TreeNode n = getNode(node);
    if (n.isRoot())
      throw new StructuralInvariantException("can't detach the root: " + n);
    unlink(n);
  }

  /**
   * Swaps node with its head: node takes its head's position under the head's
   * parent (or becomes the root), then the old head becomes the last child of
   * node, relabeled as headLabel.
   */
  public void invert(int node, String headLabel) {
    TreeNode n = getNode(node);
    if (n.head < 0)
      throw new StructuralInvariantException("can't invert a node without a head: " + n);
    TreeNode h = nodes.get(n.head);
    unlink(n);
    if (h.isRoot()) {
      h.head = DETACHED;
      n.head = ROOT;
      root = node;
    } else {
      TreeNode g = parentOf(h);
      int i = g.children.indexOf(h.getId());
      g.children.set(i, node);
      n.head = g.getId();
      h.head = DETACHED;
    }
    reparent(h.getId(), node, headLabel);
  }

  /**
   * Pre-order, left to right search for the first node matching the given
   * filters (null means no filter). With a label filter, the filter must be a
   * substring of the node's label (so "subj" matches every subject label);
   * with a text filter, the node's text must be equal to it.
   *
   * @return the id of the first match or {@link #NOT_FOUND}
   */
  public int findFirst(int from, String labelFilter, String textFilter) {
    if (labelFilter == null && textFilter == null)
      throw new IllegalArgumentException("need at least one filter");
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(from);
    int steps = 0;
    while (!stack.isEmpty()) {
      int i = stack.pop();
      TreeNode n = getNode(i);
      if (matches(n, labelFilter, textFilter))
        return i;
      if (++steps > nodes.size())
        throw new StructuralInvariantException("cycle below node " + from);
      for (int j = n.children.size() - 1; j >= 0; j--)
        stack.push(n.children.get(j));
    }
    return NOT_FOUND;
  }

  private static boolean matches(TreeNode n, String labelFilter, String textFilter) {
    if (labelFilter != null && !n.getLabel().contains(labelFilter))
      return false;
    if (textFilter != null && !textFilter.equals(n.getText()))
      return false;
    return true;
  }

  /**
   * Creates a synthetic node and puts the given nodes under it, in order. The
   * new node's index is the (floored) mean of the members' indices, its
   * left/right counts are the sums of theirs, and its label is the first
   * member's label. The new node is not attached to anything.
   *
   * @return the id of the new parent
   */
  public int mergeNodes(List<Integer> members) {
    if (members.isEmpty())
      throw new IllegalArgumentException("nothing to merge");
    int idx = 0, nLefts = 0, nRights = 0;
    for (int m : members) {
      TreeNode n = getNode(m);
      idx += n.getIdx();
      nLefts += n.getNumLefts();
      nRights += n.getNumRights();
    }
    String label = getNode(members.get(0)).getLabel();
    int under = addNode(label, "", "", Math.floorDiv(idx, members.size()), nLefts, nRights);
    return mergeNodes(members, under);
  }

  /**
   * Appends the given nodes, in order, to the children of an existing node.
   * @return under
   */
  public int mergeNodes(List<Integer> members, int under) {
    if (members.isEmpty())
      throw new IllegalArgumentException("nothing to merge");
    for (int m : members)
      reparent(m, under);
    return under;
  }

  /**
   * Verifies that the nodes reachable from the root form a tree whose head
   * pointers agree with the children lists.
   * @throws StructuralInvariantException
   */
  public void checkInvariants() {
    if (root == ROOT)
      throw new StructuralInvariantException("tree has no root");
    if (nodes.get(root).head != ROOT)
      throw new StructuralInvariantException("root's head is not ROOT: " + nodes.get(root));
    BitSet seen = new BitSet(nodes.size());
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(root);
    seen.set(root);
    while (!stack.isEmpty()) {
      TreeNode p = nodes.get(stack.pop());
      for (int c : p.children) {
        TreeNode child = getNode(c);
        if (child.head != p.getId())
          throw new StructuralInvariantException(child + " is a child of " + p + " but has head " + child.head);
        if (seen.get(c))
          throw new StructuralInvariantException(child + " is reachable twice");
        seen.set(c);
        stack.push(c);
      }
    }
    for (TreeNode n : nodes) {
      if (!seen.get(n.getId()) && n.head >= 0 && seen.get(n.head))
        throw new StructuralInvariantException(n + " has head " + n.head + " but is not among its children");
    }
  }

  public DependencyTree copy() {
    DependencyTree t = new DependencyTree();
    for (TreeNode n : nodes)
      t.nodes.add(n.copy());
    t.root = root;
    return t;
  }

  /**
   * Bracketed label/text/pos rendering of the subtree rooted at id, e.g.
   * <pre>(ROOT/improves/VERB nsubj/method/NOUN (dobj/performance/NOUN det/the/DET))</pre>
   */
  public String toTreeString(int id) {
    StringBuilder sb = new StringBuilder();
    toTreeString(getNode(id), sb, 0);
    return sb.toString();
  }

  private void toTreeString(TreeNode n, StringBuilder sb, int depth) {
    if (depth > nodes.size())
      throw new StructuralInvariantException("cycle at " + n);
    if (n.children.isEmpty()) {
      sb.append(n.show());
      return;
    }
    sb.append('(').append(n.show());
    for (int c : n.children) {
      sb.append(' ');
      toTreeString(nodes.get(c), sb, depth + 1);
    }
    sb.append(')');
  }

  /**
   * Multi-line rendering, one node per line, indented by depth.
   */
  public String toIndentedString(int id) {
    StringBuilder sb = new StringBuilder();
    Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {id, 0});
    while (!stack.isEmpty()) {
      int[] e = stack.pop();
      TreeNode n = getNode(e[0]);
      if (e[1] > nodes.size())
        throw new StructuralInvariantException("cycle at " + n);
      sb.append(StringUtils.repeat("  ", e[1])).append(n.show()).append('\n');
      for (int j = n.children.size() - 1; j >= 0; j--)
        stack.push(new int[] {n.children.get(j), e[1] + 1});
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    if (root == ROOT)
      return "(DependencyTree empty)";
    return toTreeString(root);
  }

  private TreeNode parentOf(TreeNode n) {
    TreeNode p = getNode(n.head);
    if (!p.children.contains(n.getId())) {
      throw new StructuralInvariantException(
          n + " has head " + p + " but is not among its children " + p.children);
    }
    return p;
  }

  /** Removes n from its parent's children, leaving n detached */
  private void unlink(TreeNode n) {
    if (n.head >= 0) {
      TreeNode p = parentOf(n);
      p.children.remove(Integer.valueOf(n.getId()));
    } else if (n.head == ROOT) {
      throw new StructuralInvariantException("can't unlink the root: " + n);
    }
    n.head = DETACHED;
  }
}
