package edu.jhu.hlt.tetre.datatypes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The relation labels seen directly under the focus node. Starts out as a
 * list (with repeats) and is deduplicated and canonicalized by the rules;
 * insertion order is kept throughout so results are deterministic.
 */
public class RelationLabels implements Iterable<String> {

  private List<String> labels;

  public RelationLabels() {
    this.labels = new ArrayList<>();
  }

  public RelationLabels(Collection<String> labels) {
    this.labels = new ArrayList<>(labels);
  }

  /** Labels of focus's children, in child order */
  public static RelationLabels ofChildren(DependencyTree tree, int focus) {
    RelationLabels r = new RelationLabels();
    for (TreeNode c : tree.getChildren(focus))
      r.add(c.getLabel());
    return r;
  }

  public void add(String label) {
    labels.add(label);
  }

  public int size() {
    return labels.size();
  }

  /** Replaces every occurrence of from with to */
  public void replaceAll(String from, String to) {
    for (int i = 0; i < labels.size(); i++)
      if (labels.get(i).equals(from))
        labels.set(i, to);
  }

  /** Replaces the first occurrence of from with to, if there is one */
  public boolean replaceFirst(String from, String to) {
    int i = labels.indexOf(from);
    if (i < 0)
      return false;
    labels.set(i, to);
    return true;
  }

  /** @return true if anything was removed */
  public boolean removeAll(Collection<String> remove) {
    return labels.removeAll(remove);
  }

  /** Drops repeats, keeping the first occurrence */
  public void dedup() {
    labels = new ArrayList<>(new LinkedHashSet<>(labels));
  }

  /**
   * Maps every label through {@link DependencyTags#rewrite(String)} and drops
   * the repeats this creates.
   */
  public void canonicalize() {
    LinkedHashSet<String> s = new LinkedHashSet<>();
    for (String l : labels)
      s.add(DependencyTags.rewrite(l));
    labels = new ArrayList<>(s);
  }

  public List<String> asList() {
    return Collections.unmodifiableList(labels);
  }

  public RelationLabels copy() {
    return new RelationLabels(labels);
  }

  @Override
  public Iterator<String> iterator() {
    return asList().iterator();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof RelationLabels)
      return labels.equals(((RelationLabels) other).labels);
    return false;
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return labels.toString();
  }
}
