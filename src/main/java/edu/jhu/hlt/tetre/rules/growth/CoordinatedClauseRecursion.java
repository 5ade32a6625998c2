package edu.jhu.hlt.tetre.rules.growth;

import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.tetre.datatypes.DependencyTags;
import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.datatypes.TreeNode;
import edu.jhu.hlt.tetre.rules.Rule;
import edu.jhu.hlt.tetre.rules.RuleState;

/**
 * A subject-less focus which is a conjunct shares its subject with the
 * clause it is coordinated with, so walk up the conj chain and pull the
 * subject down. Per child of the head, the first applicable case wins:
 * <ol>
 * <li>"Using many ASR hypotheses helps recover ... and improves NER accuracy":
 *     no "but", take the subject as is.
 * <li>"[16] studies the usage of grammars ... and improves complexity bounds":
 *     no "but" and the head has no subject, its object becomes our nsubj.
 * <li>"Both identify product features from reviews, but OPINE significantly
 *     improves on both": with a "but", the other conjunct (which is not above
 *     the focus) becomes our nsubj.
 * <li>"SFS [6] is based on the same rationale as BNL, but improves performance":
 *     a "but" with no other conjunct, take the subject as is.
 * </ol>
 */
public class CoordinatedClauseRecursion implements Rule {
  public static final Logger LOG = Logger.getLogger(CoordinatedClauseRecursion.class);

  public static final String NAME = "recurseOnDepConjIfNoSubj";

  public static final String CONJ = "conj";
  public static final String CC = "cc";
  public static final String BUT = "but";

  private final int maxIterations;

  public CoordinatedClauseRecursion(int maxIterations) {
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
    int tokenHead = focus;
    boolean applied = false;
    int iter = 0;
    while (CONJ.equals(t.getNode(tokenHead).getLabel())
        && t.getNode(tokenHead).getHead() >= 0
        && !hasSubject(t, focus)) {
      if (++iter > maxIterations) {
        LOG.warn("[apply] giving up after " + maxIterations + " steps up from "
            + t.getNode(focus) + ", ancestor chain may be corrupt");
        break;
      }
      tokenHead = t.getNode(tokenHead).getHead();
      List<TreeNode> children = t.getChildren(tokenHead);

      boolean isBut = false;
      boolean otherConjExists = false;
      boolean hasSubj = false;
      for (TreeNode c : children) {
        if (CC.equals(c.getLabel()) && BUT.equals(c.getText()))
          isBut = true;
        if (CONJ.equals(c.getLabel()) && c.getId() != focus)
          otherConjExists = true;
        if (DependencyTags.isSubjectFamily(c.getLabel()))
          hasSubj = true;
      }

      for (TreeNode c : children) {
        boolean isOtherConj = CONJ.equals(c.getLabel()) && c.getId() != focus;
        boolean isSubj = DependencyTags.SUBJECTS.contains(c.getLabel());
        boolean isObj = DependencyTags.OBJECTS.contains(c.getLabel());
        boolean aboveFocus = c.getId() == focus || t.isAncestor(c.getId(), focus);

        boolean condSubj = !isBut && isSubj;
        boolean condObj = !isBut && !hasSubj && isObj;
        boolean condConjOther = isBut && isOtherConj && !aboveFocus && !isSubj;
        boolean condConjSame = isBut && !otherConjExists && isSubj;

        if (condSubj || condObj || condConjOther || condConjSame) {
          if (condObj || condConjOther)
            c.setLabel(DependencyTags.DOWNWARDS_SUBJ);
          t.reparent(c.getId(), focus);
          state.getLabels().add(c.getLabel());
          applied = true;
          break;
        }
      }
    }
    return state.withApplied(applied);
  }

  private static boolean hasSubject(DependencyTree t, int focus) {
    for (TreeNode c : t.getChildren(focus))
      if (DependencyTags.SUBJECTS.contains(c.getLabel()))
        return true;
    return false;
  }
}
