package edu.jhu.hlt.tetre.rules.growth;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.Test;

import edu.jhu.hlt.tetre.datatypes.ConllRows;
import edu.jhu.hlt.tetre.datatypes.DependencyTree;
import edu.jhu.hlt.tetre.rules.RuleSet;
import edu.jhu.hlt.tetre.rules.RuleState;
import edu.jhu.hlt.tetre.util.ExperimentProperties;

public class GrowthTest {
  public static final Logger LOG = Logger.getLogger(GrowthTest.class);

  /** Keeps the messages logged at WARN or above */
  static class Warnings extends AppenderSkeleton {
    final List<String> messages = new ArrayList<>();
    @Override
    protected void append(LoggingEvent event) {
      if (event.getLevel().isGreaterOrEqual(Level.WARN))
        messages.add(event.getRenderedMessage());
    }
    @Override
    public boolean requiresLayout() {
      return false;
    }
    @Override
    public void close() {}
  }

  private static RuleState run(ClauseSubjectPromotion r, DependencyTree t, int focus) {
    RuleState s = r.apply(RuleState.initial(t, focus));
    t.checkInvariants();
    return s;
  }

  /* relcl / ccomp ********************************************************/

  @Test
  public void relclHeadBecomesSubject() {
    // "... research area which continuously improves web search relevance"
    DependencyTree t = ConllRows.tree(
        "1 area NOUN 0 ROOT",
        "2 which DET 3 nsubj",
        "3 improves VERB 1 relcl",
        "4 relevance NOUN 3 dobj");
    RuleState s = run(new ClauseSubjectPromotion(), t, 2);
    assertTrue(s.isApplied());
    assertEquals(2, t.getRoot());
    assertEquals("nsubj", t.getNode(0).getLabel());
    assertEquals(2, t.getNode(0).getHead());
    assertTrue(t.getNode(1).isDetached());
    assertEquals(Arrays.asList(3, 0), t.getNode(2).getChildren());
    assertEquals(Arrays.asList("nsubj", "dobj", "nsubj"), s.getLabels().asList());
  }

  @Test
  public void properNounSubjectIsKept() {
    // "... exhibits two shortcomings that GeckoFTL improves upon"
    DependencyTree t = ConllRows.tree(
        "1 shortcomings NOUN 0 ROOT",
        "2 GeckoFTL PROPN 3 nsubj",
        "3 improves VERB 1 relcl",
        "4 upon ADP 3 prep");
    RuleState s = run(new ClauseSubjectPromotion(), t, 2);
    assertFalse(s.isApplied());
    assertEquals(0, t.getRoot());
    assertEquals(0, t.getNode(2).getHead());
    assertEquals(Arrays.asList(1, 3), t.getNode(2).getChildren());
  }

  @Test
  public void ccompWithoutSubjectBelowRoot() {
    DependencyTree t = ConllRows.tree(
        "1 He PRON 2 nsubj",
        "2 said VERB 0 ROOT",
        "3 result NOUN 2 dobj",
        "4 improves VERB 3 ccomp",
        "5 speed NOUN 4 dobj");
    RuleState s = run(new ClauseSubjectPromotion(), t, 3);
    assertTrue(s.isApplied());
    assertEquals(1, t.getNode(3).getHead());
    assertEquals(Arrays.asList(4, 2), t.getNode(3).getChildren());
    assertEquals("nsubj", t.getNode(2).getLabel());
    assertEquals(Arrays.asList("dobj", "nsubj"), s.getLabels().asList());
  }

  @Test
  public void notAClause() {
    DependencyTree t = ConllRows.tree(
        "1 area NOUN 0 ROOT",
        "2 improves VERB 1 acl");
    RuleState s = run(new ClauseSubjectPromotion(), t, 1);
    assertFalse(s.isApplied());
    assertEquals(0, t.getRoot());
  }

  /* conj *****************************************************************/

  private static RuleState conj(DependencyTree t, int focus) {
    RuleState s = new CoordinatedClauseRecursion(64).apply(RuleState.initial(t, focus));
    t.checkInvariants();
    return s;
  }

  @Test
  public void conjTakesSubject() {
    // "Using many ASR hypotheses helps recover the ASR errors ... and improves NER accuracy"
    DependencyTree t = ConllRows.tree(
        "1 Using VERB 2 csubj",
        "2 helps VERB 0 ROOT",
        "3 recover VERB 2 xcomp",
        "4 and CCONJ 2 cc",
        "5 improves VERB 2 conj",
        "6 accuracy NOUN 5 dobj");
    RuleState s = conj(t, 4);
    assertTrue(s.isApplied());
    assertEquals(Arrays.asList(5, 0), t.getNode(4).getChildren());
    assertEquals("csubj", t.getNode(0).getLabel());
    assertEquals(Arrays.asList(2, 3, 4), t.getNode(1).getChildren());
    assertEquals(Arrays.asList("dobj", "csubj"), s.getLabels().asList());
  }

  @Test
  public void conjTakesObjectAsSubject() {
    // "[16] studies the usage of grammars ... and improves complexity bounds"
    DependencyTree t = ConllRows.tree(
        "1 studies VERB 0 ROOT",
        "2 usage NOUN 1 dobj",
        "3 and CCONJ 1 cc",
        "4 improves VERB 1 conj",
        "5 bounds NOUN 4 dobj");
    RuleState s = conj(t, 3);
    assertTrue(s.isApplied());
    assertEquals("nsubj", t.getNode(1).getLabel());
    assertEquals(3, t.getNode(1).getHead());
    assertEquals(Arrays.asList("dobj", "nsubj"), s.getLabels().asList());
  }

  @Test
  public void butTakesOtherConjunct() {
    // "Both identify product features from reviews, but OPINE significantly improves on both"
    DependencyTree t = ConllRows.tree(
        "1 Both DET 2 nsubj",
        "2 identify VERB 0 ROOT",
        "3 features NOUN 2 dobj",
        "4 but CCONJ 2 cc",
        "5 OPINE PROPN 2 conj",
        "6 improves VERB 2 conj");
    RuleState s = conj(t, 5);
    assertTrue(s.isApplied());
    assertEquals(5, t.getNode(4).getHead());
    assertEquals("nsubj", t.getNode(4).getLabel());
    // the head's own subject stays
    assertEquals(1, t.getNode(0).getHead());
    assertEquals(Arrays.asList("nsubj"), s.getLabels().asList());
  }

  @Test
  public void butWithoutOtherConjunctTakesSubject() {
    // "SFS [6] is based on the same rationale as BNL, but improves performance ..."
    DependencyTree t = ConllRows.tree(
        "1 SFS PROPN 3 nsubjpass",
        "2 is AUX 3 auxpass",
        "3 based VERB 0 ROOT",
        "4 but CCONJ 3 cc",
        "5 improves VERB 3 conj",
        "6 performance NOUN 5 dobj");
    RuleState s = conj(t, 4);
    assertTrue(s.isApplied());
    assertEquals(4, t.getNode(0).getHead());
    assertEquals("nsubjpass", t.getNode(0).getLabel());
    assertEquals(Arrays.asList("dobj", "nsubjpass"), s.getLabels().asList());
  }

  @Test
  public void walksUpConjChain() {
    DependencyTree t = ConllRows.tree(
        "1 we PRON 2 nsubj",
        "2 read VERB 0 ROOT",
        "3 wrote VERB 2 conj",
        "4 and CCONJ 3 cc",
        "5 improves VERB 3 conj");
    RuleState s = conj(t, 4);
    assertTrue(s.isApplied());
    assertEquals(4, t.getNode(0).getHead());
    assertEquals(Arrays.asList(0), t.getNode(4).getChildren());
  }

  @Test
  public void iterationCap() {
    DependencyTree t = ConllRows.tree(
        "1 we PRON 2 nsubj",
        "2 read VERB 0 ROOT",
        "3 wrote VERB 2 conj",
        "4 and CCONJ 3 cc",
        "5 improves VERB 3 conj");
    // one step up finds nothing, the second step is not allowed
    RuleState s = new CoordinatedClauseRecursion(1).apply(RuleState.initial(t, 4));
    assertFalse(s.isApplied());
    assertEquals(1, t.getNode(0).getHead());
  }

  @Test
  public void butDoesNotPullAncestorConjunct() {
    // the only other conj under "read" is "wrote", which sits above the focus
    DependencyTree t = ConllRows.tree(
        "1 we PRON 2 nsubj",
        "2 read VERB 0 ROOT",
        "3 but CCONJ 2 cc",
        "4 wrote VERB 2 conj",
        "5 improves VERB 4 conj");
    String before = t.toTreeString(t.getRoot());
    RuleState s = conj(t, 4);
    assertFalse(s.isApplied());
    assertEquals(before, t.toTreeString(t.getRoot()));
    assertEquals(1, t.getNode(3).getHead());
    assertEquals(3, t.getNode(4).getHead());
    assertTrue(t.getNode(4).getChildren().isEmpty());
    assertTrue(s.getLabels().asList().isEmpty());
  }

  @Test
  public void conjWithSubjectIsLeftAlone() {
    DependencyTree t = ConllRows.tree(
        "1 we PRON 2 nsubj",
        "2 read VERB 0 ROOT",
        "3 they PRON 4 nsubj",
        "4 write VERB 2 conj");
    RuleState s = conj(t, 3);
    assertFalse(s.isApplied());
    assertEquals(1, t.getNode(0).getHead());
  }

  /* xcomp / ccomp ********************************************************/

  @Test
  public void xcompBecomesObject() {
    // "... structured retrieval improves answer ranking for factoid questions"
    DependencyTree t = ConllRows.tree(
        "1 retrieval NOUN 2 nsubj",
        "2 improves VERB 0 ROOT",
        "3 ranking NOUN 2 xcomp");
    RuleState s = new ComplementSubstitution().apply(RuleState.initial(t, 1));
    assertTrue(s.isApplied());
    assertEquals("obj", t.getNode(2).getLabel());
    assertEquals(Arrays.asList("subj", "obj"), s.getLabels().asList());
  }

  @Test
  public void ccompBecomesSubjectWhenObjectExists() {
    // "Caching frequently accessed data ... not only improves the user's experience ..."
    DependencyTree t = ConllRows.tree(
        "1 Caching NOUN 2 ccomp",
        "2 improves VERB 0 ROOT",
        "3 experience NOUN 2 dobj");
    RuleState s = new ComplementSubstitution().apply(RuleState.initial(t, 1));
    assertTrue(s.isApplied());
    assertEquals("subj", t.getNode(0).getLabel());
    assertEquals("dobj", t.getNode(2).getLabel());
    assertEquals(Arrays.asList("subj", "obj"), s.getLabels().asList());
  }

  @Test
  public void onlyFirstComplementIsRelabeled() {
    DependencyTree t = ConllRows.tree(
        "1 it PRON 2 nsubj",
        "2 helps VERB 0 ROOT",
        "3 handle VERB 2 xcomp",
        "4 improve VERB 2 xcomp");
    RuleState s = new ComplementSubstitution().apply(RuleState.initial(t, 1));
    assertTrue(s.isApplied());
    assertEquals("obj", t.getNode(2).getLabel());
    assertEquals("xcomp", t.getNode(3).getLabel());
    assertEquals(Arrays.asList("subj", "obj", "xcomp"), s.getLabels().asList());
  }

  @Test
  public void complementsLeftAloneWhenBothExist() {
    DependencyTree t = ConllRows.tree(
        "1 it PRON 2 nsubj",
        "2 helps VERB 0 ROOT",
        "3 us PRON 2 dobj",
        "4 handle VERB 2 xcomp");
    RuleState s = new ComplementSubstitution().apply(RuleState.initial(t, 1));
    assertFalse(s.isApplied());
    assertEquals("xcomp", t.getNode(3).getLabel());
    // canonicalized all the same
    assertEquals(Arrays.asList("subj", "obj", "xcomp"), s.getLabels().asList());
  }

  /* prep in **************************************************************/

  @Test
  public void prepInBecomesObject() {
    // "... matrix co-factorization ... improves in predicting individual decisions"
    DependencyTree t = ConllRows.tree(
        "1 co-factorization NOUN 2 nsubj",
        "2 improves VERB 0 ROOT",
        "3 in ADP 2 prep",
        "4 predicting VERB 3 pcomp");
    RuleState s = new PrepInPromotion().apply(RuleState.initial(t, 1));
    assertTrue(s.isApplied());
    assertEquals("obj", t.getNode(2).getLabel());
    assertEquals(Arrays.asList("subj", "obj"), s.getLabels().asList());
  }

  @Test
  public void prepInNotNeededWithObject() {
    DependencyTree t = ConllRows.tree(
        "1 it NOUN 2 nsubj",
        "2 improves VERB 0 ROOT",
        "3 accuracy NOUN 2 dobj",
        "4 in ADP 2 prep",
        "5 on ADP 2 prep");
    RuleState s = new PrepInPromotion().apply(RuleState.initial(t, 1));
    assertFalse(s.isApplied());
    assertEquals("prep", t.getNode(3).getLabel());
    assertEquals("prep", t.getNode(4).getLabel());
  }

  @Test
  public void otherPrepositionsStay() {
    DependencyTree t = ConllRows.tree(
        "1 it NOUN 2 nsubj",
        "2 improves VERB 0 ROOT",
        "3 on ADP 2 prep");
    RuleState s = new PrepInPromotion().apply(RuleState.initial(t, 1));
    assertFalse(s.isApplied());
    assertEquals("prep", t.getNode(2).getLabel());
  }

  /* grandchildren ********************************************************/

  private static RuleState hoist(DependencyTree t, int focus) {
    RuleState s = new GrandchildHoist(256).apply(RuleState.initial(t, focus));
    t.checkInvariants();
    return s;
  }

  @Test
  public void prepositionsComeUp() {
    // "... the proposed method improves the performance by 2.9 and 1.6 to 67.3 ..."
    DependencyTree t = ConllRows.tree(
        "1 method NOUN 2 nsubj",
        "2 improves VERB 0 ROOT",
        "3 the DET 4 det",
        "4 performance NOUN 2 dobj",
        "5 by ADP 4 prep",
        "6 2.9 NUM 5 pobj",
        "7 to ADP 4 prep",
        "8 67.3 NUM 7 pobj",
        "9 in ADP 4 prep");
    RuleState s = hoist(t, 1);
    assertTrue(s.isApplied());
    assertEquals(Arrays.asList(0, 3, 4, 6), t.getNode(1).getChildren());
    assertEquals(Arrays.asList(2, 8), t.getNode(3).getChildren());
    assertEquals("prep", t.getNode(4).getLabel());
    // subtrees come along
    assertEquals(Arrays.asList(5), t.getNode(4).getChildren());
    assertEquals(Arrays.asList("nsubj", "dobj", "prep", "prep"), s.getLabels().asList());
  }

  @Test
  public void deepClausesComeUp() {
    // "(Kobayashi et al., 2004) employs an iterative semi-automatic approach which requires human input ..."
    DependencyTree t = ConllRows.tree(
        "1 Kobayashi PROPN 2 nsubj",
        "2 employs VERB 0 ROOT",
        "3 an DET 4 det",
        "4 approach NOUN 2 dobj",
        "5 of ADP 4 prep",
        "6 kind NOUN 5 pobj",
        "7 which DET 8 nsubj",
        "8 requires VERB 6 relcl",
        "9 input NOUN 8 dobj");
    RuleState s = hoist(t, 1);
    assertTrue(s.isApplied());
    assertEquals("mod", t.getNode(7).getLabel());
    assertEquals(1, t.getNode(7).getHead());
    assertEquals(Arrays.asList(6, 8), t.getNode(7).getChildren());
    assertTrue(t.getNode(5).getChildren().isEmpty());
    assertEquals(Arrays.asList("nsubj", "dobj", "mod"), s.getLabels().asList());
  }

  @Test
  public void everyMatchUnderTheSameChild() {
    DependencyTree t = ConllRows.tree(
        "1 it PRON 2 nsubj",
        "2 employs VERB 0 ROOT",
        "3 model NOUN 2 dobj",
        "4 with ADP 3 prep",
        "5 weights NOUN 4 pobj",
        "6 with ADP 5 prep",
        "7 bias NOUN 6 pobj",
        "8 with ADP 3 prep",
        "9 priors NOUN 8 pobj");
    RuleState s = hoist(t, 1);
    assertTrue(s.isApplied());
    // both "with"s under the object come up, the nested one goes along with its ancestor
    assertEquals(Arrays.asList(0, 2, 3, 7), t.getNode(1).getChildren());
    assertTrue(t.getNode(2).getChildren().isEmpty());
    assertEquals(Arrays.asList(5), t.getNode(4).getChildren());
    assertEquals("prep", t.getNode(5).getLabel());
    assertEquals(Arrays.asList("nsubj", "dobj", "prep", "prep"), s.getLabels().asList());
  }

  @Test
  public void onlyBelowSubjectsAndObjects() {
    DependencyTree t = ConllRows.tree(
        "1 it PRON 2 nsubj",
        "2 works VERB 0 ROOT",
        "3 well ADV 2 advmod",
        "4 with ADP 3 prep");
    RuleState s = hoist(t, 1);
    assertFalse(s.isApplied());
    assertEquals(2, t.getNode(3).getHead());
  }

  private static final String[] TWO_WITHS = {
      "1 it PRON 2 nsubj",
      "2 employs VERB 0 ROOT",
      "3 model NOUN 2 dobj",
      "4 with ADP 3 prep",
      "5 weights NOUN 4 pobj",
      "6 with ADP 3 prep",
      "7 priors NOUN 6 pobj"};

  @Test
  public void hoistCap() {
    DependencyTree t = ConllRows.tree(TWO_WITHS);
    Warnings w = new Warnings();
    GrandchildHoist.LOG.addAppender(w);
    try {
      RuleState s = new GrandchildHoist(1).apply(RuleState.initial(t, 1));
      t.checkInvariants();
      assertTrue(s.isApplied());
      assertEquals(Arrays.asList(0, 2, 3), t.getNode(1).getChildren());
      assertEquals(Arrays.asList(5), t.getNode(2).getChildren());
      assertEquals(Arrays.asList("nsubj", "dobj", "prep"), s.getLabels().asList());
      assertEquals(1, w.messages.size());
    } finally {
      GrandchildHoist.LOG.removeAppender(w);
    }
  }

  @Test
  public void hoistCapReachedExactly() {
    DependencyTree t = ConllRows.tree(TWO_WITHS);
    Warnings w = new Warnings();
    GrandchildHoist.LOG.addAppender(w);
    try {
      RuleState s = new GrandchildHoist(2).apply(RuleState.initial(t, 1));
      assertTrue(s.isApplied());
      assertEquals(Arrays.asList(0, 2, 3, 5), t.getNode(1).getChildren());
      assertTrue(t.getNode(2).getChildren().isEmpty());
      // nothing was left behind, so nothing to warn about
      assertTrue(w.messages.isEmpty());
    } finally {
      GrandchildHoist.LOG.removeAppender(w);
    }
  }

  /* the whole set ********************************************************/

  @Test
  public void growthOrderAndFirings() {
    DependencyTree t = ConllRows.tree(
        "1 area NOUN 0 ROOT",
        "2 which DET 3 nsubj",
        "3 improves VERB 1 relcl",
        "4 ranking NOUN 3 xcomp",
        "5 for ADP 4 prep",
        "6 questions NOUN 5 pobj");
    RuleSet g = new Growth();
    RuleSet.Applied a = g.apply(RuleState.initial(t, 2));
    LOG.info("[growthOrderAndFirings] " + a);
    assertEquals(Arrays.asList(
        ClauseSubjectPromotion.NAME,
        ComplementSubstitution.NAME,
        GrandchildHoist.NAME), a.getFired());
    assertEquals(Arrays.asList(3, 0, 4), t.getNode(2).getChildren());
    assertEquals("obj", t.getNode(3).getLabel());
    assertEquals("prep", t.getNode(4).getLabel());
    assertEquals(Arrays.asList("subj", "obj", "prep"), a.getState().getLabels().asList());
  }

  @Test
  public void growthRulesInOrder() {
    Growth g = new Growth(new ExperimentProperties(Growth.CONJ_MAX_ITERATIONS, "3"));
    assertEquals(5, g.getRules().size());
    assertTrue(g.getRules().get(0) instanceof ClauseSubjectPromotion);
    assertTrue(g.getRules().get(1) instanceof CoordinatedClauseRecursion);
    assertTrue(g.getRules().get(2) instanceof ComplementSubstitution);
    assertTrue(g.getRules().get(3) instanceof PrepInPromotion);
    assertTrue(g.getRules().get(4) instanceof GrandchildHoist);
  }
}
