package edu.jhu.hlt.tetre.datatypes;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Static tables over dependency relation labels and part of speech tags
 * (spaCy/ClearNLP style labels, universal POS tags).
 */
public class DependencyTags {

  public static final String SUBJ = "subj";
  public static final String OBJ = "obj";
  public static final String MOD = "mod";
  public static final String PREP = "prep";

  /** Label given to a node which is pulled down to become the focus's subject */
  public static final String DOWNWARDS_SUBJ = "nsubj";

  public static final Set<String> SUBJECTS =
      ImmutableSet.of("nsubj", "csubj", "nsubjpass", "csubjpass");
  public static final Set<String> OBJECTS =
      ImmutableSet.of("dobj", "iobj", "pobj");

  /** Open class parts of speech which may act as a subject */
  public static final Set<String> OPEN_CLASS_POS =
      ImmutableSet.of("NOUN", "PROPN", "VERB", "NUM", "PRON", "X");

  private static final Map<String, String> translationRules;
  static {
    ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
    for (String s : SUBJECTS)
      b.put(s, SUBJ);
    for (String o : OBJECTS)
      b.put(o, OBJ);
    translationRules = b.build();
  }

  /**
   * Collapses label variants into their bucket, e.g. nsubjpass -> subj.
   * Labels without a mapping are returned as is.
   */
  public static String rewrite(String label) {
    String r = translationRules.get(label);
    return r == null ? label : r;
  }

  /** Substring test, matches every subject label and the "subj" bucket */
  public static boolean isSubjectFamily(String label) {
    return label.contains(SUBJ);
  }

  /** Substring test, matches every object label and the "obj" bucket */
  public static boolean isObjectFamily(String label) {
    return label.contains(OBJ);
  }

  public static boolean isOpenClass(String pos) {
    return OPEN_CLASS_POS.contains(pos);
  }
}
