package edu.uw.easyqg.annotation;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import java.util.EnumSet;
import java.util.Set;

/**
 * Dependency roles the question generator cares about. Labels are resolved once, when the token stream is built;
 * everything not listed collapses into OTHER.
 */
public enum DependencyRole {
    NSUBJ, NSUBJPASS, CSUBJ, CSUBJPASS,
    DOBJ, POBJ, DATIVE, ATTR, ACOMP, APPOS, PCOMP,
    AUX, AUXPASS, COP,
    CC, CONJ, PREP, CASE, MARK,
    PUNCT, ROOT, OTHER;

    public static final Set<DependencyRole> subjectRoles = Sets.immutableEnumSet(
            EnumSet.of(NSUBJ, NSUBJPASS, CSUBJ, CSUBJPASS));

    public static final Set<DependencyRole> objectRoles = Sets.immutableEnumSet(EnumSet.of(DOBJ, POBJ));

    private static final ImmutableMap<String, DependencyRole> rolesByLabel = ImmutableMap.<String, DependencyRole>builder()
            .put("nsubj", NSUBJ)
            .put("nsubjpass", NSUBJPASS)
            .put("nsubj:pass", NSUBJPASS)
            .put("csubj", CSUBJ)
            .put("csubjpass", CSUBJPASS)
            .put("csubj:pass", CSUBJPASS)
            .put("dobj", DOBJ)
            .put("obj", DOBJ)
            .put("pobj", POBJ)
            .put("dative", DATIVE)
            .put("iobj", DATIVE)
            .put("attr", ATTR)
            .put("acomp", ACOMP)
            .put("appos", APPOS)
            .put("pcomp", PCOMP)
            .put("aux", AUX)
            .put("auxpass", AUXPASS)
            .put("aux:pass", AUXPASS)
            .put("cop", COP)
            .put("cc", CC)
            .put("conj", CONJ)
            .put("prep", PREP)
            .put("case", CASE)
            .put("mark", MARK)
            .put("punct", PUNCT)
            .put("root", ROOT)
            .build();

    public static DependencyRole fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        return rolesByLabel.getOrDefault(label.toLowerCase(), OTHER);
    }

    public boolean isSubject() {
        return subjectRoles.contains(this);
    }

    public boolean isObject() {
        return objectRoles.contains(this);
    }
}
