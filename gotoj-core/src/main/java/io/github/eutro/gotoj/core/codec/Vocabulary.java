package io.github.eutro.gotoj.core.codec;

import io.github.eutro.gotoj.core.error.UnknownTagException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;

import java.util.Map;

/**
 * Checks ireps against the {@link IrepId#vocabulary() vocabulary} of the format version.
 * <p>
 * The ids of nodes with children and the keys of named children are structural, and must
 * be known. Leaves are payload, such as names and numbers, and may be anything.
 */
final class Vocabulary {
    private Vocabulary() {
    }

    static void checkNode(Irep irep) {
        if (!irep.isLeaf()) checkTag(irep.id(), "node");
        checkKeys(irep.namedSub());
        checkKeys(irep.comments());
    }

    private static void checkKeys(Map<IrepId, Irep> map) {
        for (IrepId key : map.keySet()) checkTag(key, "key");
    }

    static void checkTag(IrepId id, String what) {
        if (!id.isVocabulary()) {
            throw new UnknownTagException(what + " '" + id + "' is not in the version "
                    + IrepId.VOCABULARY_VERSION + " vocabulary");
        }
    }
}
