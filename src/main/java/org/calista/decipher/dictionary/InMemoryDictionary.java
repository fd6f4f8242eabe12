package org.calista.decipher.dictionary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * InMemoryDictionary — immutable hash set of uppercase words.
 *
 * <p>Single-letter entries other than "A" and "I" are dropped at build time.</p>
 */
public final class InMemoryDictionary implements Dictionary {

    private final Set<String> words;

    private InMemoryDictionary(Set<String> words) {
        this.words = Collections.unmodifiableSet(words);
    }

    public static InMemoryDictionary of(Collection<String> words) {
        return builder().addAll(words).build();
    }

    public static InMemoryDictionary of(String... words) {
        Builder b = builder();
        for (String w : words) b.add(w);
        return b.build();
    }

    public static InMemoryDictionary empty() {
        return new InMemoryDictionary(new HashSet<>());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean contains(String word) {
        if (word == null || word.isEmpty()) return false;
        return words.contains(word.toUpperCase(Locale.ROOT));
    }

    @Override
    public int size() {
        return words.size();
    }

    @Override
    public List<String> snapshotSorted() {
        ArrayList<String> out = new ArrayList<>(words);
        Collections.sort(out);
        return out;
    }

    @Override
    public String toString() {
        return "InMemoryDictionary{size=" + words.size() + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final HashSet<String> words = new HashSet<>(1024);
        private int dropped;

        /**
         * Adds one entry (trimmed, uppercased).
         *
         * @return true if the word was accepted and new
         */
        public boolean add(String word) {
            if (word == null) return false;
            String w = word.trim().toUpperCase(Locale.ROOT);
            if (w.isEmpty()) return false;
            if (w.length() == 1 && !"A".equals(w) && !"I".equals(w)) {
                dropped++;
                return false;
            }
            return words.add(w);
        }

        public Builder addAll(Collection<String> ws) {
            if (ws == null) return this;
            for (String w : ws) add(w);
            return this;
        }

        public int size() {
            return words.size();
        }

        /** Single-letter entries rejected so far. */
        public int dropped() {
            return dropped;
        }

        public InMemoryDictionary build() {
            return new InMemoryDictionary(new HashSet<>(words));
        }
    }
}
