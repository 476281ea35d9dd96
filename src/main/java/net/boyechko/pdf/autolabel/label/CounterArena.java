/*
 * PDF-Auto-Label - Automated label numbering for tagged documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autolabel.label;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;

/**
 * All counters of one labelling pass. A counter is addressed by kind, level (heading level or
 * nesting depth) and scope node, and remembers the binding it was last advanced under. Advancing
 * under a different binding restarts the count.
 */
final class CounterArena {

    /**
     * @param scope the container the sequence belongs to (a list, an enclosing figure), or null
     *     for document-wide sequences
     */
    record CounterKey(ElementKind kind, int level, DocNode scope) {}

    private static final class Counter {
        private Object binding;
        private int value;
    }

    private final Map<CounterKey, Counter> counters = new HashMap<>();

    /** Advances the counter and returns its new value, restarting at 1 if the binding changed. */
    int next(CounterKey key, Object binding) {
        Counter counter = counters.computeIfAbsent(key, k -> new Counter());
        if (!Objects.equals(counter.binding, binding)) {
            counter.binding = binding;
            counter.value = 0;
        }
        return ++counter.value;
    }

    /** The last value handed out, or 0. */
    int current(CounterKey key) {
        Counter counter = counters.get(key);
        return counter != null ? counter.value : 0;
    }

    /** Drops every counter of the kind whose level is greater than the given one. */
    void discardDeeper(ElementKind kind, int level) {
        counters.keySet().removeIf(key -> key.kind() == kind && key.level() > level);
    }

    int size() {
        return counters.size();
    }
}
