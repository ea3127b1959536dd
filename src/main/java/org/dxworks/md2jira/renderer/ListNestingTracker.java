package org.dxworks.md2jira.renderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of the lists currently being traversed, outermost first.
 *
 * - Depth always equals the number of list ancestors of the node being rendered.
 * - Item prefixes carry one marker per level: {@code #} for ordered, {@code *} for bullet.
 * - Tightness belongs to each level, so leaving a nested list restores the enclosing one's.
 */
final class ListNestingTracker {

    private final List<Level> levels = new ArrayList<>();

    /**
     * Pushes a list.
     * @return true if the list is nested inside another one
     */
    boolean enter(boolean ordered, boolean tightList) {
        boolean nested = !levels.isEmpty();
        levels.add(new Level(ordered, tightList));
        return nested;
    }

    /**
     * Pops the innermost list.
     * @return true if no list remains open
     */
    boolean exit() {
        if (!levels.isEmpty()) {
            levels.remove(levels.size() - 1);
        }
        return levels.isEmpty();
    }

    String itemPrefix() {
        StringBuilder prefix = new StringBuilder(levels.size());
        for (Level level : levels) {
            prefix.append(level.ordered ? '#' : '*');
        }
        return prefix.toString();
    }

    boolean isInTightList() {
        return !levels.isEmpty() && levels.get(levels.size() - 1).tight;
    }

    int depth() {
        return levels.size();
    }

    private static final class Level {
        private final boolean ordered;
        private final boolean tight;

        private Level(boolean ordered, boolean tight) {
            this.ordered = ordered;
            this.tight = tight;
        }
    }
}
