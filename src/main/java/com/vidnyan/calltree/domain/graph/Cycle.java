package com.vidnyan.calltree.domain.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * A closed call path, canonicalized so that the same cycle found from different
 * starting points compares equal: rotated to start at its lexicographically
 * smallest member. A self-call is a single-member cycle.
 */
public record Cycle(List<String> members) {

    public Cycle {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one member");
        }
        members = List.copyOf(members);
    }

    /**
     * Canonical cycle for the given path (without the closing repeat).
     */
    public static Cycle of(List<String> path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one member");
        }
        int start = 0;
        for (int i = 1; i < path.size(); i++) {
            if (path.get(i).compareTo(path.get(start)) < 0) {
                start = i;
            }
        }
        List<String> rotated = new ArrayList<>(path.size());
        rotated.addAll(path.subList(start, path.size()));
        rotated.addAll(path.subList(0, start));
        return new Cycle(rotated);
    }

    public int length() {
        return members.size();
    }

    public boolean isSelfCall() {
        return members.size() == 1;
    }

    /**
     * Members with the first repeated at the end.
     */
    public List<String> path() {
        List<String> path = new ArrayList<>(members);
        path.add(members.get(0));
        return path;
    }

    public String format() {
        return String.join(" -> ", path());
    }
}
