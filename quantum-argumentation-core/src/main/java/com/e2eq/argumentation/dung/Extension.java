package com.e2eq.argumentation.dung;

import java.util.*;

/**
 * A set of arguments asserted as jointly accepted. Members iterate in natural string order.
 * <p>
 * Extensions compare by size first and then element-wise by their sorted members, which is
 * the order every list of extensions is returned in.
 */
public record Extension(SortedSet<String> members) implements Comparable<Extension> {

    public static final Extension EMPTY = new Extension(new TreeSet<>());

    public Extension {
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    }

    public static Extension of(String... ids) {
        return new Extension(new TreeSet<>(Arrays.asList(ids)));
    }

    public static Extension of(Collection<String> ids) {
        return new Extension(new TreeSet<>(ids));
    }

    public boolean contains(String argument) {
        return members.contains(argument);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public int compareTo(Extension other) {
        int c = Integer.compare(size(), other.size());
        if (c != 0) return c;
        Iterator<String> a = members.iterator();
        Iterator<String> b = other.members.iterator();
        while (a.hasNext()) {
            c = a.next().compareTo(b.next());
            if (c != 0) return c;
        }
        return 0;
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
