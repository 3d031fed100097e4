package dev.screener.model;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Alphabetically sorted, deduplicated skills extracted from one document.
 */
public final class ExtractedSkillSet implements Iterable<String> {

    private static final ExtractedSkillSet EMPTY = new ExtractedSkillSet(List.of());

    private final List<String> skills;

    private ExtractedSkillSet(List<String> skills) {
        this.skills = skills;
    }

    public static ExtractedSkillSet of(Collection<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return EMPTY;
        }
        Set<String> sorted = new TreeSet<>();
        for (String skill : skills) {
            if (skill != null && !skill.isBlank()) {
                sorted.add(skill);
            }
        }
        return sorted.isEmpty() ? EMPTY : new ExtractedSkillSet(List.copyOf(sorted));
    }

    public static ExtractedSkillSet of(String... skills) {
        return of(List.of(skills));
    }

    public static ExtractedSkillSet empty() {
        return EMPTY;
    }

    public List<String> asList() {
        return skills;
    }

    public Set<String> asSet() {
        return Set.copyOf(skills);
    }

    public boolean contains(String skill) {
        return skills.contains(skill);
    }

    public int size() {
        return skills.size();
    }

    public boolean isEmpty() {
        return skills.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return skills.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return skills.equals(((ExtractedSkillSet) o).skills);
    }

    @Override
    public int hashCode() {
        return Objects.hash(skills);
    }

    @Override
    public String toString() {
        return skills.toString();
    }
}
