package org.coursesched.data;

import lombok.Getter;

import java.util.List;

@Getter
public final class Requirement {
    private final String name;
    private final List<RequirementGroup> groups;

    public Requirement(String name, List<RequirementGroup> groups) {
        this.name = name;
        this.groups = List.copyOf(groups);
    }

    public boolean isSatisfiable() {
        return !groups.isEmpty();
    }

    @Override
    public String toString() {
        return "Requirement(" + name + ", groups=" + groups + ")";
    }
}
