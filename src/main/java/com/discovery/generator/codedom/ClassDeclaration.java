package com.discovery.generator.codedom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The class being generated.
 *
 * Unlike the other nodes this one is mutable: decorators append members to it
 * in sequence. Members are never removed or reordered.
 */
@Data
@NoArgsConstructor
public class ClassDeclaration implements CodeNode {
    private String name;
    private String packageName;
    private AccessModifier access = AccessModifier.PUBLIC;
    private String javadoc;
    @Setter(AccessLevel.NONE)
    private List<TypeMember> members = new ArrayList<>();

    @Builder
    public ClassDeclaration(String name, String packageName, AccessModifier access,
                            String javadoc, List<TypeMember> members) {
        this.name = name;
        this.packageName = packageName;
        this.access = access != null ? access : AccessModifier.PUBLIC;
        this.javadoc = javadoc;
        this.members = members != null ? new ArrayList<>(members) : new ArrayList<>();
    }

    public void addMember(TypeMember member) {
        members.add(member);
    }

    /**
     * Read-only view of the members in insertion order; use {@link #addMember} to append.
     */
    public List<TypeMember> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public String getQualifiedName() {
        if (packageName == null || packageName.isEmpty()) {
            return name;
        }
        return packageName + "." + name;
    }

    @Override
    public void accept(CodeNodeVisitor visitor) {
        visitor.visit(this);
    }
}
