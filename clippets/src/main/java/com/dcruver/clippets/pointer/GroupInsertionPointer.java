package com.dcruver.clippets.pointer;

import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.Elements;
import com.dcruver.clippets.domain.Group;
import com.dcruver.clippets.domain.TreeWalker;

import java.util.Optional;

/**
 * Where to insert a group within the tree. Positions are relative to other
 * groups at any depth, except the moved group's own sub-groups and groups
 * whose parent already has a sub-group of the same name.
 */
public class GroupInsertionPointer extends InsertionPointer<Group> {

    public GroupInsertionPointer(Group group) {
        super(group);
    }

    @Override
    protected Optional<Element> neighbour(Element element, boolean backwards) {
        return TreeWalker.neighbour(element, backwards, false, Elements::isGroup);
    }

    @Override
    protected boolean isAllowed(Element candidate) {
        Group group = (Group) candidate;
        if (group == source || group.getParents().contains(source)) {
            return false;
        }
        Group target = group.getParent();
        return target == source.getParent() || target.getGroup(source.getName()) == null;
    }

    @Override
    protected void commit() {
        Group from = source.getParent();
        Group target = (Group) reference;
        Group to = target.getParent();

        from.removeGroup(source);
        if (after) {
            to.addGroupAsGroup(source, target, null);
        } else {
            to.addGroupAsGroup(source, null, target);
        }
        from.clean();
        to.clean();
    }
}
