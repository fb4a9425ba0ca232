package com.jpyq.tree;

import com.jpyq.ast.PyNode;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * What a {@link Node} wraps: nothing, one syntax node, or an ordered sequence of them.
 */
sealed interface Contents {
    record Empty() implements Contents {}
    record Single(PyNode node) implements Contents {}
    record Sequence(ImmutableList<PyNode> nodes) implements Contents {}
}
