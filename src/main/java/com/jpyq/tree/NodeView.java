package com.jpyq.tree;

import com.jpyq.ast.PyNode;
import com.jpyq.ast.PyNode.Stmt;
import com.jpyq.ast.PyNode.WithBody;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * How a handle is indexed, decided once when the handle is built.
 */
sealed interface NodeView {

    record SequenceView(ImmutableList<PyNode> elements) implements NodeView {}

    record BodyView(ImmutableList<Stmt> body) implements NodeView {}

    record NoView() implements NodeView {}

    static NodeView of(Contents contents) {
        if (contents instanceof Contents.Sequence sequence) {
            return new SequenceView(sequence.nodes());
        }
        if (contents instanceof Contents.Single single && single.node() instanceof WithBody withBody) {
            return new BodyView(withBody.body());
        }
        return new NoView();
    }
}
