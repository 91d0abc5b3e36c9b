package com.xml2md.core.convert;

import com.xml2md.core.model.DocNode;

import java.util.List;
import java.util.Objects;

/**
 * What a handler tells the dispatcher after it ran.
 *
 * <ul>
 *   <li>{@link ContinueInto} - the dispatcher descends into the given children with the given
 *       state; the handler did not touch them itself.</li>
 *   <li>{@link Handled} - the node is finished, including any children the handler chose to
 *       render; the state is what the node's later siblings see.</li>
 * </ul>
 */
public interface HandlerResult {

    /**
     * Asks the dispatcher to descend into the children.
     *
     * @param children children to dispatch, in order
     * @param state state to dispatch them with
     * @return continue result
     */
    static HandlerResult continueInto(List<DocNode> children, RenderState state) {
        return new ContinueInto(children, state);
    }

    /**
     * Marks the node as finished.
     *
     * @param state state for the node's later siblings
     * @return handled result
     */
    static HandlerResult handled(RenderState state) {
        return new Handled(state);
    }

    /**
     * Descend into these children.
     *
     * @param children children to dispatch
     * @param state state for the children
     */
    record ContinueInto(List<DocNode> children, RenderState state) implements HandlerResult {
        public ContinueInto {
            Objects.requireNonNull(state, "state must not be null");
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    /**
     * Fully handled.
     *
     * @param state state for later siblings
     */
    record Handled(RenderState state) implements HandlerResult {
        public Handled {
            Objects.requireNonNull(state, "state must not be null");
        }
    }
}
