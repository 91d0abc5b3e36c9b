package com.xml2md.core.convert;

import com.xml2md.core.convert.handler.Handlers;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Drives the recursive descent over a document tree.
 *
 * <p>For every node the dispatcher resolves the element name to a {@link NodeKind}, runs the
 * kind's {@link NodeHandler}, and, when the handler answers
 * {@link HandlerResult.ContinueInto}, dispatches the returned children with the state the
 * handler chose.
 *
 * <p><b>Unknown kinds:</b> an element name outside {@link NodeKind} is the only error the
 * traversal models. It is handled here and nowhere else: one
 * {@link DiagnosticType#UNKNOWN_NODE_KIND} diagnostic is recorded and logged, nothing is
 * written for the node or its subtree, and traversal carries on with the next sibling.
 *
 * <p>A dispatcher collects the report of a single conversion; create one per conversion.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ConversionReport.Builder report = new ConversionReport.Builder();

    /**
     * Dispatches one node.
     *
     * @param state state for the node
     * @param node node to dispatch
     * @param context conversion context
     * @return state for the node's later siblings
     */
    public RenderState dispatch(RenderState state, DocNode node, ConversionContext context) {
        report.incrementNodesDispatched();

        Optional<NodeKind> kind = NodeKind.lookup(node.kind());
        if (kind.isEmpty()) {
            report(Diagnostic.unknownKind(node.kind(), state.mode()));
            return state;
        }

        log.debug("Dispatching <{}> in {} (depth {})", node.kind(), state.mode(), state.depth());
        report.recordHandled(kind.get());

        HandlerResult result = Handlers.forKind(kind.get()).handle(state, node, context);
        if (result instanceof HandlerResult.ContinueInto continueInto) {
            dispatchAll(continueInto.state(), continueInto.children(), context);
            return state;
        }
        if (result instanceof HandlerResult.Handled handled) {
            return handled.state();
        }
        throw new IllegalStateException("Unsupported handler result for <" + node.kind() + ">: " + result);
    }

    /**
     * Dispatches nodes in order, threading each node's resulting state to the next.
     *
     * @param state state for the first node
     * @param nodes nodes to dispatch
     * @param context conversion context
     * @return state after the last node
     */
    public RenderState dispatchAll(RenderState state, List<DocNode> nodes, ConversionContext context) {
        RenderState current = state;
        for (DocNode node : nodes) {
            current = dispatch(current, node, context);
        }
        return current;
    }

    /**
     * Records a diagnostic and logs it.
     *
     * @param diagnostic diagnostic to record
     */
    public void report(Diagnostic diagnostic) {
        log.warn("{}", diagnostic.message());
        report.addDiagnostic(diagnostic);
    }

    /**
     * Returns the report collected so far.
     *
     * @return conversion report
     */
    public ConversionReport report() {
        return report.build();
    }
}
