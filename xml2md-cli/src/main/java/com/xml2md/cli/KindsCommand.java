package com.xml2md.cli;

import com.xml2md.core.convert.handler.Handlers;
import com.xml2md.core.model.NodeKind;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Command to list the node kinds the converter renders.
 *
 * <p>Any element name not listed here is reported as an unknown kind and skipped along
 * with its subtree.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * xml2md kinds
 * }</pre>
 */
@Command(
    name = "kinds",
    description = "List the supported docutils node kinds",
    mixinStandardHelpOptions = true
)
public class KindsCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Supported Node Kinds:");
        System.out.println();

        for (NodeKind kind : NodeKind.values()) {
            System.out.printf("  • %s (%s)%n",
                kind.elementName(), Handlers.forKind(kind).getClass().getSimpleName());
        }

        System.out.println();
        System.out.printf("  %d kinds%n", NodeKind.values().length);
        return 0;
    }
}
