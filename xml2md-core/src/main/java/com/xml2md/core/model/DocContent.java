package com.xml2md.core.model;

/**
 * One entry in the ordered content of a {@link DocNode}: either a {@link TextNode}
 * or a nested {@link DocNode} element.
 *
 * @see DocNode#content()
 */
public interface DocContent {
}
