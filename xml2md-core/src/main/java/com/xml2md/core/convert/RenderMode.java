package com.xml2md.core.convert;

/**
 * Rendering context that decides how a handler formats its node.
 *
 * <p>Traversal starts in {@link #TOP}. The document title moves it to {@link #HEADER}, the
 * docinfo block to {@link #BODY}; sections, lists, notes and footnotes switch it for their
 * own subtree only.
 */
public enum RenderMode {
    /** Before the document title */
    TOP,

    /** After the title, before the docinfo block */
    HEADER,

    /** Document body outside any section */
    BODY,

    /** Directly inside a bullet list, between items */
    BULLET_LIST,

    /** Inside a bullet list item */
    BULLET_LIST_ITEM,

    /** Inside a section; depth counts the enclosing sections */
    SECTION,

    /** Inside a note admonition */
    NOTE,

    /** Inside a footnote that belongs to a section */
    FOOTNOTE
}
