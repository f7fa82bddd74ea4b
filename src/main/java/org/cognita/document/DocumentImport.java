package org.cognita.document;

/**
 * One entry of a document's {@code imports} section.
 *
 * @param file The model store reference of the imported document.
 * @param alias The prefix under which the imported flows, goals and actions are visible.
 */
public record DocumentImport(String file, String alias) {
}
