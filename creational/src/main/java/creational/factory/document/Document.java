package creational.factory.document;

/**
 * Product created by a {@link DocumentFactory}.
 */
public interface Document {

    /**
     * Exports the document and describes what was exported.
     */
    String export();
}
