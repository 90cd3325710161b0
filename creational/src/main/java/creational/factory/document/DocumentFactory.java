package creational.factory.document;

/**
 * Creator declaring the factory method for {@link Document}s.
 *
 * <p>Clients receive a factory and never name a concrete document class, so adding a new
 * format means adding a document and a factory, with no change to client code.
 */
public interface DocumentFactory {

    /**
     * Creates a new document.
     *
     * @return a new document, never null
     */
    Document createDocument();
}
