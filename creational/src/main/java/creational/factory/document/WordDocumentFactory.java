package creational.factory.document;

public class WordDocumentFactory implements DocumentFactory {

    @Override
    public Document createDocument() {
        return new WordDocument();
    }
}
