package creational.factory.document;

public class ExcelDocumentFactory implements DocumentFactory {

    @Override
    public Document createDocument() {
        return new ExcelDocument();
    }
}
